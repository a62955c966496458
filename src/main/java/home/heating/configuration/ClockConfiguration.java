package home.heating.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfiguration {
    /* таймлайны считаются по локальному времени дома */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
