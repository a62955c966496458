package home.heating;

import home.heating.configuration.HeatingConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
@EnableConfigurationProperties(HeatingConfiguration.class)
public class HomeHeating {
    public static void main(String[] args) {
        SpringApplication.run(HomeHeating.class, args);
    }
}
