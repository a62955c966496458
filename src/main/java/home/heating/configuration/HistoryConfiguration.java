package home.heating.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class HistoryConfiguration {
    /* сколько часов храним историю температур и состояний пинов */
    @Value("${history.retentionHours:24}")
    private Integer retentionHours;

    public Integer getRetentionHours() {
        return retentionHours;
    }
}
