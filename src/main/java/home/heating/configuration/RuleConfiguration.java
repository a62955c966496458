package home.heating.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RuleConfiguration {
    @Value("${rules.centralHeating.hysteresis:1}")
    private Float centralHeatingHysteresis;

    @Value("${rules.centralHeating.frostProtection:5}")
    private Float frostProtection;

    @Value("${rules.hotWater.hysteresis:5}")
    private Float hotWaterHysteresis;

    public Float getCentralHeatingHysteresis() {
        return centralHeatingHysteresis;
    }

    public Float getFrostProtection() {
        return frostProtection;
    }

    public Float getHotWaterHysteresis() {
        return hotWaterHysteresis;
    }
}
