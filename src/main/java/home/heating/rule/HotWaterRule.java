package home.heating.rule;

import home.heating.configuration.RuleConfiguration;
import home.heating.enums.RuleType;
import org.springframework.stereotype.Component;

/**
 * Горячая вода: широкий гистерезис, чтобы бойлер не дергался
 */
@Component
public class HotWaterRule extends AbstractThermostatRule {
    private final RuleConfiguration configuration;

    public HotWaterRule(RuleConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public RuleType getType() {
        return RuleType.HOT_WATER;
    }

    @Override
    protected float getHysteresis() {
        return configuration.getHotWaterHysteresis();
    }
}
