package home.heating.rule;

import home.heating.configuration.RuleConfiguration;
import home.heating.enums.PinState;
import home.heating.enums.RuleDecision;
import home.heating.enums.RuleType;
import home.heating.model.Pin;
import home.heating.model.PinRequest;
import home.heating.model.Thermostat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Отопление: узкий гистерезис и защита от замерзания, которую отключает только прямой запрос OFF
 */
@Component
public class CentralHeatingRule extends AbstractThermostatRule {
    private static final Logger logger = LoggerFactory.getLogger(CentralHeatingRule.class);
    private final RuleConfiguration configuration;

    public CentralHeatingRule(RuleConfiguration configuration) {
        this.configuration = configuration;
    }

    @Override
    public RuleType getType() {
        return RuleType.CENTRAL_HEATING;
    }

    @Override
    protected float getHysteresis() {
        return configuration.getCentralHeatingHysteresis();
    }

    @Override
    public RuleDecision evaluate(Thermostat thermostat, Pin pin) {
        Float temperature = thermostat.getTemperature();
        if (temperature != null && temperature < configuration.getFrostProtection()) {
            PinRequest request = pin.getActiveRequest();
            if (request == null || request.getState() != PinState.OFF) {
                logger.warn("{}: температура {} ниже порога защиты от замерзания {}, включаем",
                    thermostat.getName(), temperature, configuration.getFrostProtection());
                return RuleDecision.TURN_ON;
            }
        }
        return super.evaluate(thermostat, pin);
    }
}
