package home.heating.rule;

import home.heating.enums.PinState;
import home.heating.enums.RuleDecision;
import home.heating.model.Pin;
import home.heating.model.PinRequest;
import home.heating.model.Thermostat;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Общая часть правил: прямые запросы пина, затем сравнение температуры с целью с гистерезисом
 */
public abstract class AbstractThermostatRule implements Rule {
    private static final Logger logger = LoggerFactory.getLogger(AbstractThermostatRule.class);

    protected abstract float getHysteresis();

    @Override
    public RuleDecision evaluate(Thermostat thermostat, Pin pin) {
        Float temperature = thermostat.getTemperature();
        RuleDecision pinDecision = evaluatePinRequest(thermostat, pin, temperature);
        if (pinDecision != null) {
            return pinDecision;
        }
        if (temperature == null) {
            logger.warn("{}: температура неизвестна, выключаем", thermostat.getName());
            return RuleDecision.TURN_OFF;
        }
        return evaluateTemperature(thermostat, temperature);
    }

    protected RuleDecision evaluateTemperature(Thermostat thermostat, float temperature) {
        float target = thermostat.getTargetTemperature();
        if (temperature > target) {
            logger.debug("{}: {} выше цели {}", thermostat.getName(), temperature, target);
            return RuleDecision.TURN_OFF;
        }
        if (temperature < target - getHysteresis()) {
            logger.debug("{}: {} ниже цели {} с учетом гистерезиса", thermostat.getName(), temperature, target);
            return RuleDecision.TURN_ON;
        }
        return RuleDecision.NO_CHANGE;
    }

    /**
     * Решение по прямому запросу пина, null если прямого запроса нет или boost выполнен
     */
    protected @Nullable RuleDecision evaluatePinRequest(Thermostat thermostat, Pin pin, @Nullable Float temperature) {
        PinRequest request = pin.getActiveRequest();
        if (request == null) {
            return null;
        }
        if (request.getState() == PinState.OFF) {
            return RuleDecision.TURN_OFF;
        }
        if (request.getState() == PinState.ON) {
            return RuleDecision.TURN_ON;
        }
        float maximum = thermostat.getMaximumTemperature();
        if (temperature == null || temperature < maximum) {
            return RuleDecision.TURN_ON;
        }
        logger.info("{}: boost пина выполнен, температура {} достигла {}", pin.getName(), temperature, maximum);
        pin.purgeRequests(PinState.BOOST, request.getSource());
        return null;
    }
}
