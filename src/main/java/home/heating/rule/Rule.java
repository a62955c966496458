package home.heating.rule;

import home.heating.enums.RuleDecision;
import home.heating.enums.RuleType;
import home.heating.model.Pin;
import home.heating.model.Thermostat;

/**
 * Правило канала: по термостату и запросам пина решает, нужно ли включать канал
 */
public interface Rule {
    RuleType getType();

    /**
     * @param thermostat термостат канала
     * @param pin        пин канала
     * @return решение по каналу
     */
    RuleDecision evaluate(Thermostat thermostat, Pin pin);
}
