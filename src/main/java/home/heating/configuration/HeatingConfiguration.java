package home.heating.configuration;

import home.heating.enums.RuleType;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Описание каналов системы: термостаты с таймлайнами, пины (реле) и правила, которые их связывают.
 * Имена каналов (CH, HW) в yaml указываются в квадратных скобках, чтобы сохранить регистр.
 */
@ConfigurationProperties("heating")
public class HeatingConfiguration {
    private Map<String, ThermostatProperties> thermostats = new LinkedHashMap<>();

    private Map<String, PinProperties> pins = new LinkedHashMap<>();

    private Map<String, RuleType> rules = new LinkedHashMap<>();

    public Map<String, ThermostatProperties> getThermostats() {
        return thermostats;
    }

    public void setThermostats(Map<String, ThermostatProperties> thermostats) {
        this.thermostats = thermostats;
    }

    public Map<String, PinProperties> getPins() {
        return pins;
    }

    public void setPins(Map<String, PinProperties> pins) {
        this.pins = pins;
    }

    public Map<String, RuleType> getRules() {
        return rules;
    }

    public void setRules(Map<String, RuleType> rules) {
        this.rules = rules;
    }

    public static class ThermostatProperties {
        /* modbus адрес платы температурных датчиков */
        private Integer address;

        /* регистр датчика на плате */
        private Integer register;

        private TimelineProperties timeline = new TimelineProperties();

        public Integer getAddress() {
            return address;
        }

        public void setAddress(Integer address) {
            this.address = address;
        }

        public Integer getRegister() {
            return register;
        }

        public void setRegister(Integer register) {
            this.register = register;
        }

        public TimelineProperties getTimeline() {
            return timeline;
        }

        public void setTimeline(TimelineProperties timeline) {
            this.timeline = timeline;
        }
    }

    public static class TimelineProperties {
        private Float min = 0F;

        private Float max;

        /* период повторения таймлайна в миллисекундах, по умолчанию сутки */
        private Long period = 86_400_000L;

        private List<TimelinePointProperties> points = new ArrayList<>();

        public Float getMin() {
            return min;
        }

        public void setMin(Float min) {
            this.min = min;
        }

        public Float getMax() {
            return max;
        }

        public void setMax(Float max) {
            this.max = max;
        }

        public Long getPeriod() {
            return period;
        }

        public void setPeriod(Long period) {
            this.period = period;
        }

        public List<TimelinePointProperties> getPoints() {
            return points;
        }

        public void setPoints(List<TimelinePointProperties> points) {
            this.points = points;
        }
    }

    public static class TimelinePointProperties {
        /* время суток в формате HH:mm[:ss[.SSS]] */
        private String time;

        private Float value;

        public String getTime() {
            return time;
        }

        public void setTime(String time) {
            this.time = time;
        }

        public Float getValue() {
            return value;
        }

        public void setValue(Float value) {
            this.value = value;
        }
    }

    public static class PinProperties {
        /* modbus адрес релейного модуля */
        private Integer address;

        private Integer coil;

        /* реле подключено через нормально замкнутый контакт */
        private boolean inverted;

        public Integer getAddress() {
            return address;
        }

        public void setAddress(Integer address) {
            this.address = address;
        }

        public Integer getCoil() {
            return coil;
        }

        public void setCoil(Integer coil) {
            this.coil = coil;
        }

        public boolean isInverted() {
            return inverted;
        }

        public void setInverted(boolean inverted) {
            this.inverted = inverted;
        }
    }
}
