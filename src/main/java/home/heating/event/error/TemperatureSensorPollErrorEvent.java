package home.heating.event.error;

import org.springframework.context.ApplicationEvent;

public class TemperatureSensorPollErrorEvent extends ApplicationEvent {
    String thermostat;

    public TemperatureSensorPollErrorEvent(Object source, String thermostat) {
        super(source);
        this.thermostat = thermostat;
    }

    public String getThermostat() {
        return thermostat;
    }
}
