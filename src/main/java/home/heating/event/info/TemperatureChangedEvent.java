package home.heating.event.info;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;

public class TemperatureChangedEvent extends ApplicationEvent {
    String thermostat;

    Float temperature;

    Instant ts;

    public TemperatureChangedEvent(Object source, String thermostat, Float temperature, Instant ts) {
        super(source);
        this.thermostat = thermostat;
        this.temperature = temperature;
        this.ts = ts;
    }

    public String getThermostat() {
        return thermostat;
    }

    public Float getTemperature() {
        return temperature;
    }

    public Instant getTs() {
        return ts;
    }
}
