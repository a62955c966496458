package home.heating.event.info;

import org.springframework.context.ApplicationEvent;

import java.time.Instant;

public class PinStateChangedEvent extends ApplicationEvent {
    String pin;

    boolean on;

    Instant ts;

    public PinStateChangedEvent(Object source, String pin, boolean on, Instant ts) {
        super(source);
        this.pin = pin;
        this.on = on;
        this.ts = ts;
    }

    public String getPin() {
        return pin;
    }

    public boolean isOn() {
        return on;
    }

    public Instant getTs() {
        return ts;
    }
}
