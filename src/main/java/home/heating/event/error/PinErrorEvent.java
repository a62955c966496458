package home.heating.event.error;

import org.springframework.context.ApplicationEvent;

public class PinErrorEvent extends ApplicationEvent {
    String pin;

    String message;

    public PinErrorEvent(Object source, String pin, String message) {
        super(source);
        this.pin = pin;
        this.message = message;
    }

    public String getPin() {
        return pin;
    }

    public String getMessage() {
        return message;
    }
}
