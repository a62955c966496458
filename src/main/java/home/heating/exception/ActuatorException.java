package home.heating.exception;

/**
 * Ошибка чтения или записи физического состояния реле (пина)
 */
public class ActuatorException extends Exception {
    private final String pin;

    public ActuatorException(String pin, String message) {
        super(message);
        this.pin = pin;
    }

    public ActuatorException(String pin, String message, Throwable cause) {
        super(message, cause);
        this.pin = pin;
    }

    public String getPin() {
        return pin;
    }
}
