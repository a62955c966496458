package home.heating.exception;

/**
 * Некорректная конфигурация, приложение не должно стартовать
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
