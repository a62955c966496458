package home.heating.exception;

/**
 * Некорректный запрос от внешнего источника (бот, календарь, консоль)
 */
public class RequestException extends RuntimeException {
    public RequestException(String message) {
        super(message);
    }

    public RequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
