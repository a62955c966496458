package home.heating.exception;

public class ModbusException extends Exception {
    public ModbusException() {
        super();
    }

    public ModbusException(String message) {
        super(message);
    }
}
