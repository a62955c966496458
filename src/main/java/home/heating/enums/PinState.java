package home.heating.enums;

import home.heating.exception.RequestException;

public enum PinState {
    OFF("выключен", 0),

    ON("включен", 1),

    BOOST("включен до достижения максимальной температуры", 2);

    private final String template;

    private final Integer numericStatus;

    PinState(String template, Integer numericStatus) {
        this.template = template;
        this.numericStatus = numericStatus;
    }

    public String getTemplate() {
        return template;
    }

    public Integer getNumericStatus() {
        return numericStatus;
    }

    /**
     * Разбор состояния из запроса: on/off/boost или 1/0/2
     *
     * @param value строка запроса
     * @return состояние пина
     */
    public static PinState parse(String value) {
        if (value == null) {
            throw new RequestException("Не указано состояние пина");
        }
        String trimmed = value.trim();
        for (PinState state : values()) {
            if (state.name().equalsIgnoreCase(trimmed) || state.numericStatus.toString().equals(trimmed)) {
                return state;
            }
        }
        throw new RequestException("Неизвестное состояние пина '" + value + "'");
    }
}
