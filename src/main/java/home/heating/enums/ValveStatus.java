package home.heating.enums;

public enum ValveStatus {
    IDLE("клапан в покое", 0),

    TRANSITIONING("клапан переключается, ждем возврата пружины", 1);

    private final String template;

    private final Integer numericStatus;

    ValveStatus(String template, Integer numericStatus) {
        this.template = template;
        this.numericStatus = numericStatus;
    }

    public String getTemplate() {
        return template;
    }

    public Integer getNumericStatus() {
        return numericStatus;
    }
}
