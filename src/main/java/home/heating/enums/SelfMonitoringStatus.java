package home.heating.enums;

public enum SelfMonitoringStatus {
    OK("все хорошо", 0),

    MINOR_PROBLEMS("есть проблемы с датчиками температуры", 1),

    EMERGENCY("аварийная ситуация с реле или правилами!", 2);

    private final String template;

    private final Integer numericStatus;

    SelfMonitoringStatus(String template, Integer numericStatus) {
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
