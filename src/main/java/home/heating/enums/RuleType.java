package home.heating.enums;

public enum RuleType {
    CENTRAL_HEATING("правило отопления"),

    HOT_WATER("правило горячей воды");

    private final String template;

    RuleType(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
