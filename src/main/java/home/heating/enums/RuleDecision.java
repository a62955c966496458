package home.heating.enums;

public enum RuleDecision {
    TURN_ON("включить"),

    TURN_OFF("выключить"),

    NO_CHANGE("оставить как есть");

    private final String template;

    RuleDecision(String template) {
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
