package home.heating.enums;

public enum BotCommands {
    GET_STATUS("/get_status"),

    REQUEST("/request"),

    PIN("/pin");

    private final String telegramCommand;

    BotCommands(String telegramCommand) {
        this.telegramCommand = telegramCommand;
    }

    public String getTelegramCommand() {
        return telegramCommand;
    }
}
