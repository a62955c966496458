package home.heating.service;

public interface BotService {
    /**
     * Отправка сообщения во все чаты
     *
     * @param text текст сообщения
     */
    void notify(String text);
}
