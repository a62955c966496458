package home.heating.service;

import home.heating.model.PinStatus;
import home.heating.model.ThermostatStatus;

import java.util.List;

public interface ControllerService {
    /**
     * Запуск цикла правил
     */
    void start();

    /**
     * Остановка цикла правил. Уже начатое переключение клапана не прерывается.
     */
    void stop();

    boolean isRunning();

    /**
     * Один такт: чистка запросов, расчет правил, перевзвод таймера если цикл запущен
     */
    void pollRules();

    /**
     * Запрос целевой температуры от источника
     *
     * @param service имя термостата или ALL
     * @param source  источник запроса, у источника не больше одного запроса на термостат
     * @param target  температура, OFF или "BOOST n"
     * @param until   время окончания (ISO-8601 или секунды epoch), boost, или now для отмены запроса
     * @throws home.heating.exception.RequestException если запрос не удалось разобрать
     */
    void addRequest(String service, String source, String target, String until);

    /**
     * Прямой запрос состояния пина
     *
     * @param pin    имя пина
     * @param source источник запроса
     * @param state  on, off, boost или 1, 0, 2
     * @param until  время окончания, для boost не нужно, now для отмены запроса
     * @throws home.heating.exception.RequestException если запрос не удалось разобрать
     */
    void addPinRequest(String pin, String source, String state, String until);

    List<ThermostatStatus> getThermostatStatuses();

    List<PinStatus> getPinStatuses();

    /**
     * Получение форматированной строки со статусом для бота
     *
     * @return строка с информацией
     */
    String getFormattedStatus();
}
