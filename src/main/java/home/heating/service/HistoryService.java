package home.heating.service;

import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.List;

public interface HistoryService {
    /**
     * Добавление температуры в историю
     *
     * @param thermostat  термостат
     * @param temperature значение
     * @param ts          время
     */
    void putTemperature(String thermostat, Float temperature, Instant ts);

    /**
     * Добавление состояния пина в историю
     *
     * @param pin пин
     * @param on  состояние
     * @param ts  время
     */
    void putPinState(String pin, boolean on, Instant ts);

    /**
     * @return температуры термостата начиная с since, по возрастанию времени
     */
    List<Pair<Instant, Float>> getTemperatureHistory(String thermostat, Instant since);

    /**
     * @return переключения пина начиная с since, по возрастанию времени
     */
    List<Pair<Instant, Boolean>> getPinHistory(String pin, Instant since);

    /**
     * Доля времени, которую пин был включен за последние сутки
     *
     * @param pin пин
     * @return проценты или null если сведений нет
     */
    @Nullable
    Float getPinWorkPercentForLastDay(String pin);

    /**
     * Получение аналитики по работе пинов за прошедшие сутки
     *
     * @return сообщение для бота
     */
    String getFormattedStatusForLastDay();
}
