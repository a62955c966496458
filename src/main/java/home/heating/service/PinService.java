package home.heating.service;

import home.heating.model.Pin;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

public interface PinService {
    /**
     * Получение пина по имени
     *
     * @param name имя пина (CH, HW)
     * @return пин
     * @throws home.heating.exception.RequestException если такого пина нет
     */
    Pin getPin(String name);

    @Nullable
    Pin findPin(String name);

    Collection<Pin> getPins();

    /**
     * Получение форматированной строки с состоянием реле для бота
     *
     * @return строка с информацией
     */
    String getFormattedStatus();
}
