package home.heating.service;

import home.heating.model.Thermostat;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;

public interface ThermostatService {
    /**
     * Получение термостата по имени канала
     *
     * @param name имя термостата (CH, HW)
     * @return термостат
     * @throws home.heating.exception.RequestException если такого термостата нет
     */
    Thermostat getThermostat(String name);

    @Nullable
    Thermostat findThermostat(String name);

    /**
     * @return все термостаты в порядке конфигурации
     */
    Collection<Thermostat> getThermostats();

    /**
     * Опрос датчиков всех термостатов
     */
    void pollTemperatures();

    /**
     * Получение форматированной строки с температурами и целями для бота
     *
     * @return строка с информацией
     */
    String getCurrentTemperaturesFormatted();
}
