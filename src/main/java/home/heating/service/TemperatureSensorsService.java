package home.heating.service;

import org.jetbrains.annotations.Nullable;

public interface TemperatureSensorsService {
    /**
     * Возвращает температуру в градусах по датчику термостата
     * Если произошла ошибка опроса - возвращает null
     *
     * @param thermostat имя термостата
     * @return температура с плавающей точкой
     */
    @Nullable
    Float getCurrentTemperature(String thermostat);
}
