package home.heating.service.impl;

import home.heating.configuration.HeatingConfiguration;
import home.heating.configuration.HeatingConfiguration.ThermostatProperties;
import home.heating.event.error.TemperatureSensorPollErrorEvent;
import home.heating.exception.ModbusException;
import home.heating.service.ModbusService;
import home.heating.service.TemperatureSensorsService;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheConfig;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

/**
 * Датчики DS18B20 на плате R4DCB08
 */
@Service
@Profile("!simulation")
@CacheConfig(cacheNames = {"temperature_sensors_cache"})
public class TemperatureSensorsServiceImpl implements TemperatureSensorsService {
    public static final Integer TEMPERATURE_SENSOR_ERROR_VALUE = 32768;
    private static final Logger logger = LoggerFactory.getLogger(TemperatureSensorsServiceImpl.class);
    private final ApplicationEventPublisher applicationEventPublisher;
    private final HeatingConfiguration configuration;
    private final ModbusService modbusService;

    public TemperatureSensorsServiceImpl(
        ApplicationEventPublisher applicationEventPublisher,
        HeatingConfiguration configuration,
        ModbusService modbusService
    ) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.configuration = configuration;
        this.modbusService = modbusService;
    }

    @Override
    @Cacheable(unless = "#result == null")
    public @Nullable Float getCurrentTemperature(String thermostat) {
        ThermostatProperties properties = configuration.getThermostats().get(thermostat);
        if (properties == null || properties.getAddress() == null || properties.getRegister() == null) {
            logger.error("Для термостата {} не настроен датчик", thermostat);
            applicationEventPublisher.publishEvent(new TemperatureSensorPollErrorEvent(this, thermostat));
            return null;
        }
        try {
            int rawTemperature = modbusService.readHoldingRegister(properties.getAddress(), properties.getRegister());
            if (rawTemperature == TEMPERATURE_SENSOR_ERROR_VALUE) {
                throw new ModbusException(
                    "Ошибка опроса - температурный сенсор DS18B20 не подключен, регистр " + properties.getRegister());
            }
            /* такая логика работы R4DCB08, отрицательные значения в дополнительном коде */
            if (rawTemperature >= 0xFF00) {
                rawTemperature = rawTemperature - 0x10000;
            }
            return (float) rawTemperature / 10;
        } catch (ModbusException e) {
            logger.error("{} - ошибка опроса датчика, регистр {}: {}", thermostat, properties.getRegister(),
                e.getMessage());
            logger.debug("Отправляем событие об ошибке поллинга датчика {}", thermostat);
            applicationEventPublisher.publishEvent(new TemperatureSensorPollErrorEvent(this, thermostat));
            return null;
        }
    }
}
