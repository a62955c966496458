package home.heating.service.impl;

import home.heating.exception.ActuatorException;
import home.heating.service.RelayService;
import home.heating.service.TemperatureSensorsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Симуляция датчиков: пока реле канала включено, температура растет, иначе остывает
 */
@Service
@Profile("simulation")
public class SimulatedTemperatureSensorsServiceImpl implements TemperatureSensorsService {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedTemperatureSensorsServiceImpl.class);
    private static final float INITIAL_TEMPERATURE = 15F;
    private static final float HEATING_STEP = 0.5F;
    private static final float COOLING_STEP = 0.1F;
    private static final float AMBIENT_TEMPERATURE = 10F;
    private static final float MAX_TEMPERATURE = 70F;
    private final Map<String, Float> temperatures = new ConcurrentHashMap<>();
    private final RelayService relayService;

    public SimulatedTemperatureSensorsServiceImpl(RelayService relayService) {
        this.relayService = relayService;
    }

    @Override
    public Float getCurrentTemperature(String thermostat) {
        boolean heating;
        try {
            heating = relayService.readState(thermostat);
        } catch (ActuatorException e) {
            logger.warn("Симуляция: нет реле для {}, считаем что канал остывает", thermostat);
            heating = false;
        }
        boolean isHeating = heating;
        return temperatures.compute(thermostat, (name, current) -> {
            float temperature = current == null ? INITIAL_TEMPERATURE : current;
            if (isHeating) {
                return Math.min(MAX_TEMPERATURE, temperature + HEATING_STEP);
            }
            return Math.max(AMBIENT_TEMPERATURE, temperature - COOLING_STEP);
        });
    }
}
