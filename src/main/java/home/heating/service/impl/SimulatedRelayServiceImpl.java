package home.heating.service.impl;

import home.heating.service.RelayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Реле без железа, для отладки на столе и тестов
 */
@Service
@Profile("simulation")
public class SimulatedRelayServiceImpl implements RelayService {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedRelayServiceImpl.class);
    private final Map<String, Boolean> states = new ConcurrentHashMap<>();

    @Override
    public boolean readState(String pin) {
        return states.getOrDefault(pin, false);
    }

    @Override
    public void writeState(String pin, boolean on) {
        logger.debug("Симуляция: {} = {}", pin, on ? "ON" : "OFF");
        states.put(pin, on);
    }
}
