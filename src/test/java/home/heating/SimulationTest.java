package home.heating;

import home.heating.service.impl.SimulatedRelayServiceImpl;
import home.heating.service.impl.SimulatedTemperatureSensorsServiceImpl;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SimulationTest {
    @Test
    @DisplayName("Симуляция: канал греется при включенном реле и остывает при выключенном")
    void checkSimulatedTemperature() {
        SimulatedRelayServiceImpl relayService = new SimulatedRelayServiceImpl();
        SimulatedTemperatureSensorsServiceImpl sensors = new SimulatedTemperatureSensorsServiceImpl(relayService);

        assertFalse(relayService.readState("HW"));
        float initial = sensors.getCurrentTemperature("HW");

        relayService.writeState("HW", true);
        assertTrue(relayService.readState("HW"));
        float heated = sensors.getCurrentTemperature("HW");
        assertTrue(heated > initial);

        relayService.writeState("HW", false);
        float cooled = sensors.getCurrentTemperature("HW");
        assertTrue(cooled < heated);

        for (int i = 0; i < 1000; i++) {
            sensors.getCurrentTemperature("HW");
        }
        assertEquals(10f, sensors.getCurrentTemperature("HW"));
    }
}
