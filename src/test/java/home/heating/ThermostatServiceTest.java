package home.heating;

import home.heating.event.info.TemperatureChangedEvent;
import home.heating.exception.RequestException;
import home.heating.service.ThermostatService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.event.ApplicationEvents;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DirtiesContext(classMode = ClassMode.AFTER_EACH_TEST_METHOD)
public class ThermostatServiceTest extends AbstractTest {
    @Autowired
    ThermostatService thermostatService;

    @Autowired
    private ApplicationEvents applicationEvents;

    @Test
    @DisplayName("Термостаты создаются из конфигурации")
    void checkThermostatsFromConfiguration() {
        assertEquals(2, thermostatService.getThermostats().size());
        assertEquals(25f, thermostatService.getThermostat("CH").getTimeline().getMax());
        assertEquals(50f, thermostatService.getThermostat("HW").getTimeline().getMax());
        assertNull(thermostatService.findThermostat("POOL"));
        assertThrows(RequestException.class, () -> thermostatService.getThermostat("POOL"));
    }

    @Test
    @DisplayName("При ошибке опроса датчика остается последняя температура")
    void checkPollKeepsLastValue() {
        Mockito.when(temperatureSensorsService.getCurrentTemperature("CH")).thenReturn(19.5f);
        Mockito.when(temperatureSensorsService.getCurrentTemperature("HW")).thenReturn(44f);
        thermostatService.pollTemperatures();
        assertEquals(19.5f, thermostatService.getThermostat("CH").getTemperature());
        assertEquals(44f, thermostatService.getThermostat("HW").getTemperature());

        Mockito.when(temperatureSensorsService.getCurrentTemperature("CH")).thenReturn(null);
        Mockito.when(temperatureSensorsService.getCurrentTemperature("HW")).thenReturn(45f);
        thermostatService.pollTemperatures();
        assertEquals(19.5f, thermostatService.getThermostat("CH").getTemperature());
        assertEquals(45f, thermostatService.getThermostat("HW").getTemperature());

        assertEquals(
            1,
            applicationEvents.stream(TemperatureChangedEvent.class)
                .filter(event -> "CH".equals(event.getThermostat())).count()
        );
        assertEquals(
            2,
            applicationEvents.stream(TemperatureChangedEvent.class)
                .filter(event -> "HW".equals(event.getThermostat())).count()
        );
    }
}
