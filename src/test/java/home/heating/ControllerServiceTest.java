package home.heating;

import home.heating.event.error.RuleEvaluationErrorEvent;
import home.heating.exception.ActuatorException;
import home.heating.exception.RequestException;
import home.heating.model.Request;
import home.heating.model.Thermostat;
import home.heating.rule.HotWaterRule;
import home.heating.service.ControllerService;
import home.heating.service.PinService;
import home.heating.service.RelayService;
import home.heating.service.ThermostatService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentMatchers;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.annotation.DirtiesContext.ClassMode;
import org.springframework.test.context.event.ApplicationEvents;

import java.lang.reflect.Field;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DirtiesContext(classMode = ClassMode.AFTER_EACH_TEST_METHOD)
public class ControllerServiceTest extends AbstractTest {
    @Autowired
    ControllerService controllerService;

    @Autowired
    ThermostatService thermostatService;

    @Autowired
    PinService pinService;

    @Autowired
    RelayService relayService;

    @SpyBean
    HotWaterRule hotWaterRule;

    @Autowired
    private ApplicationEvents applicationEvents;

    private ScheduledFuture<?> getNextPoll() {
        try {
            Field field = controllerService.getClass().getDeclaredField("nextPoll");
            field.setAccessible(true);
            return (ScheduledFuture<?>) field.get(controllerService);
        } catch (Exception e) {
            throw new RuntimeException("Не удалось обратиться к таймеру цикла правил", e);
        }
    }

    @Test
    @DisplayName("Разбор запроса температуры до заданного времени")
    void checkTimedRequest() {
        Instant until = Instant.now().plus(1, ChronoUnit.HOURS).truncatedTo(ChronoUnit.SECONDS);
        controllerService.addRequest("CH", "alice", "20.5", until.toString());

        Thermostat ch = thermostatService.getThermostat("CH");
        List<Request> requests = ch.getRequests();
        assertEquals(1, requests.size());
        assertEquals("alice", requests.get(0).getSource());
        assertEquals(until, requests.get(0).getUntil());
        assertEquals(20.5f, ch.getTargetTemperature());

        controllerService.addRequest("CH", "alice", "OFF", String.valueOf(until.getEpochSecond()));
        assertEquals(1, ch.getRequests().size());
        assertEquals(0f, ch.getTargetTemperature());
    }

    @Test
    @DisplayName("Разбор boost-запросов")
    void checkBoostRequest() {
        controllerService.addRequest("HW", "bob", "BOOST 45", "2030-01-01T00:00:00");
        Request request = thermostatService.getThermostat("HW").getRequests().get(0);
        assertTrue(request.isBoost());
        assertEquals(45f, request.getTarget());

        controllerService.addRequest("HW", "carol", "42", "boost");
        assertTrue(thermostatService.getThermostat("HW").getRequests().get(1).isBoost());
    }

    @Test
    @DisplayName("Запрос ко всем термостатам и отмена запроса через now")
    void checkAllAndNow() {
        controllerService.addRequest("ALL", "calendar", "18", "2030-01-01T00:00:00Z");
        for (Thermostat thermostat : thermostatService.getThermostats()) {
            assertEquals(1, thermostat.getRequests().size());
        }

        controllerService.addRequest("HW", "calendar", "18", "now");
        assertTrue(thermostatService.getThermostat("HW").getRequests().isEmpty());
        assertEquals(1, thermostatService.getThermostat("CH").getRequests().size());
    }

    @Test
    @DisplayName("Некорректные запросы отклоняются")
    void checkBadRequests() {
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("POOL", "alice", "20", "2030-01-01T00:00:00Z"));
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("CH", "alice", "warm", "2030-01-01T00:00:00Z"));
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("CH", "alice", "20", "tomorrow"));
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("CH", "", "20", "2030-01-01T00:00:00Z"));
        assertThrows(RequestException.class,
            () -> controllerService.addPinRequest("CH", "alice", "half", "2030-01-01T00:00:00Z"));
        assertThrows(RequestException.class,
            () -> controllerService.addPinRequest("CH", "alice", "on", null));
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("CH", "alice", "20", "99999999999999999999"));
        assertThrows(RequestException.class,
            () -> controllerService.addRequest("CH", "alice", "20", "999999999999999999"));
        assertThrows(RequestException.class,
            () -> controllerService.addPinRequest("HW", "alice", "on", "999999999999999999"));
        assertTrue(thermostatService.getThermostat("CH").getRequests().isEmpty());
    }

    @Test
    @DisplayName("Запрос пина включает канал, отмена через now выключает")
    void checkPinRequest() throws ActuatorException {
        controllerService.start();
        controllerService.addPinRequest("HW", "alice", "on", "2030-01-01T00:00:00Z");
        assertEquals(1, pinService.getPin("HW").getRequests().size());
        assertTrue(relayService.readState("HW"));

        controllerService.addPinRequest("HW", "alice", "off", "now");
        assertTrue(pinService.getPin("HW").getRequests().isEmpty());
        /* температура неизвестна - правило выключает канал */
        assertFalse(relayService.readState("HW"));
    }

    @Test
    @DisplayName("Ошибка одного правила не мешает остальным")
    void checkFailingRule() throws ActuatorException {
        Mockito.doThrow(new IllegalStateException("сбой правила"))
            .when(hotWaterRule).evaluate(ArgumentMatchers.any(), ArgumentMatchers.any());
        /* ниже порога защиты от замерзания */
        thermostatService.getThermostat("CH").setTemperature(1f);

        controllerService.pollRules();

        assertTrue(relayService.readState("CH"));
        assertEquals(
            1,
            applicationEvents.stream(RuleEvaluationErrorEvent.class)
                .filter(event -> "HW".equals(event.getChannel())).count()
        );
    }

    @Test
    @DisplayName("Цикл правил перевзводит таймер, а после остановки таймера нет")
    void checkStartStop() {
        assertFalse(controllerService.isRunning());
        controllerService.pollRules();
        assertNull(getNextPoll());

        controllerService.start();
        assertTrue(controllerService.isRunning());
        ScheduledFuture<?> nextPoll = getNextPoll();
        assertNotNull(nextPoll);

        controllerService.pollRules();
        assertTrue(nextPoll.isCancelled());
        assertNotNull(getNextPoll());

        controllerService.stop();
        assertFalse(controllerService.isRunning());
        assertNull(getNextPoll());
    }

    @Test
    @DisplayName("После остановки цикла запросы сохраняются, но реле не переключаются")
    void checkRequestAfterStop() throws ActuatorException {
        controllerService.start();
        controllerService.stop();

        controllerService.addPinRequest("HW", "alice", "on", "2030-01-01T00:00:00Z");
        assertEquals(1, pinService.getPin("HW").getRequests().size());
        assertFalse(relayService.readState("HW"));
        assertNull(getNextPoll());

        controllerService.start();
        assertTrue(relayService.readState("HW"));
    }

    @Test
    @DisplayName("Статус доступен для бота")
    void checkFormattedStatus() {
        thermostatService.getThermostat("HW").setTemperature(42f);
        String status = controllerService.getFormattedStatus();
        assertTrue(status.contains("HW: 42 C°"));
        assertEquals(2, controllerService.getThermostatStatuses().size());
        assertEquals(2, controllerService.getPinStatuses().size());
    }
}
