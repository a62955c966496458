package home.heating;

import home.heating.model.Request;
import home.heating.model.Thermostat;
import home.heating.model.Timeline;
import home.heating.model.TimelinePoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ThermostatTest {
    private MutableClock clock;

    private Thermostat thermostat;

    @BeforeEach
    void setUp() {
        /* 06:00 UTC, таймлайн в этот момент дает 15 */
        clock = new MutableClock(Instant.parse("2024-01-15T06:00:00Z"), ZoneOffset.UTC);
        Timeline timeline = new Timeline(0, 50, 86_400_000L, List.of(
            new TimelinePoint(0, 10),
            new TimelinePoint(43_200_000L, 20),
            new TimelinePoint(86_399_999L, 10)
        ));
        thermostat = new Thermostat("CH", timeline, clock);
    }

    @Test
    @DisplayName("Без запросов цель берется из таймлайна")
    void checkTimelineTarget() {
        assertEquals(15f, thermostat.getTargetTemperature(), 0.001f);
    }

    @Test
    @DisplayName("Повторный запрос от того же источника заменяет предыдущий")
    void checkOneRequestPerSource() {
        thermostat.addRequest(Request.until("A", 18, clock.instant().plus(Duration.ofHours(1))));
        thermostat.addRequest(Request.until("A", 21, clock.instant().plus(Duration.ofHours(2))));
        assertEquals(1, thermostat.getRequests().size());
        assertEquals(21f, thermostat.getTargetTemperature());
    }

    @Test
    @DisplayName("При нескольких запросах побеждает добавленный последним")
    void checkLastAddedWins() {
        thermostat.addRequest(Request.until("A", 18, clock.instant().plus(Duration.ofHours(1))));
        thermostat.addRequest(Request.until("B", 12, clock.instant().plus(Duration.ofHours(1))));
        assertEquals(12f, thermostat.getTargetTemperature());

        thermostat.addRequest(Request.until("A", 19, clock.instant().plus(Duration.ofHours(1))));
        assertEquals(19f, thermostat.getTargetTemperature());
        assertEquals("B", thermostat.getRequests().get(0).getSource());
    }

    @Test
    @DisplayName("Boost важнее обычных запросов, даже добавленных позже")
    void checkBoostOutranksTimedRequests() {
        thermostat.addRequest(Request.boost("A", 30));
        thermostat.addRequest(Request.until("B", 12, clock.instant().plus(Duration.ofHours(1))));
        assertEquals(30f, thermostat.getTargetTemperature());

        thermostat.addRequest(Request.boost("C", 35));
        assertEquals(35f, thermostat.getTargetTemperature());
    }

    @Test
    @DisplayName("Истекший запрос удаляется и цель возвращается к таймлайну")
    void checkExpiry() {
        thermostat.addRequest(Request.until("A", 18, clock.instant().plus(Duration.ofMinutes(10))));
        assertEquals(18f, thermostat.getTargetTemperature());

        clock.advance(Duration.ofMinutes(10));
        thermostat.purgeRequests();
        assertEquals(1, thermostat.getRequests().size());

        clock.advance(Duration.ofMillis(1));
        thermostat.purgeRequests();
        assertTrue(thermostat.getRequests().isEmpty());
        assertEquals(15f, thermostat.getTargetTemperature(), 0.001f);
    }

    @Test
    @DisplayName("Boost действует пока температура не достигнет цели")
    void checkBoostLifecycle() {
        thermostat.setTemperature(20f);
        thermostat.addRequest(Request.boost("A", 30));
        clock.advance(Duration.ofDays(3));
        assertEquals(30f, thermostat.getTargetTemperature());

        thermostat.setTemperature(30f);
        thermostat.purgeRequests();
        assertTrue(thermostat.getRequests().isEmpty());
        assertEquals(15f, thermostat.getTargetTemperature(), 0.001f);
    }

    @Test
    @DisplayName("Boost снимается при достижении максимума таймлайна")
    void checkBoostPurgedAtTimelineMax() {
        thermostat.setTemperature(50f);
        thermostat.addRequest(Request.boost("A", 60));
        thermostat.purgeRequests();
        assertTrue(thermostat.getRequests().isEmpty());
    }

    @Test
    @DisplayName("Отмена запросов источника")
    void checkPurgeBySource() {
        thermostat.addRequest(Request.until("A", 18, clock.instant().plus(Duration.ofHours(1))));
        thermostat.addRequest(Request.boost("B", 30));
        thermostat.purgeRequests("A");
        assertEquals(1, thermostat.getRequests().size());
        assertEquals("B", thermostat.getRequests().get(0).getSource());
    }

    @Test
    @DisplayName("Максимальная температура учитывает boost-запросы")
    void checkMaximumTemperature() {
        assertEquals(20f, thermostat.getMaximumTemperature());
        thermostat.addRequest(Request.boost("A", 45));
        assertEquals(45f, thermostat.getMaximumTemperature());
        thermostat.addRequest(Request.until("B", 48, clock.instant().plus(Duration.ofHours(1))));
        assertEquals(45f, thermostat.getMaximumTemperature());
    }
}
