package home.heating.service.impl;

import home.heating.configuration.HistoryConfiguration;
import home.heating.event.info.PinStateChangedEvent;
import home.heating.event.info.TemperatureChangedEvent;
import home.heating.service.HistoryService;
import org.apache.commons.lang3.tuple.Pair;
import org.jetbrains.annotations.Nullable;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.text.DecimalFormat;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

@Service
public class HistoryServiceImpl implements HistoryService {
    private final HistoryConfiguration configuration;
    private final Clock clock;
    private final Map<String, NavigableMap<Instant, Float>> temperatureHistory = new HashMap<>();
    private final Map<String, NavigableMap<Instant, Boolean>> pinHistory = new TreeMap<>();

    public HistoryServiceImpl(HistoryConfiguration configuration, Clock clock) {
        this.configuration = configuration;
        this.clock = clock;
    }

    @EventListener
    public void onTemperatureChangedEvent(TemperatureChangedEvent event) {
        putTemperature(event.getThermostat(), event.getTemperature(), event.getTs());
    }

    @EventListener
    public void onPinStateChangedEvent(PinStateChangedEvent event) {
        putPinState(event.getPin(), event.isOn(), event.getTs());
    }

    @Override
    public synchronized void putTemperature(String thermostat, Float temperature, Instant ts) {
        NavigableMap<Instant, Float> history = temperatureHistory.computeIfAbsent(thermostat, k -> new TreeMap<>());
        if (temperature != null) {
            history.put(ts, temperature);
        }
        history.headMap(getRetentionBorder(), false).clear();
    }

    @Override
    public synchronized void putPinState(String pin, boolean on, Instant ts) {
        NavigableMap<Instant, Boolean> history = pinHistory.computeIfAbsent(pin, k -> new TreeMap<>());
        /* не добавляем если состояние такое же, как и предыдущее, экономим память */
        Map.Entry<Instant, Boolean> last = history.lastEntry();
        if (last == null || last.getValue() != on) {
            history.put(ts, on);
        }
        /* последнее переключение до границы нужно, чтобы знать состояние на начало периода */
        Instant border = history.floorKey(getRetentionBorder());
        if (border != null) {
            history.headMap(border, false).clear();
        }
    }

    private Instant getRetentionBorder() {
        return clock.instant().minus(configuration.getRetentionHours(), ChronoUnit.HOURS);
    }

    @Override
    public synchronized List<Pair<Instant, Float>> getTemperatureHistory(String thermostat, Instant since) {
        NavigableMap<Instant, Float> history = temperatureHistory.get(thermostat);
        if (history == null) {
            return List.of();
        }
        return history.tailMap(since, true).entrySet().stream()
            .map(entry -> Pair.of(entry.getKey(), entry.getValue()))
            .toList();
    }

    @Override
    public synchronized List<Pair<Instant, Boolean>> getPinHistory(String pin, Instant since) {
        NavigableMap<Instant, Boolean> history = pinHistory.get(pin);
        if (history == null) {
            return List.of();
        }
        return history.tailMap(since, true).entrySet().stream()
            .map(entry -> Pair.of(entry.getKey(), entry.getValue()))
            .toList();
    }

    @Override
    public synchronized @Nullable Float getPinWorkPercentForLastDay(String pin) {
        NavigableMap<Instant, Boolean> history = pinHistory.get(pin);
        if (history == null || history.isEmpty()) {
            return null;
        }
        Instant now = clock.instant();
        Instant dayAgo = now.minus(1, ChronoUnit.DAYS);
        Map.Entry<Instant, Boolean> before = history.floorEntry(dayAgo);

        /* если история короче суток - считаем от первого переключения */
        Instant intervalBegin = before != null ? dayAgo : history.firstKey();
        boolean intervalState = before != null ? before.getValue() : history.firstEntry().getValue();
        Instant periodBegin = intervalBegin;

        long workMillis = 0;
        for (Map.Entry<Instant, Boolean> entry : history.tailMap(intervalBegin, false).entrySet()) {
            if (intervalState) {
                workMillis += Duration.between(intervalBegin, entry.getKey()).toMillis();
            }
            intervalBegin = entry.getKey();
            intervalState = entry.getValue();
        }
        /* последний интервал не закрыт - закрываем текущим временем */
        if (intervalState) {
            workMillis += Duration.between(intervalBegin, now).toMillis();
        }

        long totalMillis = Duration.between(periodBegin, now).toMillis();
        if (totalMillis <= 0) {
            return intervalState ? 100F : 0F;
        }
        return (float) workMillis / totalMillis * 100;
    }

    @Override
    public String getFormattedStatusForLastDay() {
        List<String> pins;
        synchronized (this) {
            pins = List.copyOf(pinHistory.keySet());
        }
        if (pins.isEmpty()) {
            return "сведений о работе реле пока не достаточно";
        }
        DecimalFormat df0 = new DecimalFormat("#");
        StringBuilder message = new StringBuilder("Работа реле за последние сутки:\n");
        for (String pin : pins) {
            Float percent = getPinWorkPercentForLastDay(pin);
            message.append("* ")
                .append(pin)
                .append(" включен ")
                .append(percent == null ? "-" : df0.format(percent))
                .append("% времени\n");
        }
        return message.toString();
    }
}
