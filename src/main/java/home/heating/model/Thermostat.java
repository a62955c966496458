package home.heating.model;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Термостат канала (CH, HW): последняя измеренная температура, таймлайн и активные запросы.
 * Запросы хранятся в порядке добавления, от этого зависит выбор целевой температуры.
 */
public class Thermostat {
    private static final Logger logger = LoggerFactory.getLogger(Thermostat.class);
    private final String name;
    private final Timeline timeline;
    private final Clock clock;
    private final List<Request> requests = new ArrayList<>();
    private @Nullable Float temperature;

    public Thermostat(String name, Timeline timeline, Clock clock) {
        this.name = name;
        this.timeline = timeline;
        this.clock = clock;
    }

    public String getName() {
        return name;
    }

    public Timeline getTimeline() {
        return timeline;
    }

    /**
     * @return последняя известная температура, null если датчик еще ни разу не ответил
     */
    public synchronized @Nullable Float getTemperature() {
        return temperature;
    }

    public synchronized void setTemperature(@Nullable Float temperature) {
        this.temperature = temperature;
    }

    /**
     * Добавление запроса. Предыдущий запрос от того же источника удаляется.
     *
     * @param request запрос
     */
    public synchronized void addRequest(Request request) {
        purgeRequests(request.getSource());
        logger.info("{}: добавлен запрос {}", name, request);
        requests.add(request);
    }

    /**
     * Удаление истекших запросов и boost-запросов, которые уже достигли цели
     */
    public synchronized void purgeRequests() {
        purgeRequests(null);
    }

    /**
     * Удаление запросов источника source, плюс все истекшие
     *
     * @param source источник, запросы которого удаляются принудительно, может быть null
     */
    public synchronized void purgeRequests(@Nullable String source) {
        Instant now = clock.instant();
        Iterator<Request> iterator = requests.iterator();
        while (iterator.hasNext()) {
            Request request = iterator.next();
            boolean purge = source != null && source.equals(request.getSource());
            if (request.isBoost()) {
                if (temperature != null && (temperature >= request.getTarget() || temperature >= timeline.getMax())) {
                    logger.debug("{}: boost выполнен, температура {}", name, temperature);
                    purge = true;
                }
            } else if (request.isExpired(now)) {
                logger.debug("{}: запрос истек", name);
                purge = true;
            }
            if (purge) {
                logger.info("{}: удален запрос {}", name, request);
                iterator.remove();
            }
        }
    }

    /**
     * Целевая температура на текущий момент. Boost-запрос важнее обычных, среди запросов одного
     * вида побеждает добавленный последним. Без запросов цель берется из таймлайна.
     */
    public synchronized float getTargetTemperature() {
        purgeRequests();
        if (!requests.isEmpty()) {
            for (int i = requests.size() - 1; i >= 0; i--) {
                if (requests.get(i).isBoost()) {
                    return requests.get(i).getTarget();
                }
            }
            return requests.get(requests.size() - 1).getTarget();
        }
        return timeline.valueAtTime(LocalTime.now(clock));
    }

    /**
     * Максимальная температура, которую допускает таймлайн или активные boost-запросы
     */
    public synchronized float getMaximumTemperature() {
        float max = timeline.getMaxValue();
        for (Request request : requests) {
            if (request.isBoost() && request.getTarget() > max) {
                max = request.getTarget();
            }
        }
        return max;
    }

    public synchronized List<Request> getRequests() {
        return List.copyOf(requests);
    }

    public synchronized ThermostatStatus getStatus() {
        float target = getTargetTemperature();
        return new ThermostatStatus(name, temperature, target, List.copyOf(requests));
    }
}
