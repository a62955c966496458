package home.heating.service.impl;

import home.heating.configuration.HeatingConfiguration;
import home.heating.configuration.HeatingConfiguration.ThermostatProperties;
import home.heating.configuration.HeatingConfiguration.TimelinePointProperties;
import home.heating.configuration.HeatingConfiguration.TimelineProperties;
import home.heating.event.info.TemperatureChangedEvent;
import home.heating.exception.ConfigurationException;
import home.heating.exception.RequestException;
import home.heating.model.Request;
import home.heating.model.Thermostat;
import home.heating.model.Timeline;
import home.heating.model.TimelinePoint;
import home.heating.service.TemperatureSensorsService;
import home.heating.service.ThermostatService;
import home.heating.utils.decimal.TD_F;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
public class ThermostatServiceImpl implements ThermostatService {
    private static final Logger logger = LoggerFactory.getLogger(ThermostatServiceImpl.class);
    private final TemperatureSensorsService temperatureSensorsService;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final Map<String, Thermostat> thermostats = new LinkedHashMap<>();

    public ThermostatServiceImpl(
        HeatingConfiguration configuration,
        TemperatureSensorsService temperatureSensorsService,
        ApplicationEventPublisher applicationEventPublisher,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        this.temperatureSensorsService = temperatureSensorsService;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;

        configuration.getThermostats().forEach((name, properties) -> {
            Thermostat thermostat = new Thermostat(name, createTimeline(name, properties), clock);
            thermostats.put(name, thermostat);
            logger.info("Создан термостат {}, таймлайн {}", name, thermostat.getTimeline().getPoints());

            Gauge.builder("thermostat", () -> thermostat.getTemperature())
                .tag("system", "home_heating")
                .tag("component", "temperature")
                .tag("thermostat", name)
                .description("Температура канала " + name)
                .register(meterRegistry);

            Gauge.builder("thermostat", thermostat::getTargetTemperature)
                .tag("system", "home_heating")
                .tag("component", "target")
                .tag("thermostat", name)
                .description("Целевая температура канала " + name)
                .register(meterRegistry);
        });
    }

    private static Timeline createTimeline(String name, ThermostatProperties properties) {
        TimelineProperties timeline = properties.getTimeline();
        if (timeline == null || timeline.getMax() == null) {
            throw new ConfigurationException("Для термостата " + name + " не задан максимум таймлайна");
        }
        List<TimelinePoint> points = new ArrayList<>();
        for (TimelinePointProperties point : timeline.getPoints()) {
            if (point.getValue() == null) {
                throw new ConfigurationException(
                    "Для термостата " + name + " не задано значение точки " + point.getTime());
            }
            points.add(new TimelinePoint(Timeline.parseTimeOfDay(point.getTime()), point.getValue()));
        }
        try {
            return new Timeline(
                Objects.requireNonNullElse(timeline.getMin(), 0F),
                timeline.getMax(),
                Objects.requireNonNullElse(timeline.getPeriod(), 86_400_000L),
                points
            );
        } catch (ConfigurationException e) {
            throw new ConfigurationException("Ошибка таймлайна термостата " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Thermostat getThermostat(String name) {
        Thermostat thermostat = findThermostat(name);
        if (thermostat == null) {
            throw new RequestException("Неизвестный термостат '" + name + "'");
        }
        return thermostat;
    }

    @Override
    public @Nullable Thermostat findThermostat(String name) {
        return name == null ? null : thermostats.get(name);
    }

    @Override
    public Collection<Thermostat> getThermostats() {
        return Collections.unmodifiableCollection(thermostats.values());
    }

    @Override
    @Scheduled(fixedRateString = "${heating.sensorPollInterval}")
    public void pollTemperatures() {
        logger.debug("Запущена задача опроса датчиков термостатов");
        for (Thermostat thermostat : thermostats.values()) {
            Float temperature = temperatureSensorsService.getCurrentTemperature(thermostat.getName());
            if (temperature == null) {
                logger.debug("{}: температура не получена, оставляем прежнюю {}", thermostat.getName(),
                    thermostat.getTemperature());
                continue;
            }
            Float previous = thermostat.getTemperature();
            thermostat.setTemperature(temperature);
            if (!temperature.equals(previous)) {
                logger.debug("{}: температура изменилась {} -> {}", thermostat.getName(), previous, temperature);
                applicationEventPublisher.publishEvent(
                    new TemperatureChangedEvent(this, thermostat.getName(), temperature, clock.instant()));
            }
        }
    }

    @Override
    public String getCurrentTemperaturesFormatted() {
        StringBuilder message = new StringBuilder("Термостаты:\n");
        for (Thermostat thermostat : thermostats.values()) {
            message.append("* ")
                .append(thermostat.getName())
                .append(": ")
                .append(TD_F.format(thermostat.getTemperature()))
                .append(", цель ")
                .append(TD_F.format(thermostat.getTargetTemperature()));
            List<Request> requests = thermostat.getRequests();
            if (!requests.isEmpty()) {
                message.append(", запросы: ");
                for (int i = 0; i < requests.size(); i++) {
                    if (i > 0) {
                        message.append("; ");
                    }
                    message.append(requests.get(i));
                }
            }
            message.append("\n");
        }
        return message.toString();
    }
}
