package home.heating.service.impl;

import home.heating.configuration.ControllerConfiguration;
import home.heating.configuration.HeatingConfiguration;
import home.heating.enums.PinState;
import home.heating.enums.RuleDecision;
import home.heating.enums.RuleType;
import home.heating.event.error.RuleEvaluationErrorEvent;
import home.heating.exception.ConfigurationException;
import home.heating.exception.RequestException;
import home.heating.model.Pin;
import home.heating.model.PinRequest;
import home.heating.model.PinStatus;
import home.heating.model.Request;
import home.heating.model.Thermostat;
import home.heating.model.ThermostatStatus;
import home.heating.rule.Rule;
import home.heating.service.ControllerService;
import home.heating.service.PinService;
import home.heating.service.ThermostatService;
import home.heating.service.ValveService;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ControllerServiceImpl implements ControllerService {
    public static final String ALL_THERMOSTATS = "ALL";
    private static final Logger logger = LoggerFactory.getLogger(ControllerServiceImpl.class);
    private static final Pattern BOOST_TARGET = Pattern.compile("^BOOST\\s+(-?\\d+(?:\\.\\d+)?)$",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern EPOCH_SECONDS = Pattern.compile("^\\d+$");
    private final HeatingConfiguration heatingConfiguration;
    private final ControllerConfiguration configuration;
    private final ThermostatService thermostatService;
    private final PinService pinService;
    private final ValveService valveService;
    private final TaskScheduler taskScheduler;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;
    private final Map<RuleType, Rule> rules = new EnumMap<>(RuleType.class);
    private volatile boolean running;
    private @Nullable ScheduledFuture<?> nextPoll;

    public ControllerServiceImpl(
        HeatingConfiguration heatingConfiguration,
        ControllerConfiguration configuration,
        ThermostatService thermostatService,
        PinService pinService,
        ValveService valveService,
        List<Rule> rules,
        TaskScheduler taskScheduler,
        ApplicationEventPublisher applicationEventPublisher,
        Clock clock
    ) {
        this.heatingConfiguration = heatingConfiguration;
        this.configuration = configuration;
        this.thermostatService = thermostatService;
        this.pinService = pinService;
        this.valveService = valveService;
        this.taskScheduler = taskScheduler;
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        for (Rule rule : rules) {
            this.rules.put(rule.getType(), rule);
        }

        heatingConfiguration.getRules().forEach((channel, type) -> {
            if (thermostatService.findThermostat(channel) == null || pinService.findPin(channel) == null) {
                throw new ConfigurationException("Для правила канала " + channel + " нет термостата или пина");
            }
            if (type == null || !this.rules.containsKey(type)) {
                throw new ConfigurationException("Для канала " + channel + " задано неизвестное правило " + type);
            }
        });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!configuration.getAutoStart()) {
            logger.info("Автозапуск цикла правил отключен");
            return;
        }
        valveService.resetValve().whenComplete((result, error) -> {
            if (error != null) {
                logger.error("Не удалось сбросить клапан при запуске: {}", error.getMessage());
            }
            start();
        });
    }

    @Override
    public synchronized void start() {
        logger.info("Запуск цикла правил, период {} мс", configuration.getRuleInterval());
        running = true;
        pollRules();
    }

    @Override
    public synchronized void stop() {
        logger.info("Остановка цикла правил");
        running = false;
        cancelNextPoll();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void pollRules() {
        cancelNextPoll();
        try {
            for (Thermostat thermostat : thermostatService.getThermostats()) {
                thermostat.purgeRequests();
            }
            heatingConfiguration.getRules().forEach(this::evaluateRule);
        } finally {
            if (running) {
                nextPoll = taskScheduler.schedule(
                    this::pollRules,
                    taskScheduler.getClock().instant().plusMillis(configuration.getRuleInterval())
                );
            }
        }
    }

    private void cancelNextPoll() {
        if (nextPoll != null) {
            nextPoll.cancel(false);
            nextPoll = null;
        }
    }

    private void evaluateRule(String channel, RuleType type) {
        try {
            Rule rule = rules.get(type);
            Thermostat thermostat = thermostatService.getThermostat(channel);
            Pin pin = pinService.getPin(channel);
            RuleDecision decision = rule.evaluate(thermostat, pin);
            logger.debug("{}: {} - {}", channel, type.getTemplate(), decision.getTemplate());
            if (decision == RuleDecision.NO_CHANGE) {
                return;
            }
            boolean on = decision == RuleDecision.TURN_ON;
            valveService.setState(channel, on).whenComplete((result, error) -> {
                if (error != null) {
                    logger.error("{}: не удалось установить {}: {}", channel, on ? "ON" : "OFF",
                        error.getMessage());
                }
            });
        } catch (RuntimeException e) {
            logger.error("{}: ошибка расчета правила {}", channel, type, e);
            logger.debug("Отправляем событие об ошибке правила {}", channel);
            applicationEventPublisher.publishEvent(new RuleEvaluationErrorEvent(this, channel, e));
        }
    }

    @Override
    public void addRequest(String service, String source, String target, String until) {
        requireSource(source);
        List<Thermostat> thermostats = new ArrayList<>();
        if (ALL_THERMOSTATS.equalsIgnoreCase(service)) {
            thermostats.addAll(thermostatService.getThermostats());
        } else {
            thermostats.add(thermostatService.getThermostat(service));
        }

        if (isNow(until)) {
            for (Thermostat thermostat : thermostats) {
                logger.info("{}: отмена запроса от {}", thermostat.getName(), source);
                thermostat.purgeRequests(source);
            }
        } else {
            if (target == null) {
                throw new RequestException("Не указана целевая температура");
            }
            String trimmed = target.trim();
            boolean boost = isBoost(until);
            float value;
            Matcher matcher = BOOST_TARGET.matcher(trimmed);
            if (matcher.matches()) {
                boost = true;
                value = Float.parseFloat(matcher.group(1));
            } else if ("OFF".equalsIgnoreCase(trimmed)) {
                value = 0;
            } else {
                value = parseTemperature(trimmed);
            }
            Instant untilInstant = boost ? null : parseUntil(until);
            for (Thermostat thermostat : thermostats) {
                thermostat.addRequest(
                    boost ? Request.boost(source, value) : Request.until(source, value, untilInstant));
            }
        }
        pollRulesIfRunning();
    }

    @Override
    public void addPinRequest(String pin, String source, String state, String until) {
        requireSource(source);
        Pin actuator = pinService.getPin(pin);
        if (isNow(until)) {
            logger.info("{}: отмена запроса от {}", actuator.getName(), source);
            actuator.purgeRequests(null, source);
        } else {
            PinState pinState = PinState.parse(state);
            Instant untilInstant = pinState == PinState.BOOST || isBoost(until) ? null : parseUntil(until);
            actuator.addRequest(new PinRequest(source, pinState, untilInstant));
        }
        pollRulesIfRunning();
    }

    private synchronized void pollRulesIfRunning() {
        if (!running) {
            logger.debug("Цикл правил остановлен, запрос будет учтен после запуска");
            return;
        }
        pollRules();
    }

    private static void requireSource(String source) {
        if (source == null || source.isBlank()) {
            throw new RequestException("Не указан источник запроса");
        }
    }

    private static boolean isNow(@Nullable String until) {
        return until != null && "now".equalsIgnoreCase(until.trim());
    }

    private static boolean isBoost(@Nullable String until) {
        return until != null && "boost".equalsIgnoreCase(until.trim());
    }

    private static float parseTemperature(String value) {
        try {
            float temperature = Float.parseFloat(value);
            if (Float.isNaN(temperature) || Float.isInfinite(temperature)) {
                throw new RequestException("Некорректная температура '" + value + "'");
            }
            return temperature;
        } catch (NumberFormatException e) {
            throw new RequestException("Не удалось разобрать температуру '" + value + "'", e);
        }
    }

    private Instant parseUntil(@Nullable String until) {
        if (until == null || until.isBlank()) {
            throw new RequestException("Не указано время окончания запроса");
        }
        String trimmed = until.trim();
        if (EPOCH_SECONDS.matcher(trimmed).matches()) {
            try {
                return Instant.ofEpochSecond(Long.parseLong(trimmed));
            } catch (NumberFormatException | DateTimeException e) {
                throw new RequestException("Время окончания '" + until + "' вне допустимого диапазона", e);
            }
        }
        try {
            TemporalAccessor parsed =
                DateTimeFormatter.ISO_DATE_TIME.parseBest(trimmed, ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime) {
                return ((ZonedDateTime) parsed).toInstant();
            }
            return ((LocalDateTime) parsed).atZone(clock.getZone()).toInstant();
        } catch (DateTimeParseException e) {
            throw new RequestException("Не удалось разобрать время окончания '" + until + "'", e);
        }
    }

    @Override
    public List<ThermostatStatus> getThermostatStatuses() {
        List<ThermostatStatus> statuses = new ArrayList<>();
        for (Thermostat thermostat : thermostatService.getThermostats()) {
            statuses.add(thermostat.getStatus());
        }
        return statuses;
    }

    @Override
    public List<PinStatus> getPinStatuses() {
        List<PinStatus> statuses = new ArrayList<>();
        for (Pin pin : pinService.getPins()) {
            statuses.add(pin.getStatus());
        }
        return statuses;
    }

    @Override
    public String getFormattedStatus() {
        return (running ? "Цикл правил работает" : "Цикл правил остановлен")
            + ", " + valveService.getStatus().getTemplate() + "\n\n"
            + thermostatService.getCurrentTemperaturesFormatted() + "\n"
            + pinService.getFormattedStatus();
    }
}
