package home.heating.service.impl;

import home.heating.enums.SelfMonitoringStatus;
import home.heating.event.error.PinErrorEvent;
import home.heating.event.error.RuleEvaluationErrorEvent;
import home.heating.event.error.TemperatureSensorPollErrorEvent;
import home.heating.model.Thermostat;
import home.heating.service.BotService;
import home.heating.service.HealthService;
import home.heating.service.ThermostatService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.TreeSet;

@Service
public class HealthServiceImpl implements HealthService {
    private static final Logger logger = LoggerFactory.getLogger(HealthServiceImpl.class);
    private final BotService botService;
    private final ThermostatService thermostatService;
    private final Set<String> temperatureSensorFailEvents = new TreeSet<>();
    private final Set<String> unknownTemperatures = new TreeSet<>();
    private final Set<String> pinErrorEvents = new TreeSet<>();
    private final Set<String> ruleErrorEvents = new TreeSet<>();
    private SelfMonitoringStatus lastStatus = SelfMonitoringStatus.OK;

    public HealthServiceImpl(BotService botService, ThermostatService thermostatService, MeterRegistry meterRegistry) {
        this.botService = botService;
        this.thermostatService = thermostatService;

        Gauge.builder("health", () -> getLastStatus().getNumericStatus())
            .tag("system", "home_heating")
            .tag("component", "status")
            .description("Статус селфмониторинга")
            .register(meterRegistry);
    }

    @Scheduled(fixedRateString = "${health.controlInterval}")
    public void control() {
        calculateHealthStatus();
    }

    synchronized SelfMonitoringStatus calculateHealthStatus() {
        logger.debug("Запущена задача селфмониторинга");
        checkTemperatures();

        SelfMonitoringStatus newStatus = SelfMonitoringStatus.OK;
        if (!temperatureSensorsAreOk()) {
            newStatus = SelfMonitoringStatus.MINOR_PROBLEMS;
        }
        if (!pinsAreOk() || !rulesAreOk()) {
            newStatus = SelfMonitoringStatus.EMERGENCY;
        }
        notifyAndSetLastStatus(newStatus);

        clear();
        return newStatus;
    }

    private void checkTemperatures() {
        for (Thermostat thermostat : thermostatService.getThermostats()) {
            if (thermostat.getTemperature() == null) {
                logger.warn("{} - температура неизвестна", thermostat.getName());
                unknownTemperatures.add(thermostat.getName());
            }
        }
    }

    private void notifyAndSetLastStatus(SelfMonitoringStatus newStatus) {
        if (newStatus != lastStatus) {
            if (newStatus == SelfMonitoringStatus.EMERGENCY) {
                botService.notify(formatCriticalMessage());
            }
            if (newStatus == SelfMonitoringStatus.MINOR_PROBLEMS) {
                botService.notify(formatMinorMessage());
            }
            if (newStatus == SelfMonitoringStatus.OK) {
                botService.notify(formatOkMessage());
            }
            lastStatus = newStatus;
        }
    }

    @EventListener
    public synchronized void onTemperatureSensorPollErrorEvent(TemperatureSensorPollErrorEvent event) {
        temperatureSensorFailEvents.add(event.getThermostat());
    }

    @EventListener
    public synchronized void onPinErrorEvent(PinErrorEvent event) {
        pinErrorEvents.add(event.getPin());
    }

    @EventListener
    public synchronized void onRuleEvaluationErrorEvent(RuleEvaluationErrorEvent event) {
        ruleErrorEvents.add(event.getChannel());
    }

    @Override
    public synchronized SelfMonitoringStatus getLastStatus() {
        return lastStatus;
    }

    @Override
    public String getFormattedStatus() {
        return calculateHealthStatus().getTemplate();
    }

    private boolean temperatureSensorsAreOk() {
        return temperatureSensorFailEvents.isEmpty() && unknownTemperatures.isEmpty();
    }

    private boolean pinsAreOk() {
        return pinErrorEvents.isEmpty();
    }

    private boolean rulesAreOk() {
        return ruleErrorEvents.isEmpty();
    }

    private void clear() {
        temperatureSensorFailEvents.clear();
        unknownTemperatures.clear();
        pinErrorEvents.clear();
        ruleErrorEvents.clear();
    }

    private String formatCriticalMessage() {
        StringBuilder message = new StringBuilder("Аварийная ситуация:\n");
        if (!pinsAreOk()) {
            message.append("* отказ реле: ").append(String.join(", ", pinErrorEvents)).append("\n");
        }
        if (!rulesAreOk()) {
            message.append("* отказ правил каналов: ").append(String.join(", ", ruleErrorEvents)).append("\n");
        }
        if (!temperatureSensorsAreOk()) {
            message.append(formatTemperatureProblems());
        }
        return message.toString();
    }

    private String formatMinorMessage() {
        return "Неполадки:\n" + formatTemperatureProblems();
    }

    private String formatTemperatureProblems() {
        StringBuilder message = new StringBuilder();
        if (!temperatureSensorFailEvents.isEmpty()) {
            message.append("* отказ температурных датчиков: ")
                .append(String.join(", ", temperatureSensorFailEvents))
                .append("\n");
        }
        if (!unknownTemperatures.isEmpty()) {
            message.append("* температура неизвестна: ").append(String.join(", ", unknownTemperatures)).append("\n");
        }
        return message.toString();
    }

    private String formatOkMessage() {
        return "Ситуация нормализована";
    }
}
