package home.heating.service.impl;

import home.heating.configuration.HeatingConfiguration;
import home.heating.event.info.PinStateChangedEvent;
import home.heating.exception.RequestException;
import home.heating.model.Pin;
import home.heating.model.PinStatus;
import home.heating.service.PinService;
import home.heating.service.RelayService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Service
public class PinServiceImpl implements PinService {
    private static final Logger logger = LoggerFactory.getLogger(PinServiceImpl.class);
    private final Map<String, Pin> pins = new LinkedHashMap<>();

    public PinServiceImpl(
        HeatingConfiguration configuration,
        RelayService relayService,
        ApplicationEventPublisher applicationEventPublisher,
        Clock clock,
        MeterRegistry meterRegistry
    ) {
        for (String name : configuration.getPins().keySet()) {
            Pin pin = new Pin(name, relayService, clock, (changed, on) -> {
                logger.debug("Отправляем событие о смене состояния пина {}", changed.getName());
                applicationEventPublisher.publishEvent(
                    new PinStateChangedEvent(this, changed.getName(), on, clock.instant()));
            });
            pins.put(name, pin);
            logger.info("Создан пин {}", name);

            Gauge.builder("pin", () -> toNumeric(pin.getLastWrittenState()))
                .tag("system", "home_heating")
                .tag("component", "state")
                .tag("pin", name)
                .description("Последнее записанное состояние реле " + name)
                .register(meterRegistry);
        }
    }

    private static @Nullable Integer toNumeric(@Nullable Boolean state) {
        if (state == null) {
            return null;
        }
        return state ? 1 : 0;
    }

    @Override
    public Pin getPin(String name) {
        Pin pin = findPin(name);
        if (pin == null) {
            throw new RequestException("Неизвестный пин '" + name + "'");
        }
        return pin;
    }

    @Override
    public @Nullable Pin findPin(String name) {
        return name == null ? null : pins.get(name);
    }

    @Override
    public Collection<Pin> getPins() {
        return Collections.unmodifiableCollection(pins.values());
    }

    @Override
    public String getFormattedStatus() {
        StringBuilder message = new StringBuilder("Реле:\n");
        for (Pin pin : pins.values()) {
            PinStatus status = pin.getStatus();
            message.append("* ")
                .append(status.getName())
                .append(": ")
                .append(formatState(status.getActualState()));
            if (status.hasDiscrepancy()) {
                message.append(" (записано ").append(formatState(status.getRequestedState())).append("!)");
            }
            if (status.getActiveRequest() != null) {
                message.append(", запрос ").append(status.getActiveRequest());
            }
            if (status.getLastError() != null) {
                message.append(", ошибка: ").append(status.getLastError());
            }
            message.append("\n");
        }
        return message.toString();
    }

    private static String formatState(@Nullable Boolean state) {
        if (state == null) {
            return "неизвестно";
        }
        return state ? "включено" : "выключено";
    }
}
