package home.heating.service.impl;

import home.heating.configuration.ControllerConfiguration;
import home.heating.enums.ValveStatus;
import home.heating.event.error.PinErrorEvent;
import home.heating.exception.ActuatorException;
import home.heating.model.Pin;
import home.heating.service.PinService;
import home.heating.service.ValveService;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

@Service
public class ValveServiceImpl implements ValveService {
    private static final Logger logger = LoggerFactory.getLogger(ValveServiceImpl.class);
    private final PinService pinService;
    private final TaskScheduler taskScheduler;
    private final ControllerConfiguration configuration;
    private final ApplicationEventPublisher applicationEventPublisher;
    private ValveStatus status = ValveStatus.IDLE;

    public ValveServiceImpl(
        PinService pinService,
        TaskScheduler taskScheduler,
        ControllerConfiguration configuration,
        ApplicationEventPublisher applicationEventPublisher,
        MeterRegistry meterRegistry
    ) {
        this.pinService = pinService;
        this.taskScheduler = taskScheduler;
        this.configuration = configuration;
        this.applicationEventPublisher = applicationEventPublisher;

        Gauge.builder("valve", () -> getStatus().getNumericStatus())
            .tag("system", "home_heating")
            .tag("component", "status")
            .description("Статус трехходового клапана")
            .register(meterRegistry);
    }

    @Override
    public CompletableFuture<Void> setState(String channel, boolean on) {
        Pin pin = pinService.getPin(channel);
        CompletableFuture<Void> result = new CompletableFuture<>();
        apply(pin, on, result);
        return result;
    }

    private synchronized void apply(Pin pin, boolean on, CompletableFuture<Void> result) {
        if (status == ValveStatus.TRANSITIONING) {
            logger.debug("Клапан переключается, откладываем {} = {}", pin.getName(), on ? "ON" : "OFF");
            schedule(() -> apply(pin, on, result));
            return;
        }
        try {
            boolean current = pin.getState();
            if (current == on) {
                result.complete(null);
                return;
            }
            if (CH.equals(pin.getName()) && current && !on) {
                Pin hw = pinService.getPin(HW);
                if (!hw.getState()) {
                    logger.info("Выключаем CH через HW, ждем возврата клапана {} мс", configuration.getValveReturn());
                    pin.set(false);
                    hw.set(true);
                    status = ValveStatus.TRANSITIONING;
                    schedule(() -> completeTransition(pin, result));
                    return;
                }
            }
            pin.set(on);
            result.complete(null);
        } catch (ActuatorException e) {
            fail(e, result);
        } catch (RuntimeException e) {
            fail(pin.getName(), e, result);
        }
    }

    private synchronized void completeTransition(Pin ch, CompletableFuture<Void> result) {
        try {
            /* HW остается включенным, его выключит правило на следующем такте */
            ch.set(false);
            status = ValveStatus.IDLE;
            logger.info("Клапан вернулся, CH выключен");
            result.complete(null);
        } catch (ActuatorException e) {
            fail(e, result);
        } catch (RuntimeException e) {
            fail(ch.getName(), e, result);
        }
    }

    @Override
    public synchronized CompletableFuture<Void> resetValve() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        Pin ch = pinService.findPin(CH);
        Pin hw = pinService.findPin(HW);
        if (ch == null || hw == null) {
            logger.warn("Пины CH и HW не настроены, сброс клапана не нужен");
            result.complete(null);
            return result;
        }
        logger.info("Сброс клапана: включаем HW и ждем {} мс", configuration.getValveReturn());
        try {
            hw.set(true);
            status = ValveStatus.TRANSITIONING;
            schedule(() -> completeReset(ch, hw, result));
        } catch (ActuatorException e) {
            fail(e, result);
        }
        return result;
    }

    private synchronized void completeReset(Pin ch, Pin hw, CompletableFuture<Void> result) {
        try {
            ch.set(false);
            hw.set(false);
            status = ValveStatus.IDLE;
            logger.info("Сброс клапана завершен");
            result.complete(null);
        } catch (ActuatorException e) {
            fail(e, result);
        } catch (RuntimeException e) {
            fail(CH, e, result);
        }
    }

    private void schedule(Runnable task) {
        taskScheduler.schedule(task, taskScheduler.getClock().instant().plusMillis(configuration.getValveReturn()));
    }

    private void fail(ActuatorException e, CompletableFuture<Void> result) {
        status = ValveStatus.IDLE;
        logger.error("Ошибка переключения реле {}: {}", e.getPin(), e.getMessage());
        logger.debug("Отправляем событие об ошибке пина {}", e.getPin());
        applicationEventPublisher.publishEvent(new PinErrorEvent(this, e.getPin(), e.getMessage()));
        result.completeExceptionally(e);
    }

    private void fail(String pin, RuntimeException e, CompletableFuture<Void> result) {
        status = ValveStatus.IDLE;
        logger.error("Непредвиденная ошибка переключения {}", pin, e);
        result.completeExceptionally(e);
    }

    @Override
    public synchronized ValveStatus getStatus() {
        return status;
    }
}
