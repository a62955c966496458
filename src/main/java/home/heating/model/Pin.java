package home.heating.model;

import home.heating.enums.PinState;
import home.heating.exception.ActuatorException;
import home.heating.service.RelayService;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Пин - физический выход (реле) канала со своим списком прямых запросов.
 * Для CH и HW на Y-plan системе не вызывайте {@link #set(boolean)} напрямую, используйте ValveService.
 */
public class Pin {
    private static final Logger logger = LoggerFactory.getLogger(Pin.class);
    private final String name;
    private final RelayService relayService;
    private final Clock clock;
    private final PinStateListener listener;
    private final List<PinRequest> requests = new ArrayList<>();
    private volatile @Nullable Boolean lastWrittenState;
    private volatile @Nullable Boolean confirmedState;
    private volatile @Nullable String lastError;

    public Pin(String name, RelayService relayService, Clock clock, PinStateListener listener) {
        this.name = name;
        this.relayService = relayService;
        this.clock = clock;
        this.listener = listener;
    }

    public String getName() {
        return name;
    }

    /**
     * Физическое состояние реле
     *
     * @throws ActuatorException ошибка опроса реле
     */
    public boolean getState() throws ActuatorException {
        try {
            boolean state = relayService.readState(name);
            lastError = null;
            return state;
        } catch (ActuatorException e) {
            lastError = e.getMessage();
            throw e;
        }
    }

    /**
     * Запись состояния реле
     *
     * @param on новое состояние
     * @throws ActuatorException ошибка записи, запрошенное состояние при этом запоминается
     */
    public void set(boolean on) throws ActuatorException {
        logger.info("{} = {}", name, on ? "ON" : "OFF");
        lastWrittenState = on;
        try {
            relayService.writeState(name, on);
        } catch (ActuatorException e) {
            lastError = e.getMessage();
            throw e;
        }
        lastError = null;
        Boolean previous = confirmedState;
        confirmedState = on;
        if (!Objects.equals(previous, on)) {
            listener.onStateChanged(this, on);
        }
    }

    /**
     * @return последнее состояние, которое пытались записать в реле, null если записей не было
     */
    public @Nullable Boolean getLastWrittenState() {
        return lastWrittenState;
    }

    public @Nullable String getLastError() {
        return lastError;
    }

    /**
     * Добавление запроса. Предыдущий запрос от того же источника удаляется.
     */
    public synchronized void addRequest(PinRequest request) {
        purgeRequests(null, request.getSource());
        logger.info("{}: добавлен запрос {}", name, request);
        requests.add(request);
    }

    /**
     * Удаление истекших запросов и запросов, подходящих под все заданные критерии
     *
     * @param state  состояние запросов на удаление, может быть null
     * @param source источник запросов на удаление, может быть null
     */
    public synchronized void purgeRequests(@Nullable PinState state, @Nullable String source) {
        Instant now = clock.instant();
        boolean hasCriteria = state != null || source != null;
        Iterator<PinRequest> iterator = requests.iterator();
        while (iterator.hasNext()) {
            PinRequest request = iterator.next();
            boolean matches = hasCriteria
                && (state == null || state == request.getState())
                && (source == null || source.equals(request.getSource()));
            if (matches || request.isExpired(now)) {
                logger.info("{}: удален запрос {}", name, request);
                iterator.remove();
            }
        }
    }

    public synchronized void purgeRequests() {
        purgeRequests(null, null);
    }

    /**
     * Действующий запрос: запрос на выключение всегда важнее запросов на включение,
     * иначе действует самый ранний из активных запросов.
     *
     * @return запрос или null если запросов нет
     */
    public synchronized @Nullable PinRequest getActiveRequest() {
        purgeRequests();
        for (PinRequest request : requests) {
            if (request.getState() == PinState.OFF) {
                return request;
            }
        }
        return requests.isEmpty() ? null : requests.get(0);
    }

    public synchronized List<PinRequest> getRequests() {
        return List.copyOf(requests);
    }

    /**
     * Снимок состояния для отображения. Ошибка опроса реле не мешает получить запросы
     * и последнее запрошенное состояние.
     */
    public PinStatus getStatus() {
        Boolean actual;
        try {
            actual = getState();
        } catch (ActuatorException e) {
            logger.warn("{}: не удалось прочитать состояние реле для статуса", name);
            actual = null;
        }
        PinRequest activeRequest;
        List<PinRequest> snapshot;
        synchronized (this) {
            activeRequest = getActiveRequest();
            snapshot = List.copyOf(requests);
        }
        return new PinStatus(name, lastWrittenState, actual, activeRequest, snapshot, lastError);
    }
}
