package home.heating.model;

import home.heating.enums.PinState;
import home.heating.exception.RequestException;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Прямой запрос на состояние пина. BOOST по времени не истекает, его снимает правило
 * после достижения максимальной температуры.
 */
public class PinRequest {
    private final String source;

    private final PinState state;

    private final @Nullable Instant until;

    public PinRequest(String source, PinState state, @Nullable Instant until) {
        this.source = Objects.requireNonNull(source, "source");
        this.state = Objects.requireNonNull(state, "state");
        if (state != PinState.BOOST && until == null) {
            throw new RequestException("Для запроса " + state + " от " + source + " не указано время окончания");
        }
        this.until = state == PinState.BOOST ? null : until;
    }

    public String getSource() {
        return source;
    }

    public PinState getState() {
        return state;
    }

    public @Nullable Instant getUntil() {
        return until;
    }

    public boolean isExpired(Instant now) {
        return state != PinState.BOOST && until != null && until.isBefore(now);
    }

    @Override
    public String toString() {
        return source + " -> " + state + (until != null ? " до " + until : "");
    }
}
