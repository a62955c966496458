package home.heating.model;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;

/**
 * Запрос на целевую температуру термостата от конкретного источника.
 * Обычный запрос действует до момента until, boost-запрос действует пока температура
 * не достигнет цели. Запросы не изменяются, новый запрос от того же источника заменяет старый.
 */
public class Request {
    private final String source;

    private final float target;

    private final @Nullable Instant until;

    private Request(String source, float target, @Nullable Instant until) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = target;
        this.until = until;
    }

    public static Request until(String source, float target, Instant until) {
        return new Request(source, target, Objects.requireNonNull(until, "until"));
    }

    public static Request boost(String source, float target) {
        return new Request(source, target, null);
    }

    public String getSource() {
        return source;
    }

    public float getTarget() {
        return target;
    }

    /**
     * @return время окончания действия запроса, null для boost
     */
    public @Nullable Instant getUntil() {
        return until;
    }

    public boolean isBoost() {
        return until == null;
    }

    public boolean isExpired(Instant now) {
        return until != null && until.isBefore(now);
    }

    @Override
    public String toString() {
        return source + " -> " + target + " C° до " + (isBoost() ? "boost" : until);
    }
}
