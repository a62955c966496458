package home.heating.model;

/**
 * Контрольная точка таймлайна: смещение от начала периода в миллисекундах и значение
 */
public class TimelinePoint {
    private final long time;

    private final float value;

    public TimelinePoint(long time, float value) {
        this.time = time;
        this.value = value;
    }

    public long getTime() {
        return time;
    }

    public float getValue() {
        return value;
    }

    @Override
    public String toString() {
        return time + "ms=" + value;
    }
}
