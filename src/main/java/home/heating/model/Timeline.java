package home.heating.model;

import home.heating.exception.ConfigurationException;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Расписание целевых значений на повторяющийся период (обычно сутки).
 * Между контрольными точками значение интерполируется линейно, после последней точки
 * интерполяция идет к первой точке следующего периода.
 * Таймлайн неизменяемый, при смене конфигурации создается новый.
 */
public class Timeline {
    private final float min;

    private final float max;

    private final long period;

    private final List<TimelinePoint> points;

    private final long[] times;

    public Timeline(float min, float max, long period, List<TimelinePoint> points) {
        if (period <= 0) {
            throw new ConfigurationException("Период таймлайна должен быть положительным, задан " + period);
        }
        if (min > max) {
            throw new ConfigurationException("Минимум таймлайна " + min + " больше максимума " + max);
        }
        if (points == null || points.isEmpty()) {
            throw new ConfigurationException("В таймлайне нет ни одной точки");
        }
        long[] pointTimes = new long[points.size()];
        for (int i = 0; i < points.size(); i++) {
            TimelinePoint point = points.get(i);
            if (point.getTime() < 0 || point.getTime() >= period) {
                throw new ConfigurationException("Точка таймлайна " + point + " вне периода " + period);
            }
            if (i > 0 && point.getTime() <= pointTimes[i - 1]) {
                throw new ConfigurationException("Точки таймлайна не упорядочены по времени: " + point);
            }
            if (point.getValue() < min || point.getValue() > max) {
                throw new ConfigurationException(
                    "Значение точки " + point + " вне границ таймлайна [" + min + ", " + max + "]");
            }
            pointTimes[i] = point.getTime();
        }
        this.min = min;
        this.max = max;
        this.period = period;
        this.points = List.copyOf(points);
        this.times = pointTimes;
    }

    /**
     * Разбор времени суток вида HH:mm[:ss[.SSS]] в миллисекунды от полуночи
     *
     * @param time время суток
     * @return смещение в миллисекундах
     */
    public static long parseTimeOfDay(String time) {
        if (time == null) {
            throw new ConfigurationException("Не задано время точки таймлайна");
        }
        try {
            return LocalTime.parse(time.trim()).toNanoOfDay() / 1_000_000;
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Не удалось разобрать время точки таймлайна '" + time + "'", e);
        }
    }

    public float valueAtTime(LocalTime timeOfDay) {
        return valueAtTime(timeOfDay.toNanoOfDay() / 1_000_000);
    }

    /**
     * Значение таймлайна в заданный момент периода
     *
     * @param millis смещение от начала периода, берется по модулю периода
     * @return интерполированное значение
     */
    public float valueAtTime(long millis) {
        long time = Math.floorMod(millis, period);
        if (points.size() == 1) {
            return points.get(0).getValue();
        }

        int index = Arrays.binarySearch(times, time);
        if (index >= 0) {
            return points.get(index).getValue();
        }

        int next = -index - 1;
        TimelinePoint first = points.get(0);
        TimelinePoint last = points.get(points.size() - 1);
        TimelinePoint before;
        TimelinePoint after;
        long beforeTime;
        long afterTime;
        if (next == 0) {
            /* до первой точки - тянемся от последней точки предыдущего периода */
            before = last;
            beforeTime = last.getTime() - period;
            after = first;
            afterTime = first.getTime();
        } else if (next == points.size()) {
            before = last;
            beforeTime = last.getTime();
            after = first;
            afterTime = first.getTime() + period;
        } else {
            before = points.get(next - 1);
            beforeTime = before.getTime();
            after = points.get(next);
            afterTime = after.getTime();
        }

        float fraction = (float) (time - beforeTime) / (afterTime - beforeTime);
        return before.getValue() + (after.getValue() - before.getValue()) * fraction;
    }

    /**
     * Максимальное значение среди контрольных точек
     */
    public float getMaxValue() {
        float result = points.get(0).getValue();
        for (TimelinePoint point : points) {
            result = Math.max(result, point.getValue());
        }
        return result;
    }

    public float getMin() {
        return min;
    }

    public float getMax() {
        return max;
    }

    public long getPeriod() {
        return period;
    }

    public List<TimelinePoint> getPoints() {
        return Collections.unmodifiableList(points);
    }
}
