package sp.sistemaspalacios.attendance_engine.service.common;

import org.springframework.stereotype.Service;

import java.time.LocalTime;

/**
 * Aritmética de intervalos sobre horas del día, en segundos.
 * <p>
 * Los intervalos de trabajo están acotados al día calendario (inicio &lt;= fin).
 * Las ventanas de configuración (nocturna) pueden cruzar medianoche.
 */
@Service
public class WorkingTimeCalculatorService {

    private static final int SECONDS_PER_DAY = 24 * 60 * 60;

    public record Interval(LocalTime start, LocalTime end) {
        public Interval {
            if (start == null || end == null) {
                throw new IllegalArgumentException("Intervalo con extremos nulos");
            }
            if (end.isBefore(start)) {
                throw new IllegalArgumentException("Intervalo invertido: " + start + " - " + end);
            }
        }
    }

    public long durationSeconds(Interval interval) {
        return interval.end().toSecondOfDay() - interval.start().toSecondOfDay();
    }

    public long overlapSeconds(Interval a, Interval b) {
        return overlap(a.start().toSecondOfDay(), a.end().toSecondOfDay(),
                b.start().toSecondOfDay(), b.end().toSecondOfDay());
    }

    public boolean overlaps(Interval a, Interval b) {
        return overlapSeconds(a, b) > 0;
    }

    /**
     * Segundos del intervalo que caen dentro de la ventana [windowStart, windowEnd).
     * Si windowStart &gt; windowEnd la ventana cruza medianoche (p. ej. 22:00–06:00).
     */
    public long overlapWithWindowSeconds(Interval interval, LocalTime windowStart, LocalTime windowEnd) {
        int s = interval.start().toSecondOfDay();
        int e = interval.end().toSecondOfDay();
        int ws = windowStart.toSecondOfDay();
        int we = windowEnd.toSecondOfDay();
        if (ws <= we) {
            return overlap(s, e, ws, we);
        }
        return overlap(s, e, ws, SECONDS_PER_DAY) + overlap(s, e, 0, we);
    }

    private long overlap(int aStart, int aEnd, int bStart, int bEnd) {
        return Math.max(0, Math.min(aEnd, bEnd) - Math.max(aStart, bStart));
    }
}
