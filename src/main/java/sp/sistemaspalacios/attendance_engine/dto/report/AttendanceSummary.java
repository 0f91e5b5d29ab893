package sp.sistemaspalacios.attendance_engine.dto.report;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Agregado parcial de asistencia. Se combina con {@link #combine} sin volver
 * a procesar marcaciones, en cualquier orden y agrupación.
 */
@Value
@Builder(toBuilder = true)
public class AttendanceSummary {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    int recordCount;
    int daysWorked;
    int daysAbsent;

    /** Días programados; null = días trabajados + ausencias. */
    Integer scheduledDays;

    int lateArrivals;
    int earlyDepartures;

    @Builder.Default
    BigDecimal regularHours = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal overtimeHours = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal recargo25Hours = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal suplementario50Hours = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal extraordinario100Hours = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal nightHours = BigDecimal.ZERO;

    public static AttendanceSummary empty() {
        return AttendanceSummary.builder().build();
    }

    public AttendanceSummary combine(AttendanceSummary other) {
        Integer scheduled = scheduledDays == null && other.scheduledDays == null
                ? null
                : getEffectiveScheduledDays() + other.getEffectiveScheduledDays();

        return AttendanceSummary.builder()
                .recordCount(recordCount + other.recordCount)
                .daysWorked(daysWorked + other.daysWorked)
                .daysAbsent(daysAbsent + other.daysAbsent)
                .scheduledDays(scheduled)
                .lateArrivals(lateArrivals + other.lateArrivals)
                .earlyDepartures(earlyDepartures + other.earlyDepartures)
                .regularHours(regularHours.add(other.regularHours))
                .overtimeHours(overtimeHours.add(other.overtimeHours))
                .recargo25Hours(recargo25Hours.add(other.recargo25Hours))
                .suplementario50Hours(suplementario50Hours.add(other.suplementario50Hours))
                .extraordinario100Hours(extraordinario100Hours.add(other.extraordinario100Hours))
                .nightHours(nightHours.add(other.nightHours))
                .build();
    }

    public AttendanceSummary withScheduledDays(int scheduled) {
        if (scheduled < 0) {
            throw new IllegalArgumentException("Los días programados no pueden ser negativos: " + scheduled);
        }
        return toBuilder().scheduledDays(scheduled).build();
    }

    public int getEffectiveScheduledDays() {
        return scheduledDays != null ? scheduledDays : daysWorked + daysAbsent;
    }

    public BigDecimal getTotalWorkedHours() {
        return regularHours.add(recargo25Hours).add(suplementario50Hours).add(extraordinario100Hours);
    }

    /** trabajados / programados × 100, dos decimales. */
    public BigDecimal getAttendanceRate() {
        return percentage(daysWorked, getEffectiveScheduledDays());
    }

    /** (trabajados − atrasos) / trabajados × 100, dos decimales. */
    public BigDecimal getPunctualityRate() {
        return percentage(Math.max(0, daysWorked - lateArrivals), daysWorked);
    }

    private static BigDecimal percentage(int part, int total) {
        if (total <= 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return BigDecimal.valueOf(part)
                .multiply(HUNDRED)
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }
}
