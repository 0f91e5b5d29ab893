package sp.sistemaspalacios.attendance_engine.entity.attendance;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.dto.time.WorkPeriod;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Asistencia de un empleado en un día calendario.
 * <p>
 * Inmutable: toda modificación produce una copia con {@code version + 1}
 * (ver {@link #nextRevision()}). Soporta horario partido con dos pares
 * entrada/salida.
 */
@Value
@Builder(toBuilder = true)
public class AttendanceRecord {

    Long id;
    Long employeeId;
    LocalDate date;

    LocalTime entry;
    LocalTime exit;
    LocalTime entry2;
    LocalTime exit2;

    /** Minutos de almuerzo; null = usar el valor por defecto de la configuración. */
    Integer lunchMinutes;

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

    @Builder.Default
    AttendanceStatus status = AttendanceStatus.PENDING;

    boolean manualEntry;
    String notes;
    String modifiedBy;
    LocalDateTime modifiedAt;
    LocalDateTime createdAt;
    LocalDateTime deletedAt;

    long version;

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean hasEntry() {
        return entry != null || entry2 != null;
    }

    /** Pares presentes (al menos un extremo informado), en orden. */
    public List<WorkPeriod> getPeriods() {
        List<WorkPeriod> periods = new ArrayList<>(2);
        if (entry != null || exit != null) {
            periods.add(new WorkPeriod(entry, exit));
        }
        if (entry2 != null || exit2 != null) {
            periods.add(new WorkPeriod(entry2, exit2));
        }
        return periods;
    }

    /** Última salida registrada del día. */
    public LocalTime getLastExit() {
        return exit2 != null ? exit2 : exit;
    }

    public HoursBreakdown getHours() {
        return new HoursBreakdown(regularHours, overtimeHours, recargo25Hours,
                suplementario50Hours, extraordinario100Hours, nightHours);
    }

    public AttendanceRecord withHours(HoursBreakdown hours) {
        return toBuilder()
                .regularHours(hours.regular())
                .overtimeHours(hours.overtime())
                .recargo25Hours(hours.recargo25())
                .suplementario50Hours(hours.suplementario50())
                .extraordinario100Hours(hours.extraordinario100())
                .nightHours(hours.nocturnas())
                .build();
    }

    /** Builder a partir de esta copia con la versión ya incrementada. */
    public AttendanceRecordBuilder nextRevision() {
        return toBuilder().version(version + 1);
    }
}
