package sp.sistemaspalacios.attendance_engine.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

/**
 * Parámetros de jornada y recargos. Varían por jurisdicción y empleador, por
 * eso nunca se fijan en el código: cada operación del motor recibe la
 * configuración como argumento y este bean es solo el valor por defecto.
 * <p>
 * Los umbrales de horas extra se miden sobre el exceso diario: con los
 * valores por defecto las dos primeras horas extra son recargo 25 %, las dos
 * siguientes suplementarias 50 % y el resto extraordinarias 100 %.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "attendance.shift")
public class ShiftConfiguration {

    @NotBlank
    private String version = "EC-2025";

    // ===== JORNADA =====

    @Min(60)
    @Max(720)
    private int standardShiftMinutes = 8 * 60;

    @Min(0)
    private int recargoLimitMinutes = 2 * 60;

    @Min(0)
    private int suplementarioLimitMinutes = 4 * 60;

    // ===== HORARIO NOCTURNO (puede cruzar medianoche) =====

    @NotNull
    private LocalTime nightStart = LocalTime.of(22, 0);

    @NotNull
    private LocalTime nightEnd = LocalTime.of(6, 0);

    // ===== ALMUERZO =====

    @Min(0)
    @Max(240)
    private int defaultLunchMinutes = 0;

    /** Ventana de almuerzo opcional; sin ventana el almuerzo se descuenta de los pares en orden. */
    private LocalTime lunchWindowStart;
    private LocalTime lunchWindowEnd;

    // ===== PUNTUALIDAD =====

    @NotNull
    private LocalTime nominalStart = LocalTime.of(8, 0);

    @NotNull
    private LocalTime nominalEnd = LocalTime.of(17, 0);

    @Min(0)
    private int graceMinutes = 10;

    // ===== ADMINISTRATIVOS =====

    /** Un día de administrativo con menos tiempo que este no suma horas. */
    @Min(0)
    @Max(720)
    private int administrativeMinimumMinutes = 4 * 60;

    // ===== MARCACIONES =====

    @Min(0)
    private int duplicateThresholdMinutes = 5;

    @NotNull
    @DecimalMin("0.0")
    private BigDecimal minimumConfidence = new BigDecimal("0.60");

    // ===== CALENDARIO =====

    @NotNull
    private Set<DayOfWeek> restDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    @NotNull
    private Set<LocalDate> holidays = new HashSet<>();

    // ===== REDONDEO Y NÓMINA =====

    @Min(0)
    @Max(6)
    private int hourScale = 2;

    @NotNull
    private BigDecimal recargoRate = new BigDecimal("0.25");

    @NotNull
    private BigDecimal suplementarioRate = new BigDecimal("0.50");

    @NotNull
    private BigDecimal extraordinarioRate = new BigDecimal("1.00");

    @NotNull
    private BigDecimal nightRate = new BigDecimal("0.25");

    /** Horas mensuales para derivar el valor hora desde el sueldo. */
    @Min(1)
    private int monthlyHours = 240;

    // ===== LOTES =====

    @Min(1)
    private int batchChunkSize = 200;

    /** Día de descanso obligatorio o feriado: todo lo trabajado es extraordinario. */
    public boolean isRestDay(LocalDate date) {
        return restDays.contains(date.getDayOfWeek()) || holidays.contains(date);
    }

    public boolean hasLunchWindow() {
        return lunchWindowStart != null && lunchWindowEnd != null;
    }
}
