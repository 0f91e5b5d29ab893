package sp.sistemaspalacios.attendance_engine.service.classification;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.hours.ClassificationResult;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.dto.time.WorkPeriod;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeeType;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;
import sp.sistemaspalacios.attendance_engine.service.common.WorkingTimeCalculatorService;
import sp.sistemaspalacios.attendance_engine.service.common.WorkingTimeCalculatorService.Interval;
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Clasifica las horas trabajadas de un día en regulares, recargo 25 %,
 * suplementarias 50 %, extraordinarias 100 % y nocturnas.
 * <p>
 * Los administrativos se cuentan del primer al último movimiento, solo si
 * alcanzan el mínimo diario, y su exceso va completo a extraordinarias.
 * <p>
 * Función pura: mismas entradas, mismo desglose. Todo el cálculo se hace en
 * segundos y se redondea una sola vez al final.
 */
@Service
@RequiredArgsConstructor
public class HourClassificationService {

    private static final int MAX_PERIODS = 2;

    private final WorkingTimeCalculatorService calculator;
    private final TimeService timeService;

    public ClassificationResult classify(AttendanceRecord record, ShiftConfiguration config) {
        return classify(record, EmployeeType.REGULAR, config);
    }

    public ClassificationResult classify(AttendanceRecord record, EmployeeType employeeType, ShiftConfiguration config) {
        AttendanceRecordValidator.requireWellFormed(record);
        return classify(record.getId(), record.getEmployeeId(), record.getDate(),
                record.getPeriods(), record.getLunchMinutes(), employeeType, config);
    }

    public ClassificationResult classify(LocalDate date, List<WorkPeriod> periods,
                                         Integer lunchMinutes, ShiftConfiguration config) {
        return classify(date, periods, lunchMinutes, EmployeeType.REGULAR, config);
    }

    public ClassificationResult classify(LocalDate date, List<WorkPeriod> periods, Integer lunchMinutes,
                                         EmployeeType employeeType, ShiftConfiguration config) {
        return classify(null, null, date, periods, lunchMinutes, employeeType, config);
    }

    private ClassificationResult classify(Long recordId, Long employeeId, LocalDate date,
                                          List<WorkPeriod> periods, Integer lunchMinutes,
                                          EmployeeType employeeType, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        if (date == null) {
            throw new IllegalArgumentException("La fecha a clasificar es obligatoria.");
        }
        if (periods == null) {
            throw new IllegalArgumentException("La lista de pares entrada/salida es obligatoria.");
        }
        if (periods.size() > MAX_PERIODS) {
            throw new IllegalArgumentException(String.format(
                    "Se admiten como máximo %d pares entrada/salida por día; recibidos %d.",
                    MAX_PERIODS, periods.size()));
        }
        if (employeeType == null) {
            throw new IllegalArgumentException("El tipo de empleado es obligatorio.");
        }
        if (lunchMinutes != null && lunchMinutes < 0) {
            throw new IllegalArgumentException("El tiempo de almuerzo no puede ser negativo.");
        }

        boolean restDay = config.isRestDay(date);
        List<AttendanceIssue> issues = new ArrayList<>();

        // ==========================================
        // PASO 1: RECHAZO POR ORDEN DE HORAS
        // ==========================================

        for (int i = 0; i < periods.size(); i++) {
            WorkPeriod period = periods.get(i);
            if (period.isReversed()) {
                issues.add(AttendanceIssue.builder()
                        .type(IssueType.TIME_ORDER_VIOLATION)
                        .recordId(recordId)
                        .employeeId(employeeId)
                        .date(date)
                        .field(exitField(i))
                        .message(String.format("Salida %s anterior a la entrada %s",
                                timeService.format(period.exit()), timeService.format(period.entry())))
                        .build());
            }
        }
        // Turno partido: el segundo par no puede empezar antes de cerrar el primero
        if (periods.size() == MAX_PERIODS) {
            LocalTime firstExit = periods.get(0).exit();
            LocalTime secondEntry = periods.get(1).entry();
            if (firstExit != null && secondEntry != null && secondEntry.isBefore(firstExit)) {
                issues.add(AttendanceIssue.builder()
                        .type(IssueType.TIME_ORDER_VIOLATION)
                        .recordId(recordId)
                        .employeeId(employeeId)
                        .date(date)
                        .field("entrada2")
                        .message(String.format("Segunda entrada %s anterior al cierre del primer par %s",
                                timeService.format(secondEntry), timeService.format(firstExit)))
                        .build());
            }
        }
        if (!issues.isEmpty()) {
            return new ClassificationResult(date, null, 0, 0, false, restDay, issues);
        }

        // ==========================================
        // PASO 2: MINUTOS TRABAJADOS Y NOCTURNOS
        // ==========================================

        boolean administrative = employeeType == EmployeeType.ADMINISTRATIVE;
        boolean incomplete = periods.stream().anyMatch(p -> !p.isComplete());
        long workedSeconds = 0;
        long nightSeconds = 0;

        if (administrative) {
            // Del primer al último movimiento del día, sin descontar almuerzo
            Interval span = firstToLastMovement(periods);
            if (span != null) {
                workedSeconds = calculator.durationSeconds(span);
                nightSeconds = calculator.overlapWithWindowSeconds(span, config.getNightStart(), config.getNightEnd());
            }
            if (workedSeconds < config.getAdministrativeMinimumMinutes() * 60L) {
                // Día por debajo del mínimo: no cuenta
                return new ClassificationResult(date, HoursBreakdown.zero(), workedSeconds, 0,
                        incomplete, restDay, issues);
            }
        } else {
            long lunchRemaining = (lunchMinutes != null ? lunchMinutes : config.getDefaultLunchMinutes()) * 60L;
            for (WorkPeriod period : periods) {
                if (!period.isComplete()) {
                    // Par abierto: no suma, el verificador decide si es inconsistente
                    continue;
                }
                Interval interval = new Interval(period.entry(), period.exit());
                long raw = calculator.durationSeconds(interval);

                long lunch = config.hasLunchWindow()
                        ? Math.min(lunchRemaining, calculator.overlapSeconds(interval,
                                new Interval(config.getLunchWindowStart(), config.getLunchWindowEnd())))
                        : Math.min(lunchRemaining, raw);
                lunchRemaining -= lunch;

                long worked = Math.max(0, raw - lunch);
                long night = calculator.overlapWithWindowSeconds(interval, config.getNightStart(), config.getNightEnd());

                workedSeconds += worked;
                nightSeconds += Math.min(night, worked);
            }
        }

        // ==========================================
        // PASO 3: TRAMOS DE RECARGO
        // ==========================================

        long regular;
        long recargo;
        long suplementario;
        long extraordinario;

        if (restDay) {
            regular = 0;
            recargo = 0;
            suplementario = 0;
            extraordinario = workedSeconds;
        } else if (administrative) {
            // Administrativos: sin recargo ni suplementarias, todo el exceso es extraordinario
            regular = Math.min(workedSeconds, config.getStandardShiftMinutes() * 60L);
            recargo = 0;
            suplementario = 0;
            extraordinario = workedSeconds - regular;
        } else {
            long standard = config.getStandardShiftMinutes() * 60L;
            long tier1 = config.getRecargoLimitMinutes() * 60L;
            long tier2 = config.getSuplementarioLimitMinutes() * 60L;

            regular = Math.min(workedSeconds, standard);
            long excess = workedSeconds - regular;
            recargo = Math.min(excess, tier1);
            suplementario = Math.min(Math.max(0, excess - tier1), tier2 - tier1);
            extraordinario = Math.max(0, excess - tier2);
        }

        int scale = config.getHourScale();
        HoursBreakdown breakdown = HoursBreakdown.of(
                timeService.secondsToHours(regular, scale),
                timeService.secondsToHours(recargo, scale),
                timeService.secondsToHours(suplementario, scale),
                timeService.secondsToHours(extraordinario, scale),
                timeService.secondsToHours(nightSeconds, scale));

        return new ClassificationResult(date, breakdown, workedSeconds, nightSeconds, incomplete, restDay, issues);
    }

    /** Primer y último movimiento registrados; null si hay menos de dos. */
    private Interval firstToLastMovement(List<WorkPeriod> periods) {
        LocalTime first = null;
        LocalTime last = null;
        int movements = 0;
        for (WorkPeriod period : periods) {
            for (LocalTime time : new LocalTime[]{period.entry(), period.exit()}) {
                if (time == null) {
                    continue;
                }
                movements++;
                if (first == null || time.isBefore(first)) {
                    first = time;
                }
                if (last == null || time.isAfter(last)) {
                    last = time;
                }
            }
        }
        return movements < 2 ? null : new Interval(first, last);
    }

    private String exitField(int index) {
        return index == 0 ? "salida" : "salida2";
    }
}
