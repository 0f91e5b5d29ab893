package sp.sistemaspalacios.attendance_engine.dto.hours;

import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;

import java.time.LocalDate;
import java.util.List;

/**
 * Resultado de clasificar un día: el desglose (null si el día fue rechazado
 * por orden de horas inválido) junto con los hallazgos detectados.
 */
public record ClassificationResult(LocalDate date,
                                   HoursBreakdown breakdown,
                                   long workedSeconds,
                                   long nightSeconds,
                                   boolean incomplete,
                                   boolean restDay,
                                   List<AttendanceIssue> issues) {

    public ClassificationResult {
        issues = List.copyOf(issues);
    }

    public boolean isClassified() {
        return breakdown != null;
    }
}
