package sp.sistemaspalacios.attendance_engine.dto.report;

import java.time.LocalDate;

/** Un punto de la serie: ventana etiquetada canónicamente y su agregado. */
public record TrendPoint(String periodKey, LocalDate periodStart, AttendanceSummary summary) {
}
