package sp.sistemaspalacios.attendance_engine.dto.repair;

import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;

import java.util.List;

/**
 * Resultado de reparar un registro.
 *
 * @param record        registro resultante (igual al de entrada si no hubo cambios)
 * @param applied       hallazgos que produjeron una transformación
 * @param pendingReview hallazgos que requieren revisión humana
 * @param changed       si el registro cambió y su versión se incrementó
 */
public record RepairResult(AttendanceRecord record,
                           List<AttendanceIssue> applied,
                           List<AttendanceIssue> pendingReview,
                           boolean changed) {

    public RepairResult {
        applied = List.copyOf(applied);
        pendingReview = List.copyOf(pendingReview);
    }

    public static RepairResult unchanged(AttendanceRecord record, List<AttendanceIssue> pendingReview) {
        return new RepairResult(record, List.of(), pendingReview, false);
    }
}
