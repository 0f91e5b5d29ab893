package sp.sistemaspalacios.attendance_engine.dto.reconciliation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;

import java.util.List;

@Value
@Builder
public class ReconciliationResult {
    Long employeeId;

    /** Registro persistido; null si no había marcaciones ni registro para el día. */
    AttendanceRecord record;

    boolean created;
    boolean updated;

    @Singular
    List<AttendanceIssue> issues;

    @Singular
    List<PunchEvent> duplicates;

    /** Marcaciones que quedan sin procesar a la espera de revisión manual. */
    @Singular
    List<PunchEvent> reviewEvents;

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
