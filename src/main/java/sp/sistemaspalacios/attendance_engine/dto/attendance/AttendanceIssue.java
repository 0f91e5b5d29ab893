package sp.sistemaspalacios.attendance_engine.dto.attendance;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Hallazgo de calidad de datos. Es un valor, nunca una excepción: lo
 * consumen el motor de reparación o la cola de revisión humana.
 */
@Value
@Builder
public class AttendanceIssue {
    IssueType type;
    Long recordId;
    Long employeeId;
    LocalDate date;
    /** Campo afectado (entrada, salida2, horasRecargo...), si aplica. */
    String field;
    String message;
}
