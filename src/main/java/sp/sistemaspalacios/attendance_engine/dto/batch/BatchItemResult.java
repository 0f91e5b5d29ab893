package sp.sistemaspalacios.attendance_engine.dto.batch;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;

import java.util.List;

/** Resultado de un elemento de lote (registro o empleado, según la operación). */
@Value
@Builder
public class BatchItemResult {
    Long id;
    ItemOutcome outcome;
    String message;

    @Singular
    List<AttendanceIssue> issues;

    public static BatchItemResult of(Long id, ItemOutcome outcome, String message) {
        return BatchItemResult.builder().id(id).outcome(outcome).message(message).build();
    }

    public static BatchItemResult failed(Long id, Exception ex) {
        return of(id, ItemOutcome.FAILED, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }

    public boolean isFailed() {
        return outcome == ItemOutcome.FAILED;
    }
}
