package sp.sistemaspalacios.attendance_engine.entity.punch;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Una marcación biométrica ya decodificada por el colaborador de ingesta.
 */
@Value
@Builder(toBuilder = true)
public class PunchEvent {
    Long id;
    Long employeeId;
    Long deviceId;
    LocalDateTime timestamp;

    @Builder.Default
    MovementType movementType = MovementType.UNKNOWN;

    BigDecimal confidence;
    boolean processed;
    Long attendanceRecordId;

    public LocalDate getDate() {
        return timestamp == null ? null : timestamp.toLocalDate();
    }
}
