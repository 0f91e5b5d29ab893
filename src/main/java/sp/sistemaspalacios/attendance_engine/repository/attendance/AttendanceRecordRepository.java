package sp.sistemaspalacios.attendance_engine.repository.attendance;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceRecordPatch;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.exception.VersionConflictException;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Almacén de registros de asistencia. Lo implementa el servicio anfitrión;
 * el motor solo lo consume.
 */
public interface AttendanceRecordRepository {

    Optional<AttendanceRecord> findById(Long id);

    /** Registros vivos (no eliminados) del empleado en el día. */
    List<AttendanceRecord> findByEmployeeAndDate(Long employeeId, LocalDate date);

    List<AttendanceRecord> findByEmployeeAndDateRange(Long employeeId, LocalDate from, LocalDate to);

    Page<AttendanceRecord> findByBranchAndDate(Long branchId, LocalDate date, Pageable pageable);

    /** Persiste un registro nuevo y lo devuelve con id y versión asignados. */
    AttendanceRecord create(AttendanceRecord record);

    /**
     * Aplica el parche si la versión almacenada coincide con la esperada y
     * devuelve el registro con la versión incrementada.
     *
     * @throws VersionConflictException si otro proceso modificó el registro
     */
    AttendanceRecord update(Long id, long expectedVersion, AttendanceRecordPatch patch);

    AttendanceRecord softDelete(Long id, long expectedVersion, String actor, LocalDateTime at);
}
