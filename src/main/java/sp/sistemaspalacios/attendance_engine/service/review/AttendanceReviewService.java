package sp.sistemaspalacios.attendance_engine.service.review;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.ConsistencyContext;
import sp.sistemaspalacios.attendance_engine.dto.hours.ClassificationResult;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceField;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceRecordPatch;
import sp.sistemaspalacios.attendance_engine.dto.time.WorkPeriod;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeePlacement;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeeType;
import sp.sistemaspalacios.attendance_engine.exception.InvalidStatusTransitionException;
import sp.sistemaspalacios.attendance_engine.exception.ResourceNotFoundException;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.service.classification.HourClassificationService;
import sp.sistemaspalacios.attendance_engine.service.consistency.AttendanceConsistencyService;
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Acciones de revisión humana sobre un registro: aprobar, rechazar, enviar a
 * revisión, marcar ausencia y corrección manual.
 * <p>
 * Cada acción tiene una variante pura, que devuelve la nueva revisión del
 * registro, y una variante por id que la persiste con verificación de versión.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceReviewService {

    private static final Set<AttendanceField> TIME_FIELDS = EnumSet.of(
            AttendanceField.ENTRY, AttendanceField.EXIT, AttendanceField.ENTRY2, AttendanceField.EXIT2,
            AttendanceField.LUNCH_MINUTES);

    private static final Set<AttendanceField> HOUR_FIELDS = EnumSet.of(
            AttendanceField.REGULAR_HOURS, AttendanceField.OVERTIME_HOURS, AttendanceField.RECARGO25_HOURS,
            AttendanceField.SUPLEMENTARIO50_HOURS, AttendanceField.EXTRAORDINARIO100_HOURS,
            AttendanceField.NIGHT_HOURS);

    private final AttendanceRecordRepository recordRepository;
    private final MasterDataRepository masterDataRepository;
    private final AttendanceConsistencyService consistencyService;
    private final HourClassificationService classificationService;
    private final Clock clock;

    // ==========================================
    // ACCIONES PURAS
    // ==========================================

    /**
     * Aprueba el registro: requiere todos los pares cerrados y ningún hallazgo
     * estructural.
     */
    public AttendanceRecord approve(AttendanceRecord record, ConsistencyContext context, String actor,
                                    ShiftConfiguration config) {
        AttendanceRecordValidator.requireWellFormed(record);
        requireActor(actor);
        AttendanceStatus status = record.getStatus();
        if (!status.isApprovable()) {
            throw new InvalidStatusTransitionException(status, AttendanceStatus.COMPLETE,
                    "El registro en estado " + status.getDescription() + " no puede aprobarse.");
        }

        List<WorkPeriod> periods = record.getPeriods();
        if (periods.isEmpty() || periods.stream().anyMatch(p -> !p.isComplete())) {
            throw new InvalidStatusTransitionException(status, AttendanceStatus.COMPLETE,
                    "Para aprobar se requieren entrada y salida en todos los pares.");
        }

        List<AttendanceIssue> structural = consistencyService.check(record, context, config).stream()
                .filter(i -> i.getType().isStructural())
                .collect(Collectors.toList());
        if (!structural.isEmpty()) {
            throw new InvalidStatusTransitionException(status, AttendanceStatus.COMPLETE,
                    "El registro tiene inconsistencias: " + structural.stream()
                            .map(AttendanceIssue::getMessage)
                            .collect(Collectors.joining("; ")));
        }

        return stamp(record.nextRevision().status(AttendanceStatus.COMPLETE).build(), actor, null);
    }

    public AttendanceRecord reject(AttendanceRecord record, String actor, String reason) {
        AttendanceRecordValidator.requireWellFormed(record);
        requireActor(actor);
        requireTransition(record.getStatus(), AttendanceStatus.INCONSISTENT);
        return stamp(record.nextRevision().status(AttendanceStatus.INCONSISTENT).build(), actor,
                "Rechazado: " + orDefault(reason));
    }

    public AttendanceRecord sendToReview(AttendanceRecord record, String actor, String reason) {
        AttendanceRecordValidator.requireWellFormed(record);
        requireActor(actor);
        requireTransition(record.getStatus(), AttendanceStatus.UNDER_REVIEW);
        return stamp(record.nextRevision().status(AttendanceStatus.UNDER_REVIEW).build(), actor,
                "En revisión: " + orDefault(reason));
    }

    /** Solo un registro pendiente puede marcarse como ausencia; se limpian horas y marcaciones. */
    public AttendanceRecord markAbsent(AttendanceRecord record, String actor, String reason) {
        AttendanceRecordValidator.requireWellFormed(record);
        requireActor(actor);
        if (record.getStatus() != AttendanceStatus.PENDING) {
            throw new InvalidStatusTransitionException(record.getStatus(), AttendanceStatus.ABSENT,
                    "Solo un registro pendiente puede marcarse como ausencia.");
        }
        AttendanceRecord absent = record.nextRevision()
                .status(AttendanceStatus.ABSENT)
                .entry(null)
                .exit(null)
                .entry2(null)
                .exit2(null)
                .lunchMinutes(null)
                .build()
                .withHours(HoursBreakdown.zero());
        return stamp(absent, actor, "Ausencia: " + orDefault(reason));
    }

    /**
     * Corrección manual: admite cualquier estado de origen, incluida la
     * ausencia. Si cambian horas de marcación y no se informan las horas
     * clasificadas, se reclasifica el día. Sin estado explícito queda MODIFIED.
     */
    public AttendanceRecord manualOverride(AttendanceRecord record, AttendanceRecordPatch changes, String actor,
                                           String reason, ShiftConfiguration config) {
        return manualOverride(record, changes, actor, reason, EmployeeType.REGULAR, config);
    }

    public AttendanceRecord manualOverride(AttendanceRecord record, AttendanceRecordPatch changes, String actor,
                                           String reason, EmployeeType employeeType, ShiftConfiguration config) {
        AttendanceRecordValidator.requireWellFormed(record);
        requireActor(actor);
        if (changes == null || changes.isEmpty()) {
            throw new IllegalArgumentException("La corrección manual no contiene cambios.");
        }

        AttendanceRecord corrected = changes.applyTo(record).toBuilder()
                .version(record.getVersion() + 1)
                .manualEntry(true)
                .build();
        if (!changes.contains(AttendanceField.STATUS)) {
            corrected = corrected.toBuilder().status(AttendanceStatus.MODIFIED).build();
        }

        boolean timesChanged = changes.fields().stream().anyMatch(TIME_FIELDS::contains);
        boolean hoursGiven = changes.fields().stream().anyMatch(HOUR_FIELDS::contains);
        if (timesChanged && !hoursGiven) {
            ClassificationResult classification = classificationService.classify(corrected, employeeType, config);
            if (classification.isClassified()) {
                corrected = corrected.withHours(classification.breakdown());
            }
        }
        return stamp(corrected, actor, "Corrección manual: " + orDefault(reason));
    }

    // ==========================================
    // ACCIONES PERSISTIDAS
    // ==========================================

    public AttendanceRecord approve(Long recordId, String actor, ShiftConfiguration config) {
        AttendanceRecord record = load(recordId);
        List<AttendanceRecord> sameDay = recordRepository.findByEmployeeAndDate(record.getEmployeeId(), record.getDate());
        boolean resolvable = masterDataRepository.resolveEmployee(record.getEmployeeId()).isPresent();
        return persist(record, approve(record, new ConsistencyContext(resolvable, sameDay), actor, config), "aprobado");
    }

    public AttendanceRecord reject(Long recordId, String actor, String reason) {
        AttendanceRecord record = load(recordId);
        return persist(record, reject(record, actor, reason), "rechazado");
    }

    public AttendanceRecord sendToReview(Long recordId, String actor, String reason) {
        AttendanceRecord record = load(recordId);
        return persist(record, sendToReview(record, actor, reason), "enviado a revisión");
    }

    public AttendanceRecord markAbsent(Long recordId, String actor, String reason) {
        AttendanceRecord record = load(recordId);
        return persist(record, markAbsent(record, actor, reason), "marcado como ausencia");
    }

    public AttendanceRecord manualOverride(Long recordId, AttendanceRecordPatch changes, String actor,
                                           String reason, ShiftConfiguration config) {
        AttendanceRecord record = load(recordId);
        EmployeeType employeeType = masterDataRepository.resolveEmployee(record.getEmployeeId())
                .map(EmployeePlacement::getEmployeeType)
                .orElse(EmployeeType.REGULAR);
        return persist(record, manualOverride(record, changes, actor, reason, employeeType, config),
                "corregido manualmente");
    }

    // ===== MÉTODOS DE UTILIDAD =====

    private AttendanceRecord load(Long recordId) {
        if (recordId == null) {
            throw new IllegalArgumentException("El id del registro es obligatorio.");
        }
        AttendanceRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Registro de asistencia no encontrado: " + recordId));
        if (record.isDeleted()) {
            throw new ResourceNotFoundException("El registro de asistencia " + recordId + " fue eliminado.");
        }
        return record;
    }

    private AttendanceRecord persist(AttendanceRecord before, AttendanceRecord after, String action) {
        AttendanceRecordPatch patch = AttendanceRecordPatch.diff(before, after);
        AttendanceRecord saved = recordRepository.update(before.getId(), before.getVersion(), patch);
        log.info("📝 Registro {} {} por {} ({} -> {})",
                before.getId(), action, after.getModifiedBy(), before.getStatus(), after.getStatus());
        return saved;
    }

    private AttendanceRecord stamp(AttendanceRecord record, String actor, String note) {
        String notes = record.getNotes();
        if (note != null) {
            notes = notes == null || notes.isBlank() ? note : notes + " | " + note;
        }
        return record.toBuilder()
                .modifiedBy(actor)
                .modifiedAt(LocalDateTime.now(clock))
                .notes(notes)
                .build();
    }

    private void requireTransition(AttendanceStatus from, AttendanceStatus to) {
        if (from == AttendanceStatus.ABSENT || !from.canTransitionTo(to)) {
            throw new InvalidStatusTransitionException(from, to, String.format(
                    "Transición no permitida: %s -> %s", from.getDescription(), to.getDescription()));
        }
    }

    private void requireActor(String actor) {
        if (actor == null || actor.isBlank()) {
            throw new IllegalArgumentException("Se requiere el usuario que realiza la acción.");
        }
    }

    private String orDefault(String reason) {
        return reason == null || reason.isBlank() ? "sin motivo" : reason.trim();
    }
}
