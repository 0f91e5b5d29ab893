package sp.sistemaspalacios.attendance_engine.service.repair;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.dto.repair.RepairResult;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aplica a cada hallazgo una única transformación determinista. Nunca inventa
 * datos: solo marca, limita a cero o da de baja lógica.
 * <p>
 * La reparación es idempotente: si ninguna transformación cambia el registro
 * se devuelve la misma instancia, sin incrementar la versión.
 */
@Service
@RequiredArgsConstructor
public class AttendanceRepairService {

    static final String SYSTEM_ACTOR = "sistema";

    private static final Comparator<AttendanceRecord> OLDEST_FIRST = Comparator
            .comparing(AttendanceRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(AttendanceRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Clock clock;

    public RepairResult repair(AttendanceRecord record, List<AttendanceIssue> issues) {
        return repair(record, issues, SYSTEM_ACTOR);
    }

    public RepairResult repair(AttendanceRecord record, List<AttendanceIssue> issues, String actor) {
        AttendanceRecordValidator.requireWellFormed(record);
        if (issues == null) {
            throw new IllegalArgumentException("La lista de hallazgos es obligatoria.");
        }
        if (record.isDeleted()) {
            return RepairResult.unchanged(record, List.of());
        }

        AttendanceRecord current = record;
        List<AttendanceIssue> applied = new ArrayList<>();
        List<AttendanceIssue> pendingReview = new ArrayList<>();

        for (AttendanceIssue issue : issues) {
            AttendanceRecord next = transform(current, issue);

            if (next == null) {
                pendingReview.add(issue);
            } else if (next != current) {
                applied.add(issue);
                current = next;
            } else if (current.getStatus() == AttendanceStatus.ABSENT && isOrderIssue(issue)) {
                // La ausencia solo se abandona por corrección manual
                pendingReview.add(issue);
            }
        }

        if (applied.isEmpty()) {
            return RepairResult.unchanged(record, pendingReview);
        }
        return new RepairResult(stamp(current, record, applied, actor), applied, pendingReview, true);
    }

    /**
     * Conserva el registro creado primero (empate: id menor) y da de baja
     * lógica al resto del grupo. Los ya eliminados no se tocan.
     */
    public List<RepairResult> repairDuplicates(List<AttendanceRecord> group, String actor) {
        if (group == null || group.isEmpty()) {
            return List.of();
        }
        group.forEach(AttendanceRecordValidator::requireWellFormed);

        AttendanceRecord keeper = group.stream()
                .filter(r -> !r.isDeleted())
                .min(OLDEST_FIRST)
                .orElse(null);

        List<RepairResult> results = new ArrayList<>(group.size());
        for (AttendanceRecord record : group) {
            if (record == keeper || record.isDeleted()) {
                results.add(RepairResult.unchanged(record, List.of()));
                continue;
            }
            AttendanceIssue issue = AttendanceIssue.builder()
                    .type(IssueType.DUPLICATE)
                    .recordId(record.getId())
                    .employeeId(record.getEmployeeId())
                    .date(record.getDate())
                    .field("id")
                    .message(String.format("Duplicado del registro %s", keeper.getId()))
                    .build();
            AttendanceRecord deleted = stamp(softDelete(record), record, List.of(issue), actor);
            results.add(new RepairResult(deleted, List.of(issue), List.of(), true));
        }
        return results;
    }

    // ==========================================
    // TRANSFORMACIONES
    // ==========================================

    /** Transformación única por tipo; null = el hallazgo va a revisión. */
    private AttendanceRecord transform(AttendanceRecord record, AttendanceIssue issue) {
        switch (issue.getType()) {
            case INCOMPLETE_PAIR:
            case TIME_ORDER_VIOLATION:
                return markInconsistent(record);
            case NEGATIVE_HOURS:
                return clampNegativeHours(record);
            case OVERTIME_TOTAL_MISMATCH:
                return recomputeOvertimeTotal(record);
            case ORPHANED_EMPLOYEE:
                return softDelete(record);
            default:
                // Los duplicados se resuelven por grupo (repairDuplicates)
                return null;
        }
    }

    private AttendanceRecord markInconsistent(AttendanceRecord record) {
        AttendanceStatus status = record.getStatus();
        if (status == AttendanceStatus.INCONSISTENT || !status.canTransitionTo(AttendanceStatus.INCONSISTENT)) {
            return record;
        }
        // Las horas quedan como estaban: no se recalculan desde datos inválidos
        return record.toBuilder().status(AttendanceStatus.INCONSISTENT).build();
    }

    private AttendanceRecord clampNegativeHours(AttendanceRecord record) {
        HoursBreakdown hours = record.getHours();
        if (!hours.hasNegative()) {
            return record;
        }
        HoursBreakdown clamped = HoursBreakdown.of(
                atLeastZero(hours.regular()),
                atLeastZero(hours.recargo25()),
                atLeastZero(hours.suplementario50()),
                atLeastZero(hours.extraordinario100()),
                atLeastZero(hours.nocturnas()));
        return record.withHours(clamped);
    }

    private AttendanceRecord recomputeOvertimeTotal(AttendanceRecord record) {
        BigDecimal tiers = record.getHours().tierSum();
        if (record.getOvertimeHours().compareTo(tiers) == 0) {
            return record;
        }
        return record.toBuilder().overtimeHours(tiers).build();
    }

    private AttendanceRecord softDelete(AttendanceRecord record) {
        if (record.isDeleted()) {
            return record;
        }
        return record.toBuilder().deletedAt(LocalDateTime.now(clock)).build();
    }

    // ===== MÉTODOS DE UTILIDAD =====

    private AttendanceRecord stamp(AttendanceRecord repaired, AttendanceRecord original,
                                   List<AttendanceIssue> applied, String actor) {
        Set<String> kinds = applied.stream()
                .map(i -> i.getType().name())
                .collect(Collectors.toCollection(LinkedHashSet::new));
        String note = "Reparación automática: " + String.join(", ", kinds);
        String notes = original.getNotes() == null || original.getNotes().isBlank()
                ? note
                : original.getNotes() + " | " + note;

        return repaired.toBuilder()
                .version(original.getVersion() + 1)
                .modifiedBy(Objects.requireNonNullElse(actor, SYSTEM_ACTOR))
                .modifiedAt(LocalDateTime.now(clock))
                .notes(notes)
                .build();
    }

    private static boolean isOrderIssue(AttendanceIssue issue) {
        return issue.getType() == IssueType.INCOMPLETE_PAIR || issue.getType() == IssueType.TIME_ORDER_VIOLATION;
    }

    private static BigDecimal atLeastZero(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }
}
