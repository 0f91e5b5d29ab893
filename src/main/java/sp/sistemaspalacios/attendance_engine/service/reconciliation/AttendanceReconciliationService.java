package sp.sistemaspalacios.attendance_engine.service.reconciliation;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.ConsistencyContext;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchItemResult;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchReport;
import sp.sistemaspalacios.attendance_engine.dto.batch.ItemOutcome;
import sp.sistemaspalacios.attendance_engine.dto.hours.ClassificationResult;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchMatchResult;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchPair;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceField;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceRecordPatch;
import sp.sistemaspalacios.attendance_engine.dto.reconciliation.ReconciliationResult;
import sp.sistemaspalacios.attendance_engine.dto.repair.RepairResult;
import sp.sistemaspalacios.attendance_engine.dto.time.WorkPeriod;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeePlacement;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeeType;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.repository.punch.PunchEventRepository;
import sp.sistemaspalacios.attendance_engine.service.classification.HourClassificationService;
import sp.sistemaspalacios.attendance_engine.service.consistency.AttendanceConsistencyService;
import sp.sistemaspalacios.attendance_engine.service.matching.PunchMatchingService;
import sp.sistemaspalacios.attendance_engine.service.repair.AttendanceRepairService;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Convierte las marcaciones pendientes de un empleado-día en su registro de
 * asistencia: emparejar, fusionar con lo existente, clasificar, verificar,
 * reparar y persistir. Toda la E/S ocurre aquí; el cálculo es del núcleo puro.
 */
@Slf4j
@Service
public class AttendanceReconciliationService {

    private static final String ACTOR = "conciliacion";

    private static final Comparator<AttendanceRecord> OLDEST_FIRST = Comparator
            .comparing(AttendanceRecord::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(AttendanceRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final AttendanceRecordRepository recordRepository;
    private final PunchEventRepository punchRepository;
    private final MasterDataRepository masterDataRepository;
    private final PunchMatchingService matchingService;
    private final HourClassificationService classificationService;
    private final AttendanceConsistencyService consistencyService;
    private final AttendanceRepairService repairService;
    private final Clock clock;
    private final Executor executor;

    public AttendanceReconciliationService(AttendanceRecordRepository recordRepository,
                                           PunchEventRepository punchRepository,
                                           MasterDataRepository masterDataRepository,
                                           PunchMatchingService matchingService,
                                           HourClassificationService classificationService,
                                           AttendanceConsistencyService consistencyService,
                                           AttendanceRepairService repairService,
                                           Clock clock,
                                           @Qualifier("reconciliationExecutor") Executor executor) {
        this.recordRepository = recordRepository;
        this.punchRepository = punchRepository;
        this.masterDataRepository = masterDataRepository;
        this.matchingService = matchingService;
        this.classificationService = classificationService;
        this.consistencyService = consistencyService;
        this.repairService = repairService;
        this.clock = clock;
        this.executor = executor;
    }

    public ReconciliationResult reconcile(Long employeeId, LocalDate date, ShiftConfiguration config) {
        if (employeeId == null || date == null) {
            throw new IllegalArgumentException("Empleado y fecha son obligatorios para conciliar.");
        }
        ShiftConfigurationValidator.validate(config);

        log.info("🔄 Conciliando empleado {} - {}", employeeId, date);

        List<PunchEvent> events = punchRepository.findUnprocessed(employeeId, date);
        List<AttendanceRecord> sameDay = recordRepository.findByEmployeeAndDate(employeeId, date).stream()
                .filter(r -> !r.isDeleted())
                .collect(Collectors.toList());
        AttendanceRecord existing = sameDay.stream().min(OLDEST_FIRST).orElse(null);

        ReconciliationResult.ReconciliationResultBuilder result = ReconciliationResult.builder().employeeId(employeeId);

        if (events.isEmpty() && existing == null) {
            log.info("ℹ️ Sin marcaciones ni registro para empleado {} el {}", employeeId, date);
            return result.build();
        }

        // ==========================================
        // PASO 1: EMPAREJAR MARCACIONES
        // ==========================================

        PunchMatchResult match = matchingService.match(events, config);
        result.issues(match.getIssues()).duplicates(match.getDuplicates()).reviewEvents(match.getReviewEvents());

        if (existing != null && existing.getStatus() == AttendanceStatus.ABSENT && !events.isEmpty()) {
            log.warn("⚠️ Registro {} marcado como ausencia; {} marcaciones quedan para revisión manual",
                    existing.getId(), events.size());
            return result.record(existing).clearDuplicates().clearReviewEvents().reviewEvents(events).build();
        }

        // ==========================================
        // PASO 2: FUSIONAR CON EL REGISTRO DEL DÍA
        // ==========================================

        AttendanceRecord base = existing != null ? existing : newPendingRecord(employeeId, date);
        MergeOutcome merge = mergePairs(base, match.getPairs());
        for (PunchEvent unmerged : merge.unmerged) {
            result.reviewEvent(unmerged);
        }
        if (!merge.unmerged.isEmpty()) {
            result.issue(AttendanceIssue.builder()
                    .type(IssueType.EXCESS_PUNCHES)
                    .recordId(base.getId())
                    .employeeId(employeeId)
                    .date(date)
                    .field("marcaciones")
                    .message(String.format("%d marcaciones no caben en los pares libres del registro",
                            merge.unmerged.size()))
                    .build());
        }

        // ==========================================
        // PASO 3: CLASIFICAR, VERIFICAR Y REPARAR
        // ==========================================

        AttendanceRecord candidate = merge.record;
        Optional<EmployeePlacement> placement = masterDataRepository.resolveEmployee(employeeId);
        EmployeeType employeeType = placement.map(EmployeePlacement::getEmployeeType).orElse(EmployeeType.REGULAR);
        ClassificationResult classification = classificationService.classify(candidate, employeeType, config);
        if (classification.isClassified()) {
            candidate = candidate.withHours(classification.breakdown());
        }

        boolean resolvable = placement.isPresent();
        List<AttendanceRecord> siblings = new ArrayList<>(sameDay);
        siblings.removeIf(r -> existing != null && Objects.equals(r.getId(), existing.getId()));
        List<AttendanceIssue> issues = consistencyService.check(candidate, new ConsistencyContext(resolvable, siblings), config);
        result.issues(issues);

        RepairResult repair = repairService.repair(candidate, issues, ACTOR);
        candidate = repair.record();
        if (!issues.isEmpty()) {
            log.warn("⚠️ Empleado {} - {}: {} hallazgos, {} reparados, {} a revisión",
                    employeeId, date, issues.size(), repair.applied().size(), repair.pendingReview().size());
        }

        // ==========================================
        // PASO 4: PERSISTIR Y MARCAR PROCESADAS
        // ==========================================

        AttendanceRecord saved;
        if (existing == null) {
            saved = recordRepository.create(candidate);
            result.created(true);
            log.info("✅ Registro {} creado para empleado {} - {}", saved.getId(), employeeId, date);
        } else {
            AttendanceRecordPatch patch = AttendanceRecordPatch.diff(existing, candidate);
            if (patch.isEmpty()) {
                saved = existing;
            } else {
                if (!patch.contains(AttendanceField.MODIFIED_AT)) {
                    patch.modifiedBy(ACTOR, LocalDateTime.now(clock));
                }
                saved = recordRepository.update(existing.getId(), existing.getVersion(), patch);
                result.updated(true);
                log.info("✅ Registro {} actualizado ({} campos) para empleado {} - {}",
                        saved.getId(), patch.fields().size(), employeeId, date);
            }
        }

        Set<Long> processedIds = new LinkedHashSet<>();
        for (PunchEvent event : match.consumedEvents()) {
            if (event.getId() != null && !merge.unmerged.contains(event)) {
                processedIds.add(event.getId());
            }
        }
        if (!processedIds.isEmpty()) {
            punchRepository.markProcessed(processedIds, saved.getId());
        }

        return result.record(saved).build();
    }

    /**
     * Concilia varios empleados del mismo día en paralelo, por lotes de
     * {@code batchChunkSize}: cada lote se espera antes de enviar el siguiente.
     * Cada empleado-día es independiente; un fallo (incluido el rechazo del
     * ejecutor) se reporta en su elemento y no afecta al resto.
     */
    public BatchReport reconcileAll(LocalDate date, List<Long> employeeIds, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        List<Long> distinct = employeeIds.stream().distinct().collect(Collectors.toList());
        int chunkSize = config.getBatchChunkSize();
        log.info("📦 Conciliación masiva {} - {} empleados en lotes de {}", date, distinct.size(), chunkSize);

        List<BatchItemResult> items = new ArrayList<>(distinct.size());
        for (int from = 0; from < distinct.size(); from += chunkSize) {
            List<Long> chunk = distinct.subList(from, Math.min(from + chunkSize, distinct.size()));

            List<CompletableFuture<BatchItemResult>> futures = chunk.stream()
                    .map(employeeId -> submit(employeeId, date, config))
                    .collect(Collectors.toList());

            items.addAll(futures.stream()
                    .map(CompletableFuture::join)
                    .collect(Collectors.toList()));
        }

        BatchReport report = new BatchReport(items, false);
        log.info("📊 Conciliación {} terminada: {}", date, report.countByOutcome());
        return report;
    }

    private CompletableFuture<BatchItemResult> submit(Long employeeId, LocalDate date, ShiftConfiguration config) {
        try {
            return CompletableFuture.supplyAsync(() -> reconcileItem(employeeId, date, config), executor);
        } catch (RejectedExecutionException ex) {
            log.error("❌ Ejecutor saturado; empleado {} - {} no se concilió", employeeId, date, ex);
            return CompletableFuture.completedFuture(BatchItemResult.failed(employeeId, ex));
        }
    }

    private BatchItemResult reconcileItem(Long employeeId, LocalDate date, ShiftConfiguration config) {
        try {
            ReconciliationResult reconciled = reconcile(employeeId, date, config);
            ItemOutcome outcome = reconciled.isCreated() || reconciled.isUpdated() ? ItemOutcome.UPDATED : ItemOutcome.UNCHANGED;
            return BatchItemResult.builder()
                    .id(employeeId)
                    .outcome(outcome)
                    .message(reconciled.getRecord() == null ? "Sin datos" : "Registro " + reconciled.getRecord().getId())
                    .issues(reconciled.getIssues())
                    .build();
        } catch (RuntimeException ex) {
            log.error("❌ Error conciliando empleado {} - {}", employeeId, date, ex);
            return BatchItemResult.failed(employeeId, ex);
        }
    }

    // ==========================================
    // FUSIÓN
    // ==========================================

    private AttendanceRecord newPendingRecord(Long employeeId, LocalDate date) {
        return AttendanceRecord.builder()
                .employeeId(employeeId)
                .date(date)
                .status(AttendanceStatus.PENDING)
                .createdAt(LocalDateTime.now(clock))
                .build();
    }

    /**
     * Las marcaciones solo ocupan huecos: una salida suelta cierra el primer par
     * abierto; un par nuevo va al primer par vacío. Nunca se sobrescribe una
     * hora ya registrada.
     */
    private MergeOutcome mergePairs(AttendanceRecord record, List<PunchPair> pairs) {
        LocalTime[] slots = {record.getEntry(), record.getExit(), record.getEntry2(), record.getExit2()};
        List<PunchEvent> unmerged = new ArrayList<>();

        for (PunchPair pair : pairs) {
            WorkPeriod period = pair.toWorkPeriod();
            LocalTime entry = period.entry();
            LocalTime exit = period.exit();

            if (entry == null) {
                int open = firstOpenPair(slots);
                if (open >= 0) {
                    slots[open * 2 + 1] = exit;
                    continue;
                }
            }
            int target = firstEmptyPair(slots);
            if (target < 0) {
                unmerged.addAll(pair.events());
                continue;
            }
            slots[target * 2] = entry;
            slots[target * 2 + 1] = exit;
        }

        AttendanceRecord merged = record.toBuilder()
                .entry(slots[0])
                .exit(slots[1])
                .entry2(slots[2])
                .exit2(slots[3])
                .build();
        return new MergeOutcome(merged, unmerged);
    }

    private int firstOpenPair(LocalTime[] slots) {
        for (int i = 0; i < 2; i++) {
            if (slots[i * 2] != null && slots[i * 2 + 1] == null) {
                return i;
            }
        }
        return -1;
    }

    private int firstEmptyPair(LocalTime[] slots) {
        for (int i = 0; i < 2; i++) {
            if (slots[i * 2] == null && slots[i * 2 + 1] == null) {
                return i;
            }
        }
        return -1;
    }

    private static final class MergeOutcome {
        private final AttendanceRecord record;
        private final List<PunchEvent> unmerged;

        private MergeOutcome(AttendanceRecord record, List<PunchEvent> unmerged) {
            this.record = record;
            this.unmerged = unmerged;
        }
    }
}
