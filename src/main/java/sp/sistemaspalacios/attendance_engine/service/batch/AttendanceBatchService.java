package sp.sistemaspalacios.attendance_engine.service.batch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.ConsistencyContext;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.batch.AggregationReport;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchItemResult;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchReport;
import sp.sistemaspalacios.attendance_engine.dto.batch.ItemOutcome;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceRecordPatch;
import sp.sistemaspalacios.attendance_engine.dto.report.AttendanceSummary;
import sp.sistemaspalacios.attendance_engine.dto.report.Granularity;
import sp.sistemaspalacios.attendance_engine.dto.report.TrendPoint;
import sp.sistemaspalacios.attendance_engine.dto.repair.RepairResult;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.exception.ResourceNotFoundException;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.service.aggregation.AttendanceAggregationService;
import sp.sistemaspalacios.attendance_engine.service.consistency.AttendanceConsistencyService;
import sp.sistemaspalacios.attendance_engine.service.repair.AttendanceRepairService;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * Reparación y agregación masivas por lotes. Cada lote se procesa completo
 * antes de consultar la cancelación, y cada registro se confirma por
 * separado, de modo que un reintento con los ids ya confirmados no repite
 * trabajo.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AttendanceBatchService {

    private static final String ACTOR = "reparacion-lote";

    private final AttendanceRecordRepository recordRepository;
    private final MasterDataRepository masterDataRepository;
    private final AttendanceConsistencyService consistencyService;
    private final AttendanceRepairService repairService;
    private final AttendanceAggregationService aggregationService;

    // ==========================================
    // REPARACIÓN MASIVA
    // ==========================================

    public BatchReport repairAll(List<Long> recordIds, Collection<Long> alreadyCommitted,
                                 BooleanSupplier cancelled, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        if (recordIds == null) {
            throw new IllegalArgumentException("La lista de registros es obligatoria.");
        }
        Set<Long> committed = alreadyCommitted == null ? Set.of() : Set.copyOf(alreadyCommitted);
        BooleanSupplier isCancelled = cancelled == null ? () -> false : cancelled;

        List<List<Long>> chunks = chunk(new ArrayList<>(new LinkedHashSet<>(recordIds)), config.getBatchChunkSize());
        log.info("🛠️ Reparación masiva: {} registros en {} lotes", recordIds.size(), chunks.size());

        List<BatchItemResult> items = new ArrayList<>();
        boolean wasCancelled = false;
        for (int c = 0; c < chunks.size(); c++) {
            List<Long> chunk = chunks.get(c);
            if (isCancelled.getAsBoolean()) {
                wasCancelled = true;
                log.warn("⏹️ Reparación cancelada antes del lote {}/{}", c + 1, chunks.size());
                for (int rest = c; rest < chunks.size(); rest++) {
                    chunks.get(rest).forEach(id -> items.add(BatchItemResult.of(id, ItemOutcome.CANCELLED, "Lote cancelado")));
                }
                break;
            }
            for (Long id : chunk) {
                if (committed.contains(id)) {
                    items.add(BatchItemResult.of(id, ItemOutcome.SKIPPED, "Confirmado en una ejecución anterior"));
                    continue;
                }
                items.add(repairItem(id, config));
            }
            log.info("✅ Lote {}/{} procesado", c + 1, chunks.size());
        }

        BatchReport report = new BatchReport(items, wasCancelled);
        log.info("📊 Reparación masiva terminada: {}", report.countByOutcome());
        return report;
    }

    private BatchItemResult repairItem(Long recordId, ShiftConfiguration config) {
        try {
            return repairOne(recordId, config);
        } catch (RuntimeException ex) {
            log.error("❌ Error reparando registro {}", recordId, ex);
            return BatchItemResult.failed(recordId, ex);
        }
    }

    private BatchItemResult repairOne(Long recordId, ShiftConfiguration config) {
        AttendanceRecord record = recordRepository.findById(recordId)
                .orElseThrow(() -> new ResourceNotFoundException("Registro de asistencia no encontrado: " + recordId));
        if (record.isDeleted()) {
            return BatchItemResult.of(recordId, ItemOutcome.UNCHANGED, "Registro ya eliminado");
        }

        List<AttendanceRecord> sameDay = recordRepository.findByEmployeeAndDate(record.getEmployeeId(), record.getDate());
        boolean resolvable = masterDataRepository.resolveEmployee(record.getEmployeeId()).isPresent();
        List<AttendanceIssue> issues = consistencyService.check(record, new ConsistencyContext(resolvable, sameDay), config);
        if (issues.isEmpty()) {
            return BatchItemResult.of(recordId, ItemOutcome.UNCHANGED, "Sin hallazgos");
        }

        AttendanceRecord repaired = record;
        List<AttendanceIssue> applied = new ArrayList<>();

        if (issues.stream().anyMatch(i -> i.getType() == IssueType.DUPLICATE)) {
            RepairResult duplicateRepair = repairDuplicateGroup(record, sameDay, config);
            if (duplicateRepair != null && duplicateRepair.changed()) {
                repaired = duplicateRepair.record();
                applied.addAll(duplicateRepair.applied());
            }
        }
        if (!repaired.isDeleted()) {
            RepairResult result = repairService.repair(repaired, issues, ACTOR);
            repaired = result.record();
            applied.addAll(result.applied());
        }

        if (applied.isEmpty()) {
            return BatchItemResult.builder()
                    .id(recordId)
                    .outcome(ItemOutcome.UNCHANGED)
                    .message("Hallazgos pendientes de revisión")
                    .issues(issues)
                    .build();
        }

        commit(record, repaired);
        return BatchItemResult.builder()
                .id(recordId)
                .outcome(ItemOutcome.UPDATED)
                .message(repaired.isDeleted() ? "Registro eliminado" : "Registro reparado")
                .issues(applied)
                .build();
    }

    /** Resultado de la regla de duplicados para este registro dentro de su grupo. */
    private RepairResult repairDuplicateGroup(AttendanceRecord record, List<AttendanceRecord> sameDay,
                                              ShiftConfiguration config) {
        List<AttendanceRecord> candidates = new ArrayList<>(sameDay);
        if (candidates.stream().noneMatch(r -> Objects.equals(r.getId(), record.getId()))) {
            candidates.add(record);
        }
        for (List<AttendanceRecord> group : consistencyService.findDuplicateGroups(candidates, config)) {
            boolean containsRecord = group.stream().anyMatch(r -> Objects.equals(r.getId(), record.getId()));
            if (!containsRecord) {
                continue;
            }
            // Siempre la copia recién leída del registro en proceso
            List<AttendanceRecord> fresh = group.stream()
                    .map(r -> Objects.equals(r.getId(), record.getId()) ? record : r)
                    .collect(Collectors.toList());
            return repairService.repairDuplicates(fresh, ACTOR).stream()
                    .filter(r -> Objects.equals(r.record().getId(), record.getId()))
                    .findFirst()
                    .orElse(null);
        }
        return null;
    }

    private void commit(AttendanceRecord before, AttendanceRecord after) {
        if (after.isDeleted() && !before.isDeleted()) {
            recordRepository.softDelete(before.getId(), before.getVersion(), after.getModifiedBy(), after.getDeletedAt());
            log.info("🗑️ Registro {} eliminado lógicamente", before.getId());
            return;
        }
        AttendanceRecordPatch patch = AttendanceRecordPatch.diff(before, after);
        recordRepository.update(before.getId(), before.getVersion(), patch);
        log.info("🔧 Registro {} reparado ({} campos)", before.getId(), patch.fields().size());
    }

    // ==========================================
    // AGREGACIÓN MASIVA
    // ==========================================

    /**
     * Agrega por empleado el rango [from, to], en lotes de empleados. Los
     * agregados parciales se combinan sin releer registros; una cancelación
     * deja el total con los lotes ya completados.
     */
    public AggregationReport summarizeEmployees(List<Long> employeeIds, LocalDate from, LocalDate to,
                                                Granularity granularity, BooleanSupplier cancelled,
                                                ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        if (employeeIds == null || from == null || to == null || granularity == null) {
            throw new IllegalArgumentException("Empleados, rango de fechas y granularidad son obligatorios.");
        }
        BooleanSupplier isCancelled = cancelled == null ? () -> false : cancelled;

        Map<Long, AttendanceSummary> byEmployee = new LinkedHashMap<>();
        Map<Long, List<TrendPoint>> trends = new LinkedHashMap<>();
        List<BatchItemResult> items = new ArrayList<>();
        boolean wasCancelled = false;

        List<List<Long>> chunks = chunk(new ArrayList<>(new LinkedHashSet<>(employeeIds)), config.getBatchChunkSize());
        for (int c = 0; c < chunks.size(); c++) {
            if (isCancelled.getAsBoolean()) {
                wasCancelled = true;
                log.warn("⏹️ Agregación cancelada antes del lote {}/{}", c + 1, chunks.size());
                for (int rest = c; rest < chunks.size(); rest++) {
                    chunks.get(rest).forEach(id -> items.add(BatchItemResult.of(id, ItemOutcome.CANCELLED, "Lote cancelado")));
                }
                break;
            }
            for (Long employeeId : chunks.get(c)) {
                try {
                    List<AttendanceRecord> records = recordRepository.findByEmployeeAndDateRange(employeeId, from, to);
                    byEmployee.put(employeeId, aggregationService.summarizePeriod(records, from, to, config));
                    trends.put(employeeId, aggregationService.trend(records, granularity, config));
                    items.add(BatchItemResult.of(employeeId, ItemOutcome.UPDATED, records.size() + " registros"));
                } catch (RuntimeException ex) {
                    log.error("❌ Error agregando empleado {} ({} - {})", employeeId, from, to, ex);
                    items.add(BatchItemResult.failed(employeeId, ex));
                }
            }
        }

        return AggregationReport.builder()
                .total(aggregationService.combineAll(byEmployee.values()))
                .byEmployee(byEmployee)
                .trends(trends)
                .items(new BatchReport(items, wasCancelled))
                .build();
    }

    /** Agregado de una sucursal en un día, leyendo el almacén página por página. */
    public AttendanceSummary summarizeBranchDay(Long branchId, LocalDate date, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        AttendanceSummary total = AttendanceSummary.empty();
        Pageable pageable = PageRequest.of(0, config.getBatchChunkSize());
        Page<AttendanceRecord> page;
        do {
            page = recordRepository.findByBranchAndDate(branchId, date, pageable);
            total = total.combine(aggregationService.summarize(page.getContent(), config));
            pageable = page.nextPageable();
        } while (page.hasNext());

        log.info("📊 Sucursal {} - {}: {} registros", branchId, date, total.getRecordCount());
        return total;
    }

    private static <T> List<List<T>> chunk(List<T> values, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < values.size(); i += size) {
            chunks.add(new ArrayList<>(values.subList(i, Math.min(values.size(), i + size))));
        }
        return chunks;
    }
}
