package sp.sistemaspalacios.attendance_engine.service.batch;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.batch.AggregationReport;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchItemResult;
import sp.sistemaspalacios.attendance_engine.dto.batch.BatchReport;
import sp.sistemaspalacios.attendance_engine.dto.batch.ItemOutcome;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceField;
import sp.sistemaspalacios.attendance_engine.dto.patch.AttendanceRecordPatch;
import sp.sistemaspalacios.attendance_engine.dto.report.AttendanceSummary;
import sp.sistemaspalacios.attendance_engine.dto.report.Granularity;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeePlacement;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.service.aggregation.AttendanceAggregationService;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;
import sp.sistemaspalacios.attendance_engine.service.consistency.AttendanceConsistencyService;
import sp.sistemaspalacios.attendance_engine.service.repair.AttendanceRepairService;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AttendanceBatchServiceTest {

    private static final LocalDate DAY = LocalDate.of(2025, 3, 4);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-06T02:00:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime NOW = LocalDateTime.of(2025, 3, 6, 2, 0);

    @Mock
    private AttendanceRecordRepository recordRepository;
    @Mock
    private MasterDataRepository masterDataRepository;

    private final ShiftConfiguration config = new ShiftConfiguration();
    private AttendanceBatchService batch;

    @BeforeEach
    void setUp() {
        TimeService timeService = new TimeService();
        batch = new AttendanceBatchService(
                recordRepository,
                masterDataRepository,
                new AttendanceConsistencyService(timeService),
                new AttendanceRepairService(CLOCK),
                new AttendanceAggregationService(timeService));
    }

    private static AttendanceRecord.AttendanceRecordBuilder record(long id, String entry, String exit) {
        return AttendanceRecord.builder()
                .id(id)
                .employeeId(10L)
                .date(DAY)
                .entry(entry == null ? null : LocalTime.parse(entry))
                .exit(exit == null ? null : LocalTime.parse(exit))
                .createdAt(LocalDateTime.of(DAY, LocalTime.of(7, 0)).plusMinutes(id))
                .version(1);
    }

    private void employeeIsKnown() {
        when(masterDataRepository.resolveEmployee(10L)).thenReturn(Optional.of(
                EmployeePlacement.builder().employeeId(10L).branchId(3L).build()));
    }

    // ===== REPARACIÓN =====

    @Test
    void repairAll_reportsEachRecordIndependently() {
        config.setBatchChunkSize(2);
        AttendanceRecord open = record(1, "08:00", null).status(AttendanceStatus.COMPLETE).build();
        when(recordRepository.findById(1L)).thenReturn(Optional.of(open));
        when(recordRepository.findById(3L)).thenReturn(Optional.empty());
        when(recordRepository.findByEmployeeAndDate(10L, DAY)).thenReturn(List.of(open));
        employeeIsKnown();

        BatchReport report = batch.repairAll(List.of(1L, 2L, 3L, 1L), Set.of(2L), null, config);

        assertThat(report.getItems()).extracting(BatchItemResult::getOutcome)
                .containsExactly(ItemOutcome.UPDATED, ItemOutcome.SKIPPED, ItemOutcome.FAILED);
        assertThat(report.committedIds()).containsExactly(1L, 2L);
        assertThat(report.retryableIds()).containsExactly(3L);
        assertThat(report.getItems().get(2).isFailed()).isTrue();
        assertThat(report.isCancelled()).isFalse();

        ArgumentCaptor<AttendanceRecordPatch> patch = ArgumentCaptor.forClass(AttendanceRecordPatch.class);
        verify(recordRepository).update(eq(1L), eq(1L), patch.capture());
        assertThat(patch.getValue().get(AttendanceField.STATUS)).contains(AttendanceStatus.INCONSISTENT);
        assertThat(patch.getValue().get(AttendanceField.MODIFIED_BY)).contains("reparacion-lote");
    }

    @Test
    void repairAll_stopsBetweenChunksWhenCancelled() {
        config.setBatchChunkSize(1);
        AttendanceRecord healthy = record(1, "08:00", "16:00").build();
        when(recordRepository.findById(1L)).thenReturn(Optional.of(healthy));
        when(recordRepository.findByEmployeeAndDate(10L, DAY)).thenReturn(List.of(healthy));
        employeeIsKnown();
        AtomicInteger checks = new AtomicInteger();

        BatchReport report = batch.repairAll(List.of(1L, 2L, 3L), null, () -> checks.incrementAndGet() > 1, config);

        assertThat(report.isCancelled()).isTrue();
        assertThat(report.count(ItemOutcome.UNCHANGED)).isEqualTo(1);
        assertThat(report.count(ItemOutcome.CANCELLED)).isEqualTo(2);
        assertThat(report.retryableIds()).containsExactly(2L, 3L);
        verify(recordRepository, never()).findById(2L);
        verify(recordRepository, never()).update(anyLong(), anyLong(), any());
    }

    @Test
    void repairAll_keepsOldestDuplicate_andSoftDeletesTheOther() {
        AttendanceRecord oldest = record(10, "08:00", "16:00").build();
        AttendanceRecord copy = record(11, "08:02", "16:00").build();
        when(recordRepository.findById(10L)).thenReturn(Optional.of(oldest));
        when(recordRepository.findById(11L)).thenReturn(Optional.of(copy));
        when(recordRepository.findByEmployeeAndDate(10L, DAY)).thenReturn(List.of(oldest, copy));
        employeeIsKnown();

        BatchReport report = batch.repairAll(List.of(10L, 11L), List.of(), () -> false, config);

        assertThat(report.getItems()).extracting(BatchItemResult::getOutcome)
                .containsExactly(ItemOutcome.UNCHANGED, ItemOutcome.UPDATED);
        assertThat(report.getItems().get(1).getMessage()).isEqualTo("Registro eliminado");
        verify(recordRepository).softDelete(11L, 1L, "reparacion-lote", NOW);
        verify(recordRepository, never()).softDelete(eq(10L), anyLong(), any(), any());
        verify(recordRepository, never()).update(anyLong(), anyLong(), any());
    }

    @Test
    void repairAll_leavesAlreadyDeletedRecordAlone() {
        when(recordRepository.findById(1L)).thenReturn(Optional.of(record(1, "08:00", null).deletedAt(NOW).build()));

        BatchReport report = batch.repairAll(List.of(1L), null, null, config);

        assertThat(report.count(ItemOutcome.UNCHANGED)).isEqualTo(1);
        verify(recordRepository, never()).findByEmployeeAndDate(any(), any());
    }

    // ===== AGREGACIÓN =====

    @Test
    void summarizeEmployees_combinesPartialsAndIsolatesFailures() {
        LocalDate from = LocalDate.of(2025, 3, 3);
        LocalDate to = LocalDate.of(2025, 3, 7);
        when(recordRepository.findByEmployeeAndDateRange(1L, from, to)).thenReturn(List.of(
                record(1, "08:00", "16:00").employeeId(1L).build(),
                record(2, "08:00", "16:00").employeeId(1L).date(DAY.plusDays(1)).build()));
        when(recordRepository.findByEmployeeAndDateRange(2L, from, to)).thenThrow(new IllegalStateException("timeout"));

        AggregationReport report = batch.summarizeEmployees(List.of(1L, 2L), from, to, Granularity.DAY, null, config);

        assertThat(report.getTotal().getRecordCount()).isEqualTo(2);
        assertThat(report.getTotal().getDaysWorked()).isEqualTo(2);
        assertThat(report.getByEmployee()).containsOnlyKeys(1L);
        assertThat(report.getTrends().get(1L)).hasSize(2);
        assertThat(report.getItems().count(ItemOutcome.FAILED)).isEqualTo(1);
        assertThat(report.getItems().retryableIds()).containsExactly(2L);
    }

    @Test
    void summarizeBranchDay_readsEveryPage() {
        config.setBatchChunkSize(1);
        PageRequest first = PageRequest.of(0, 1);
        when(recordRepository.findByBranchAndDate(eq(3L), eq(DAY), any())).thenReturn(
                new PageImpl<>(List.of(record(1, "08:00", "16:00").build()), first, 2),
                new PageImpl<>(List.of(record(2, "08:30", "16:00").employeeId(11L).build()), first.next(), 2));

        AttendanceSummary summary = batch.summarizeBranchDay(3L, DAY, config);

        assertThat(summary.getRecordCount()).isEqualTo(2);
        assertThat(summary.getDaysWorked()).isEqualTo(2);
        assertThat(summary.getLateArrivals()).isEqualTo(1);

        ArgumentCaptor<Pageable> pages = ArgumentCaptor.forClass(Pageable.class);
        verify(recordRepository, times(2)).findByBranchAndDate(eq(3L), eq(DAY), pages.capture());
        assertThat(pages.getAllValues()).extracting(Pageable::getPageNumber).containsExactly(0, 1);
    }
}
