package sp.sistemaspalacios.attendance_engine.service.aggregation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.report.AttendanceSummary;
import sp.sistemaspalacios.attendance_engine.dto.report.Granularity;
import sp.sistemaspalacios.attendance_engine.dto.report.GroupBy;
import sp.sistemaspalacios.attendance_engine.dto.report.GroupKey;
import sp.sistemaspalacios.attendance_engine.dto.report.TrendPoint;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeePlacement;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AttendanceAggregationServiceTest {

    private final AttendanceAggregationService aggregator = new AttendanceAggregationService(new TimeService());

    private ShiftConfiguration config;
    private long nextId;

    @BeforeEach
    void setUp() {
        config = new ShiftConfiguration();
        nextId = 1;
    }

    private AttendanceRecord worked(long employeeId, LocalDate date, String entry, String exit) {
        return AttendanceRecord.builder()
                .id(nextId++)
                .employeeId(employeeId)
                .date(date)
                .entry(LocalTime.parse(entry))
                .exit(LocalTime.parse(exit))
                .regularHours(new BigDecimal("8.00"))
                .recargo25Hours(new BigDecimal("0.50"))
                .overtimeHours(new BigDecimal("0.50"))
                .status(AttendanceStatus.COMPLETE)
                .build();
    }

    private AttendanceRecord absent(long employeeId, LocalDate date) {
        return AttendanceRecord.builder()
                .id(nextId++)
                .employeeId(employeeId)
                .date(date)
                .status(AttendanceStatus.ABSENT)
                .build();
    }

    /** 22 días hábiles desde el lunes 3 de marzo de 2025 (hasta el 1 de abril): 2 ausencias y 20 trabajados. */
    private List<AttendanceRecord> march(long employeeId) {
        List<AttendanceRecord> records = new ArrayList<>();
        LocalDate day = LocalDate.of(2025, 3, 3);
        while (records.size() < 22) {
            if (!config.isRestDay(day)) {
                records.add(records.size() < 2 ? absent(employeeId, day) : worked(employeeId, day, "08:00", "17:00"));
            }
            day = day.plusDays(1);
        }
        return records;
    }

    @Test
    void summarize_monthWithTwoAbsences_hasAttendanceRateOf9091() {
        AttendanceSummary summary = aggregator.summarize(march(1L), config).withScheduledDays(22);

        assertThat(summary.getDaysWorked()).isEqualTo(20);
        assertThat(summary.getDaysAbsent()).isEqualTo(2);
        assertThat(summary.getAttendanceRate()).isEqualByComparingTo("90.91");
        assertThat(summary.getRegularHours()).isEqualByComparingTo("160.00");
        assertThat(summary.getRecargo25Hours()).isEqualByComparingTo("10.00");
        assertThat(summary.getTotalWorkedHours()).isEqualByComparingTo("170.00");
    }

    @Test
    void summarize_withoutScheduledDays_usesWorkedPlusAbsent() {
        AttendanceSummary summary = aggregator.summarize(march(1L), config);

        assertThat(summary.getEffectiveScheduledDays()).isEqualTo(22);
        assertThat(summary.getAttendanceRate()).isEqualByComparingTo("90.91");
    }

    @Test
    void summarize_countsLateArrivalsAndEarlyDepartures_usingGracePeriod() {
        LocalDate day = LocalDate.of(2025, 3, 4);
        List<AttendanceRecord> records = List.of(
                worked(1L, day, "08:10", "16:50"),
                worked(1L, day.plusDays(1), "08:11", "17:00"),
                worked(1L, day.plusDays(2), "07:55", "16:49"));

        AttendanceSummary summary = aggregator.summarize(records, config);

        assertThat(summary.getLateArrivals()).isEqualTo(1);
        assertThat(summary.getEarlyDepartures()).isEqualTo(1);
        assertThat(summary.getPunctualityRate()).isEqualByComparingTo("66.67");
    }

    @Test
    void summarize_followsConfiguredNominalShift() {
        config.setNominalStart(LocalTime.of(14, 0));
        config.setNominalEnd(LocalTime.of(22, 0));

        AttendanceSummary summary = aggregator.summarize(
                List.of(worked(1L, LocalDate.of(2025, 3, 4), "13:58", "22:05")), config);

        assertThat(summary.getLateArrivals()).isZero();
        assertThat(summary.getEarlyDepartures()).isZero();
    }

    @Test
    void summarize_skipsDeletedRecords_andHoursOfRecordsUnderReview() {
        LocalDate day = LocalDate.of(2025, 3, 4);
        AttendanceRecord deleted = worked(1L, day, "08:00", "17:00").toBuilder()
                .deletedAt(LocalDateTime.of(2025, 3, 5, 8, 0))
                .build();
        AttendanceRecord underReview = worked(1L, day.plusDays(1), "08:00", "17:00").toBuilder()
                .status(AttendanceStatus.UNDER_REVIEW)
                .build();

        AttendanceSummary summary = aggregator.summarize(List.of(deleted, underReview), config);

        assertThat(summary.getRecordCount()).isEqualTo(1);
        assertThat(summary.getDaysWorked()).isEqualTo(1);
        assertThat(summary.getTotalWorkedHours()).isEqualByComparingTo("0");
    }

    @Test
    void combine_ofPartitions_equalsFullAggregation() {
        List<AttendanceRecord> records = march(1L);
        AttendanceSummary full = aggregator.summarize(records, config);

        AttendanceSummary left = aggregator.summarize(records.subList(0, 7), config);
        AttendanceSummary middle = aggregator.summarize(records.subList(7, 15), config);
        AttendanceSummary right = aggregator.summarize(records.subList(15, records.size()), config);

        assertThat(left.combine(middle).combine(right)).isEqualTo(full);
        assertThat(left.combine(middle.combine(right))).isEqualTo(full);
        assertThat(right.combine(left).combine(middle)).isEqualTo(full);
    }

    @Test
    void combine_keepsExplicitScheduledDaysAssociative() {
        AttendanceSummary a = aggregator.summarize(march(1L).subList(0, 5), config).withScheduledDays(6);
        AttendanceSummary b = aggregator.summarize(march(1L).subList(5, 10), config);
        AttendanceSummary c = aggregator.summarize(march(1L).subList(10, 12), config).withScheduledDays(3);

        assertThat(a.combine(b).combine(c)).isEqualTo(a.combine(b.combine(c)));
        assertThat(a.combine(b).combine(c).getEffectiveScheduledDays()).isEqualTo(6 + 5 + 3);
    }

    @Test
    void trend_labelsWindowsCanonically_inAscendingOrder() {
        List<AttendanceRecord> records = new ArrayList<>(march(1L));
        records.add(worked(1L, LocalDate.of(2025, 2, 28), "08:00", "17:00"));
        Collections.reverse(records);

        List<TrendPoint> monthly = aggregator.trend(records, Granularity.MONTH, config);
        List<TrendPoint> weekly = aggregator.trend(records, Granularity.WEEK, config);

        assertThat(monthly).extracting(TrendPoint::periodKey).containsExactly("2025-02", "2025-03", "2025-04");
        assertThat(weekly).extracting(TrendPoint::periodKey)
                .containsExactly("2025-W09", "2025-W10", "2025-W11", "2025-W12", "2025-W13", "2025-W14");
        assertThat(weekly).extracting(TrendPoint::periodStart).isSorted();
    }

    @Test
    void mergeTrends_combinesMatchingWindows() {
        List<AttendanceRecord> records = march(1L);
        List<TrendPoint> full = aggregator.trend(records, Granularity.WEEK, config);

        List<TrendPoint> merged = aggregator.mergeTrends(
                aggregator.trend(records.subList(0, 11), Granularity.WEEK, config),
                aggregator.trend(records.subList(11, records.size()), Granularity.WEEK, config));

        assertThat(merged).isEqualTo(full);
    }

    @Test
    void aggregate_groupsByBranch_withUnassignedBucket() {
        LocalDate day = LocalDate.of(2025, 3, 4);
        List<AttendanceRecord> records = List.of(
                worked(1L, day, "08:00", "17:00"),
                worked(2L, day, "08:00", "17:00"),
                worked(3L, day, "08:00", "17:00"),
                absent(4L, day));
        Map<Long, EmployeePlacement> placements = Map.of(
                1L, EmployeePlacement.builder().employeeId(1L).areaId(10L).branchId(100L).build(),
                2L, EmployeePlacement.builder().employeeId(2L).areaId(11L).branchId(100L).build(),
                3L, EmployeePlacement.builder().employeeId(3L).areaId(12L).branchId(200L).build());

        Map<GroupKey, AttendanceSummary> byBranch = aggregator.aggregate(records, GroupBy.BRANCH, placements, config);

        assertThat(byBranch.keySet()).containsExactly(
                new GroupKey(GroupBy.BRANCH, 100L),
                new GroupKey(GroupBy.BRANCH, 200L),
                new GroupKey(GroupBy.BRANCH, null));
        assertThat(byBranch.get(new GroupKey(GroupBy.BRANCH, 100L)).getDaysWorked()).isEqualTo(2);
        assertThat(byBranch.get(new GroupKey(GroupBy.BRANCH, null)).getDaysAbsent()).isEqualTo(1);
        assertThat(new GroupKey(GroupBy.BRANCH, null).label()).isEqualTo("BRANCH:SIN_ASIGNAR");
    }

    @Test
    void groupedTrend_buildsOneSeriesPerEmployee() {
        LocalDate monday = LocalDate.of(2025, 3, 3);
        List<AttendanceRecord> records = List.of(
                worked(2L, monday.plusDays(7), "08:00", "17:00"),
                worked(1L, monday, "08:00", "17:00"),
                worked(2L, monday, "08:00", "17:00"));

        Map<GroupKey, List<TrendPoint>> series = aggregator.groupedTrend(records, GroupBy.EMPLOYEE, null,
                Granularity.WEEK, config);

        assertThat(series.keySet()).containsExactly(
                new GroupKey(GroupBy.EMPLOYEE, 1L),
                new GroupKey(GroupBy.EMPLOYEE, 2L));
        assertThat(series.get(new GroupKey(GroupBy.EMPLOYEE, 2L)))
                .extracting(TrendPoint::periodKey)
                .containsExactly("2025-W10", "2025-W11");
    }

    @Test
    void summarizePeriod_usesWorkingDaysAsDenominator() {
        List<AttendanceRecord> records = march(1L);

        AttendanceSummary summary = aggregator.summarizePeriod(
                records, LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31), config);

        // 21 días hábiles en marzo; el 1 de abril queda fuera del rango
        assertThat(summary.getEffectiveScheduledDays()).isEqualTo(21);
        assertThat(summary.getRecordCount()).isEqualTo(21);
    }
}
