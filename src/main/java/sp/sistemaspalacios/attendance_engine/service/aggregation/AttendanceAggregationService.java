package sp.sistemaspalacios.attendance_engine.service.aggregation;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
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
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Agrega registros por grupo (empleado, área, sucursal) y por ventana de
 * tiempo (día, semana ISO, mes).
 * <p>
 * Cada registro produce un agregado unitario y los agregados se combinan por
 * suma, por lo que el resultado no depende del orden ni de cómo se
 * particione el conjunto.
 */
@Service
@RequiredArgsConstructor
public class AttendanceAggregationService {

    private static final Comparator<GroupKey> KEY_ORDER = Comparator
            .comparing(GroupKey::dimension)
            .thenComparing(GroupKey::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TimeService timeService;

    /** Agregado unitario de un registro. Los eliminados aportan el agregado vacío. */
    public AttendanceSummary summarize(AttendanceRecord record, ShiftConfiguration config) {
        AttendanceRecordValidator.requireWellFormed(record);
        if (record.isDeleted()) {
            return AttendanceSummary.empty();
        }

        AttendanceSummary.AttendanceSummaryBuilder builder = AttendanceSummary.builder().recordCount(1);

        if (record.getStatus() == AttendanceStatus.ABSENT) {
            builder.daysAbsent(1);
        } else if (record.hasEntry()) {
            builder.daysWorked(1);
            LocalTime firstEntry = record.getEntry() != null ? record.getEntry() : record.getEntry2();
            if (isLate(firstEntry, config)) {
                builder.lateArrivals(1);
            }
            if (isEarlyDeparture(record.getLastExit(), config)) {
                builder.earlyDepartures(1);
            }
        }

        if (record.getStatus().countsAsWorkTime()) {
            builder.regularHours(record.getRegularHours())
                    .overtimeHours(record.getOvertimeHours())
                    .recargo25Hours(record.getRecargo25Hours())
                    .suplementario50Hours(record.getSuplementario50Hours())
                    .extraordinario100Hours(record.getExtraordinario100Hours())
                    .nightHours(record.getNightHours());
        }
        return builder.build();
    }

    public AttendanceSummary summarize(Collection<AttendanceRecord> records, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        AttendanceSummary total = AttendanceSummary.empty();
        for (AttendanceRecord record : records) {
            total = total.combine(summarize(record, config));
        }
        return total;
    }

    /**
     * Agregado del rango [from, to] usando como denominador los días
     * laborables del calendario configurado.
     */
    public AttendanceSummary summarizePeriod(Collection<AttendanceRecord> records, LocalDate from, LocalDate to,
                                             ShiftConfiguration config) {
        int scheduled = timeService.workingDaysBetween(from, to, config);
        List<AttendanceRecord> inRange = records.stream()
                .filter(r -> r.getDate() != null && !r.getDate().isBefore(from) && !r.getDate().isAfter(to))
                .collect(Collectors.toList());
        return summarize(inRange, config).withScheduledDays(scheduled);
    }

    public Map<GroupKey, AttendanceSummary> aggregate(Collection<AttendanceRecord> records, GroupBy groupBy,
                                                      Map<Long, EmployeePlacement> placements,
                                                      ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        Map<GroupKey, AttendanceSummary> groups = new TreeMap<>(KEY_ORDER);
        for (AttendanceRecord record : records) {
            GroupKey key = keyOf(record, groupBy, placements);
            groups.merge(key, summarize(record, config), AttendanceSummary::combine);
        }
        return new LinkedHashMap<>(groups);
    }

    /** Serie temporal ordenada ascendentemente por inicio de ventana. */
    public List<TrendPoint> trend(Collection<AttendanceRecord> records, Granularity granularity,
                                  ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        Map<LocalDate, AttendanceSummary> windows = new TreeMap<>();
        for (AttendanceRecord record : records) {
            AttendanceSummary unit = summarize(record, config);
            windows.merge(timeService.periodStart(record.getDate(), granularity), unit, AttendanceSummary::combine);
        }
        return toPoints(windows, granularity);
    }

    public Map<GroupKey, List<TrendPoint>> groupedTrend(Collection<AttendanceRecord> records, GroupBy groupBy,
                                                        Map<Long, EmployeePlacement> placements,
                                                        Granularity granularity, ShiftConfiguration config) {
        Map<GroupKey, List<AttendanceRecord>> byGroup = new TreeMap<>(KEY_ORDER);
        for (AttendanceRecord record : records) {
            byGroup.computeIfAbsent(keyOf(record, groupBy, placements), k -> new ArrayList<>()).add(record);
        }
        Map<GroupKey, List<TrendPoint>> result = new LinkedHashMap<>();
        byGroup.forEach((key, groupRecords) -> result.put(key, trend(groupRecords, granularity, config)));
        return result;
    }

    public AttendanceSummary combineAll(Collection<AttendanceSummary> partials) {
        return partials.stream().reduce(AttendanceSummary.empty(), AttendanceSummary::combine);
    }

    /** Combina dos series parciales ventana por ventana. */
    public List<TrendPoint> mergeTrends(List<TrendPoint> left, List<TrendPoint> right) {
        Map<LocalDate, TrendPoint> merged = new TreeMap<>();
        for (TrendPoint point : left) {
            merged.put(point.periodStart(), point);
        }
        for (TrendPoint point : right) {
            merged.merge(point.periodStart(), point, (a, b) ->
                    new TrendPoint(a.periodKey(), a.periodStart(), a.summary().combine(b.summary())));
        }
        return new ArrayList<>(merged.values());
    }

    // ===== MÉTODOS DE UTILIDAD =====

    private List<TrendPoint> toPoints(Map<LocalDate, AttendanceSummary> windows, Granularity granularity) {
        List<TrendPoint> points = new ArrayList<>(windows.size());
        windows.forEach((periodStart, summary) ->
                points.add(new TrendPoint(timeService.periodKey(periodStart, granularity), periodStart, summary)));
        return points;
    }

    private GroupKey keyOf(AttendanceRecord record, GroupBy groupBy, Map<Long, EmployeePlacement> placements) {
        if (groupBy == GroupBy.EMPLOYEE) {
            return new GroupKey(groupBy, record.getEmployeeId());
        }
        EmployeePlacement placement = placements == null ? null : placements.get(record.getEmployeeId());
        if (placement == null) {
            return new GroupKey(groupBy, null);
        }
        return new GroupKey(groupBy, groupBy == GroupBy.AREA ? placement.getAreaId() : placement.getBranchId());
    }

    private boolean isLate(LocalTime firstEntry, ShiftConfiguration config) {
        return firstEntry != null && firstEntry.isAfter(config.getNominalStart().plusMinutes(config.getGraceMinutes()));
    }

    private boolean isEarlyDeparture(LocalTime lastExit, ShiftConfiguration config) {
        return lastExit != null && lastExit.isBefore(config.getNominalEnd().minusMinutes(config.getGraceMinutes()));
    }
}
