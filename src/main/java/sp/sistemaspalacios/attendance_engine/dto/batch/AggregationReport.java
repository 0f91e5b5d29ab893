package sp.sistemaspalacios.attendance_engine.dto.batch;

import lombok.Builder;
import lombok.Value;
import sp.sistemaspalacios.attendance_engine.dto.report.AttendanceSummary;
import sp.sistemaspalacios.attendance_engine.dto.report.TrendPoint;

import java.util.List;
import java.util.Map;

/** Agregación por empleados de un rango de fechas, con resultado por empleado. */
@Value
@Builder
public class AggregationReport {
    AttendanceSummary total;
    Map<Long, AttendanceSummary> byEmployee;
    Map<Long, List<TrendPoint>> trends;
    BatchReport items;
}
