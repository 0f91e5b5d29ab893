package sp.sistemaspalacios.attendance_engine.dto.report;

public enum Granularity {
    DAY,
    WEEK,   // semana ISO (lunes a domingo)
    MONTH
}
