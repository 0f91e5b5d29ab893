package sp.sistemaspalacios.attendance_engine.dto.report;

public enum GroupBy {
    EMPLOYEE,
    AREA,
    BRANCH
}
