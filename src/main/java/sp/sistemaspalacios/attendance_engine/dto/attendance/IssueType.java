package sp.sistemaspalacios.attendance_engine.dto.attendance;

/**
 * Tipos de inconsistencia detectados sobre registros o marcaciones.
 */
public enum IssueType {
    INCOMPLETE_PAIR(true),
    TIME_ORDER_VIOLATION(true),
    NEGATIVE_HOURS(true),
    OVERTIME_TOTAL_MISMATCH(false),
    DUPLICATE(false),
    ORPHANED_EMPLOYEE(true),

    // Hallazgos sobre el conjunto de marcaciones
    INFERRED_MOVEMENT(false),
    AMBIGUOUS_SEQUENCE(false),
    EXCESS_PUNCHES(false),
    LOW_CONFIDENCE(false);

    private final boolean structural;

    IssueType(boolean structural) {
        this.structural = structural;
    }

    /** Una violación estructural impide aprobar el registro. */
    public boolean isStructural() {
        return structural;
    }
}
