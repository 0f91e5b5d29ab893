package sp.sistemaspalacios.attendance_engine.dto.batch;

public enum ItemOutcome {
    UPDATED,
    UNCHANGED,
    /** Ya confirmado en una ejecución anterior. */
    SKIPPED,
    FAILED,
    /** No procesado porque el lote se canceló antes de llegar a él. */
    CANCELLED
}
