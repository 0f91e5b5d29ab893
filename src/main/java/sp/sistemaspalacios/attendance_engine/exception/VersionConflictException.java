package sp.sistemaspalacios.attendance_engine.exception;

/**
 * Lanzada por el almacén de registros cuando la versión guardada no coincide
 * con la esperada (concurrencia optimista).
 */
public class VersionConflictException extends RuntimeException {

    private final Long recordId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(Long recordId, long expectedVersion, long actualVersion) {
        super(String.format("Conflicto de versión en registro %d: esperada %d, encontrada %d",
                recordId, expectedVersion, actualVersion));
        this.recordId = recordId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public Long getRecordId() {
        return recordId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
