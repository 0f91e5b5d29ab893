package sp.sistemaspalacios.attendance_engine.entity.attendance;

import java.util.EnumSet;
import java.util.Set;

/**
 * Estado de un registro diario de asistencia.
 * <p>
 * PENDING es el estado de entrada; ABSENT es terminal para el día y solo se
 * abandona con una corrección manual.
 */
public enum AttendanceStatus {
    PENDING("Pendiente"),
    COMPLETE("Completo"),
    MODIFIED("Modificado"),
    INCONSISTENT("Inconsistente"),
    UNDER_REVIEW("En Revisión"),
    ABSENT("Ausente");

    private final String description;

    AttendanceStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /** Transiciones automáticas permitidas (las correcciones manuales no pasan por aquí). */
    public Set<AttendanceStatus> allowedTransitions() {
        switch (this) {
            case PENDING:
                return EnumSet.of(COMPLETE, MODIFIED, INCONSISTENT, UNDER_REVIEW, ABSENT);
            case INCONSISTENT:
                return EnumSet.of(COMPLETE, MODIFIED, UNDER_REVIEW);
            case UNDER_REVIEW:
                return EnumSet.of(COMPLETE, MODIFIED, INCONSISTENT);
            case MODIFIED:
                return EnumSet.of(COMPLETE, INCONSISTENT, UNDER_REVIEW);
            case COMPLETE:
                return EnumSet.of(MODIFIED, INCONSISTENT, UNDER_REVIEW);
            default:
                return EnumSet.noneOf(AttendanceStatus.class);
        }
    }

    public boolean canTransitionTo(AttendanceStatus target) {
        return this == target || allowedTransitions().contains(target);
    }

    public boolean countsAsWorkTime() {
        return this == COMPLETE || this == PENDING || this == MODIFIED;
    }

    public boolean requiresAttention() {
        return this == PENDING || this == INCONSISTENT || this == UNDER_REVIEW;
    }

    /** Estados desde los que un registro puede aprobarse a COMPLETE. */
    public boolean isApprovable() {
        return this == PENDING || this == INCONSISTENT || this == UNDER_REVIEW || this == MODIFIED;
    }
}
