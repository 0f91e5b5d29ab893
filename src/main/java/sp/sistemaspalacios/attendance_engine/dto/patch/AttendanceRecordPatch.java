package sp.sistemaspalacios.attendance_engine.dto.patch;

import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Actualización parcial tipada de un registro: cada campo presente lleva su
 * nuevo valor, y {@link Optional#empty()} significa "dejar en nulo". Los
 * campos ausentes no se tocan.
 * <p>
 * El almacén aplica el parche junto con la verificación de versión; aquí no
 * se incrementa la versión.
 */
public final class AttendanceRecordPatch {

    private final EnumMap<AttendanceField, Optional<Object>> changes = new EnumMap<>(AttendanceField.class);

    public static AttendanceRecordPatch empty() {
        return new AttendanceRecordPatch();
    }

    /** Parche con los campos que difieren entre dos versiones del mismo registro. */
    public static AttendanceRecordPatch diff(AttendanceRecord before, AttendanceRecord after) {
        if (before == null || after == null) {
            throw new IllegalArgumentException("Ambas versiones del registro son obligatorias.");
        }
        if (!Objects.equals(before.getId(), after.getId())) {
            throw new IllegalArgumentException(String.format(
                    "No se puede comparar registros distintos: %s vs %s", before.getId(), after.getId()));
        }
        AttendanceRecordPatch patch = new AttendanceRecordPatch();
        for (AttendanceField field : AttendanceField.values()) {
            Object oldValue = field.read(before);
            Object newValue = field.read(after);
            if (!sameValue(oldValue, newValue)) {
                patch.changes.put(field, Optional.ofNullable(newValue));
            }
        }
        return patch;
    }

    public AttendanceRecordPatch set(AttendanceField field, Object value) {
        if (field == null) {
            throw new IllegalArgumentException("El campo del parche es obligatorio.");
        }
        if (value == null) {
            return clear(field);
        }
        if (!field.getValueType().isInstance(value)) {
            throw new IllegalArgumentException(String.format("Tipo inválido para %s: se esperaba %s y llegó %s",
                    field.getColumnLabel(), field.getValueType().getSimpleName(), value.getClass().getSimpleName()));
        }
        changes.put(field, Optional.of(value));
        return this;
    }

    public AttendanceRecordPatch clear(AttendanceField field) {
        if (!field.isNullable()) {
            throw new IllegalArgumentException("El campo " + field.getColumnLabel() + " no admite valor nulo.");
        }
        changes.put(field, Optional.empty());
        return this;
    }

    // ===== ATAJOS TIPADOS =====

    public AttendanceRecordPatch entry(LocalTime value) {
        return set(AttendanceField.ENTRY, value);
    }

    public AttendanceRecordPatch exit(LocalTime value) {
        return set(AttendanceField.EXIT, value);
    }

    public AttendanceRecordPatch status(AttendanceStatus value) {
        return set(AttendanceField.STATUS, value);
    }

    public AttendanceRecordPatch notes(String value) {
        return set(AttendanceField.NOTES, value);
    }

    public AttendanceRecordPatch modifiedBy(String actor, LocalDateTime at) {
        set(AttendanceField.MODIFIED_BY, actor);
        return set(AttendanceField.MODIFIED_AT, at);
    }

    public AttendanceRecordPatch hours(HoursBreakdown hours) {
        set(AttendanceField.REGULAR_HOURS, hours.regular());
        set(AttendanceField.OVERTIME_HOURS, hours.overtime());
        set(AttendanceField.RECARGO25_HOURS, hours.recargo25());
        set(AttendanceField.SUPLEMENTARIO50_HOURS, hours.suplementario50());
        set(AttendanceField.EXTRAORDINARIO100_HOURS, hours.extraordinario100());
        return set(AttendanceField.NIGHT_HOURS, hours.nocturnas());
    }

    // ===== CONSULTA =====

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public boolean contains(AttendanceField field) {
        return changes.containsKey(field);
    }

    public Set<AttendanceField> fields() {
        return Collections.unmodifiableSet(changes.keySet());
    }

    public Optional<Object> get(AttendanceField field) {
        Optional<Object> value = changes.get(field);
        return value == null ? Optional.empty() : value;
    }

    public Map<AttendanceField, Optional<Object>> asMap() {
        return Collections.unmodifiableMap(changes);
    }

    /** Copia del registro con los cambios aplicados (misma versión). */
    public AttendanceRecord applyTo(AttendanceRecord record) {
        AttendanceRecord.AttendanceRecordBuilder builder = record.toBuilder();
        changes.forEach((field, value) -> write(builder, field, value.orElse(null)));
        return builder.build();
    }

    private static void write(AttendanceRecord.AttendanceRecordBuilder builder, AttendanceField field, Object value) {
        switch (field) {
            case ENTRY:
                builder.entry((LocalTime) value);
                break;
            case EXIT:
                builder.exit((LocalTime) value);
                break;
            case ENTRY2:
                builder.entry2((LocalTime) value);
                break;
            case EXIT2:
                builder.exit2((LocalTime) value);
                break;
            case LUNCH_MINUTES:
                builder.lunchMinutes((Integer) value);
                break;
            case REGULAR_HOURS:
                builder.regularHours((BigDecimal) value);
                break;
            case OVERTIME_HOURS:
                builder.overtimeHours((BigDecimal) value);
                break;
            case RECARGO25_HOURS:
                builder.recargo25Hours((BigDecimal) value);
                break;
            case SUPLEMENTARIO50_HOURS:
                builder.suplementario50Hours((BigDecimal) value);
                break;
            case EXTRAORDINARIO100_HOURS:
                builder.extraordinario100Hours((BigDecimal) value);
                break;
            case NIGHT_HOURS:
                builder.nightHours((BigDecimal) value);
                break;
            case STATUS:
                builder.status((AttendanceStatus) value);
                break;
            case MANUAL_ENTRY:
                builder.manualEntry((Boolean) value);
                break;
            case NOTES:
                builder.notes((String) value);
                break;
            case MODIFIED_BY:
                builder.modifiedBy((String) value);
                break;
            case MODIFIED_AT:
                builder.modifiedAt((LocalDateTime) value);
                break;
            case DELETED_AT:
                builder.deletedAt((LocalDateTime) value);
                break;
            default:
                throw new IllegalStateException("Campo no soportado: " + field);
        }
    }

    private static boolean sameValue(Object a, Object b) {
        if (a instanceof BigDecimal && b instanceof BigDecimal) {
            return ((BigDecimal) a).compareTo((BigDecimal) b) == 0;
        }
        return Objects.equals(a, b);
    }

    @Override
    public String toString() {
        return "AttendanceRecordPatch" + changes;
    }
}
