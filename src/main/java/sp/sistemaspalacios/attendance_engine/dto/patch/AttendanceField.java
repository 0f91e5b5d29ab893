package sp.sistemaspalacios.attendance_engine.dto.patch;

import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.function.Function;

/**
 * Campos actualizables de un registro de asistencia. Identidad, empleado,
 * fecha, creación y versión no se actualizan por parche.
 */
public enum AttendanceField {
    ENTRY("entrada", LocalTime.class, AttendanceRecord::getEntry),
    EXIT("salida", LocalTime.class, AttendanceRecord::getExit),
    ENTRY2("entrada2", LocalTime.class, AttendanceRecord::getEntry2),
    EXIT2("salida2", LocalTime.class, AttendanceRecord::getExit2),
    LUNCH_MINUTES("minutosAlmuerzo", Integer.class, AttendanceRecord::getLunchMinutes),
    REGULAR_HOURS("horasRegulares", BigDecimal.class, AttendanceRecord::getRegularHours),
    OVERTIME_HOURS("horasExtras", BigDecimal.class, AttendanceRecord::getOvertimeHours),
    RECARGO25_HOURS("horasRecargo", BigDecimal.class, AttendanceRecord::getRecargo25Hours),
    SUPLEMENTARIO50_HOURS("horasSuplementarias", BigDecimal.class, AttendanceRecord::getSuplementario50Hours),
    EXTRAORDINARIO100_HOURS("horasExtraordinarias", BigDecimal.class, AttendanceRecord::getExtraordinario100Hours),
    NIGHT_HOURS("horasNocturnas", BigDecimal.class, AttendanceRecord::getNightHours),
    STATUS("estado", AttendanceStatus.class, AttendanceRecord::getStatus),
    MANUAL_ENTRY("esManual", Boolean.class, AttendanceRecord::isManualEntry),
    NOTES("observaciones", String.class, AttendanceRecord::getNotes),
    MODIFIED_BY("modificadoPor", String.class, AttendanceRecord::getModifiedBy),
    MODIFIED_AT("fechaModificacion", LocalDateTime.class, AttendanceRecord::getModifiedAt),
    DELETED_AT("fechaEliminacion", LocalDateTime.class, AttendanceRecord::getDeletedAt);

    private final String columnLabel;
    private final Class<?> valueType;
    private final Function<AttendanceRecord, Object> reader;

    AttendanceField(String columnLabel, Class<?> valueType, Function<AttendanceRecord, Object> reader) {
        this.columnLabel = columnLabel;
        this.valueType = valueType;
        this.reader = reader;
    }

    public String getColumnLabel() {
        return columnLabel;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    public Object read(AttendanceRecord record) {
        return reader.apply(record);
    }

    /** Los campos sin valor por defecto admiten borrado (valor vacío). */
    public boolean isNullable() {
        return valueType != BigDecimal.class && this != STATUS && this != MANUAL_ENTRY;
    }
}
