package sp.sistemaspalacios.attendance_engine.dto.attendance;

import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;

import java.util.List;

/**
 * Datos externos que necesita el verificador: si el empleado sigue existiendo
 * en datos maestros y los demás registros del mismo empleado y día.
 */
public record ConsistencyContext(boolean employeeResolvable, List<AttendanceRecord> sameDayRecords) {

    public ConsistencyContext {
        sameDayRecords = sameDayRecords == null ? List.of() : List.copyOf(sameDayRecords);
    }

    public static ConsistencyContext standalone() {
        return new ConsistencyContext(true, List.of());
    }
}
