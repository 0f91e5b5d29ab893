package sp.sistemaspalacios.attendance_engine.validator.attendance;

import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;

import java.time.LocalDate;
import java.util.Collection;

/**
 * Validaciones de contrato. Un fallo aquí es un error del llamador y se lanza
 * de inmediato; los problemas de calidad de datos los reporta el verificador
 * de consistencia.
 */
public class AttendanceRecordValidator {

    private AttendanceRecordValidator() {
    }

    public static void requireWellFormed(AttendanceRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("El registro de asistencia es obligatorio.");
        }
        if (record.getEmployeeId() == null) {
            throw new IllegalArgumentException(
                    String.format("El registro %s no tiene empleado asignado.", record.getId()));
        }
        if (record.getDate() == null) {
            throw new IllegalArgumentException(
                    String.format("El registro %s no tiene fecha.", record.getId()));
        }
        if (record.getStatus() == null) {
            throw new IllegalArgumentException(
                    String.format("El registro %s no tiene estado.", record.getId()));
        }
        if (record.getRegularHours() == null || record.getOvertimeHours() == null
                || record.getRecargo25Hours() == null || record.getSuplementario50Hours() == null
                || record.getExtraordinario100Hours() == null || record.getNightHours() == null) {
            throw new IllegalArgumentException(
                    String.format("El registro %s tiene categorías de horas nulas.", record.getId()));
        }
        if (record.getLunchMinutes() != null && record.getLunchMinutes() < 0) {
            throw new IllegalArgumentException("El tiempo de almuerzo no puede ser negativo.");
        }
    }

    /** Todas las marcaciones deben pertenecer al mismo empleado y al mismo día. */
    public static void requireSingleEmployeeDay(Collection<PunchEvent> events) {
        if (events == null) {
            throw new IllegalArgumentException("La lista de marcaciones es obligatoria.");
        }
        Long employeeId = null;
        LocalDate date = null;
        for (PunchEvent event : events) {
            if (event == null || event.getTimestamp() == null) {
                throw new IllegalArgumentException("Marcación sin fecha/hora.");
            }
            if (event.getEmployeeId() == null) {
                throw new IllegalArgumentException(
                        String.format("La marcación %s no tiene empleado.", event.getId()));
            }
            if (employeeId == null) {
                employeeId = event.getEmployeeId();
                date = event.getDate();
            } else if (!employeeId.equals(event.getEmployeeId()) || !date.equals(event.getDate())) {
                throw new IllegalArgumentException(String.format(
                        "Las marcaciones deben ser de un solo empleado y día (%d/%s vs %d/%s).",
                        employeeId, date, event.getEmployeeId(), event.getDate()));
            }
        }
    }
}
