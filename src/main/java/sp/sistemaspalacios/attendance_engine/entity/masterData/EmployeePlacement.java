package sp.sistemaspalacios.attendance_engine.entity.masterData;

import lombok.Builder;
import lombok.Value;

/**
 * Ubicación organizacional de un empleado: empleado → área → sucursal, con
 * su tipo (regular por defecto).
 */
@Value
@Builder
public class EmployeePlacement {
    Long employeeId;
    Long areaId;
    Long branchId;

    @Builder.Default
    EmployeeType employeeType = EmployeeType.REGULAR;
}
