package sp.sistemaspalacios.attendance_engine.repository.masterData;

import sp.sistemaspalacios.attendance_engine.entity.masterData.EmployeePlacement;

import java.util.Optional;

/**
 * Consulta de datos maestros. Una referencia obsoleta devuelve vacío en lugar
 * de lanzar excepción.
 */
public interface MasterDataRepository {

    Optional<EmployeePlacement> resolveEmployee(Long employeeId);

    Optional<Long> resolveDeviceBranch(Long deviceId);
}
