package sp.sistemaspalacios.attendance_engine.entity.masterData;

/**
 * Tipo de empleado. Define cómo se cuentan y clasifican sus horas.
 */
public enum EmployeeType {
    /** Horario fijo: se suman los pares entrada/salida y se aplican los tres tramos. */
    REGULAR,
    /**
     * Horario flexible: se cuenta del primer al último movimiento del día,
     * solo cuentan los días con el mínimo configurado y todo el exceso es extraordinario.
     */
    ADMINISTRATIVE
}
