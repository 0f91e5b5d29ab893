package sp.sistemaspalacios.attendance_engine.dto.report;

/**
 * Clave de agrupación. {@code id} nulo agrupa los registros sin área o
 * sucursal asignada.
 */
public record GroupKey(GroupBy dimension, Long id) {

    public static final String UNASSIGNED = "SIN_ASIGNAR";

    public String label() {
        return dimension.name() + ":" + (id == null ? UNASSIGNED : id.toString());
    }
}
