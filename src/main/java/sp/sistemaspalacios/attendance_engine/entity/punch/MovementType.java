package sp.sistemaspalacios.attendance_engine.entity.punch;

public enum MovementType {
    ENTRY,     // Entrada
    EXIT,      // Salida
    UNKNOWN    // El dispositivo no reportó el tipo
}
