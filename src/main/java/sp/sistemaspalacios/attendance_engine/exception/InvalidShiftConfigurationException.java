package sp.sistemaspalacios.attendance_engine.exception;

/**
 * Configuración de jornada ausente o incoherente. Es un error del llamador,
 * no un problema de calidad de datos.
 */
public class InvalidShiftConfigurationException extends RuntimeException {

    public InvalidShiftConfigurationException(String message) {
        super(message);
    }
}
