package sp.sistemaspalacios.attendance_engine.validator.config;

import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.exception.InvalidShiftConfigurationException;

public class ShiftConfigurationValidator {

    private ShiftConfigurationValidator() {
    }

    public static void validate(ShiftConfiguration config) {
        if (config == null) {
            throw new InvalidShiftConfigurationException("La configuración de jornada es obligatoria.");
        }

        // ==========================================
        // VALORES OBLIGATORIOS
        // ==========================================

        requireNonNull(config.getNightStart(), "nightStart");
        requireNonNull(config.getNightEnd(), "nightEnd");
        requireNonNull(config.getNominalStart(), "nominalStart");
        requireNonNull(config.getNominalEnd(), "nominalEnd");
        requireNonNull(config.getRestDays(), "restDays");
        requireNonNull(config.getHolidays(), "holidays");
        requireNonNull(config.getRecargoRate(), "recargoRate");
        requireNonNull(config.getSuplementarioRate(), "suplementarioRate");
        requireNonNull(config.getExtraordinarioRate(), "extraordinarioRate");
        requireNonNull(config.getNightRate(), "nightRate");

        // ==========================================
        // RANGOS
        // ==========================================

        if (config.getStandardShiftMinutes() <= 0) {
            throw new InvalidShiftConfigurationException("La jornada estándar debe ser mayor a cero minutos.");
        }
        if (config.getRecargoLimitMinutes() < 0 || config.getSuplementarioLimitMinutes() < 0) {
            throw new InvalidShiftConfigurationException("Los umbrales de horas extra no pueden ser negativos.");
        }
        if (config.getSuplementarioLimitMinutes() < config.getRecargoLimitMinutes()) {
            throw new InvalidShiftConfigurationException(String.format(
                    "El umbral suplementario (%d min) no puede ser menor que el de recargo (%d min).",
                    config.getSuplementarioLimitMinutes(), config.getRecargoLimitMinutes()));
        }
        if (config.getHourScale() < 0) {
            throw new InvalidShiftConfigurationException("La escala de redondeo no puede ser negativa.");
        }
        if (config.getDuplicateThresholdMinutes() < 0 || config.getGraceMinutes() < 0) {
            throw new InvalidShiftConfigurationException("Tolerancias y umbrales deben ser >= 0.");
        }
        if (config.getMonthlyHours() < 1) {
            throw new InvalidShiftConfigurationException("Las horas mensuales deben ser al menos 1.");
        }
        if (config.getAdministrativeMinimumMinutes() < 0) {
            throw new InvalidShiftConfigurationException("El mínimo diario de administrativos no puede ser negativo.");
        }
        if (config.getBatchChunkSize() < 1) {
            throw new InvalidShiftConfigurationException("El tamaño de lote debe ser al menos 1.");
        }

        // ==========================================
        // COHERENCIA ENTRE CAMPOS
        // ==========================================

        if (config.getNightStart().equals(config.getNightEnd())) {
            throw new InvalidShiftConfigurationException("El horario nocturno no puede empezar y terminar a la misma hora.");
        }
        if (!config.getNominalStart().isBefore(config.getNominalEnd())) {
            throw new InvalidShiftConfigurationException(String.format(
                    "La hora nominal de entrada (%s) debe ser anterior a la de salida (%s).",
                    config.getNominalStart(), config.getNominalEnd()));
        }
        if ((config.getLunchWindowStart() == null) != (config.getLunchWindowEnd() == null)) {
            throw new InvalidShiftConfigurationException("La ventana de almuerzo requiere inicio y fin.");
        }
        if (config.hasLunchWindow() && !config.getLunchWindowStart().isBefore(config.getLunchWindowEnd())) {
            throw new InvalidShiftConfigurationException("La ventana de almuerzo debe iniciar antes de terminar.");
        }
    }

    private static void requireNonNull(Object value, String field) {
        if (value == null) {
            throw new InvalidShiftConfigurationException("Falta el parámetro de configuración: " + field);
        }
    }
}
