package sp.sistemaspalacios.attendance_engine.validator.config;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.exception.InvalidShiftConfigurationException;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShiftConfigurationValidatorTest {

    @Test
    void validate_acceptsDefaults() {
        assertThatCode(() -> ShiftConfigurationValidator.validate(new ShiftConfiguration())).doesNotThrowAnyException();
    }

    @Test
    void validate_rejectsMissingConfiguration() {
        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(null))
                .isInstanceOf(InvalidShiftConfigurationException.class);
    }

    @Test
    void validate_rejectsSecondTierBelowFirst() {
        ShiftConfiguration config = new ShiftConfiguration();
        config.setRecargoLimitMinutes(180);
        config.setSuplementarioLimitMinutes(120);

        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(config))
                .isInstanceOf(InvalidShiftConfigurationException.class)
                .hasMessageContaining("suplementario");
    }

    @Test
    void validate_rejectsNegativeAdministrativeMinimum() {
        ShiftConfiguration config = new ShiftConfiguration();
        config.setAdministrativeMinimumMinutes(-1);

        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(config))
                .isInstanceOf(InvalidShiftConfigurationException.class)
                .hasMessageContaining("administrativos");
    }

    @Test
    void validate_rejectsEmptyNightWindow() {
        ShiftConfiguration config = new ShiftConfiguration();
        config.setNightEnd(config.getNightStart());

        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(config))
                .isInstanceOf(InvalidShiftConfigurationException.class);
    }

    @Test
    void validate_rejectsHalfLunchWindow() {
        ShiftConfiguration config = new ShiftConfiguration();
        config.setLunchWindowStart(LocalTime.NOON);

        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(config))
                .isInstanceOf(InvalidShiftConfigurationException.class);
    }

    @Test
    void validate_rejectsInvertedNominalShift() {
        ShiftConfiguration config = new ShiftConfiguration();
        config.setNominalStart(LocalTime.of(18, 0));

        assertThatThrownBy(() -> ShiftConfigurationValidator.validate(config))
                .isInstanceOf(InvalidShiftConfigurationException.class);
    }
}
