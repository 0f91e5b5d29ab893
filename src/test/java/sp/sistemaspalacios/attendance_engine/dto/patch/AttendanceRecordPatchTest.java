package sp.sistemaspalacios.attendance_engine.dto.patch;

import org.junit.jupiter.api.Test;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttendanceRecordPatchTest {

    private final AttendanceRecord base = AttendanceRecord.builder()
            .id(1L)
            .employeeId(5L)
            .date(LocalDate.of(2025, 3, 4))
            .entry(LocalTime.of(8, 0))
            .exit(LocalTime.of(17, 0))
            .regularHours(new BigDecimal("8.00"))
            .notes("original")
            .version(2)
            .build();

    @Test
    void diff_containsOnlyChangedFields() {
        AttendanceRecord after = base.toBuilder()
                .exit(LocalTime.of(18, 0))
                .status(AttendanceStatus.COMPLETE)
                .regularHours(new BigDecimal("8.0"))
                .notes(null)
                .build();

        AttendanceRecordPatch patch = AttendanceRecordPatch.diff(base, after);

        assertThat(patch.fields()).containsExactly(AttendanceField.EXIT, AttendanceField.STATUS, AttendanceField.NOTES);
        assertThat(patch.get(AttendanceField.NOTES)).isEmpty();
        assertThat(patch.get(AttendanceField.EXIT)).contains(LocalTime.of(18, 0));
    }

    @Test
    void applyTo_reproducesTheTargetRecord() {
        AttendanceRecord after = base.toBuilder().exit2(LocalTime.of(20, 0)).entry2(LocalTime.of(19, 0)).build();

        AttendanceRecord patched = AttendanceRecordPatch.diff(base, after).applyTo(base);

        assertThat(patched).isEqualTo(after);
        assertThat(patched.getVersion()).isEqualTo(2);
    }

    @Test
    void clear_setsFieldToNull() {
        AttendanceRecord patched = AttendanceRecordPatch.empty().clear(AttendanceField.EXIT).applyTo(base);

        assertThat(patched.getExit()).isNull();
        assertThat(patched.getEntry()).isEqualTo(LocalTime.of(8, 0));
    }

    @Test
    void set_rejectsWrongValueType() {
        assertThatThrownBy(() -> AttendanceRecordPatch.empty().set(AttendanceField.ENTRY, "08:00"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void clear_rejectsNonNullableFields() {
        assertThatThrownBy(() -> AttendanceRecordPatch.empty().clear(AttendanceField.STATUS))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AttendanceRecordPatch.empty().set(AttendanceField.REGULAR_HOURS, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void diff_ofIdenticalRecords_isEmpty() {
        assertThat(AttendanceRecordPatch.diff(base, base.toBuilder().build()).isEmpty()).isTrue();
        assertThat(AttendanceRecordPatch.empty().get(AttendanceField.ENTRY)).isEqualTo(Optional.empty());
    }

    @Test
    void hours_setsAllSixBuckets() {
        HoursBreakdown hours = HoursBreakdown.of(new BigDecimal("8.00"), new BigDecimal("2.00"),
                new BigDecimal("0.50"), BigDecimal.ZERO, new BigDecimal("1.00"));

        AttendanceRecordPatch patch = AttendanceRecordPatch.empty().hours(hours);

        assertThat(patch.asMap()).hasSize(6);
        assertThat(patch.applyTo(base).getHours()).isEqualTo(hours);
        assertThat(patch.get(AttendanceField.OVERTIME_HOURS)).contains(new BigDecimal("2.50"));
    }
}
