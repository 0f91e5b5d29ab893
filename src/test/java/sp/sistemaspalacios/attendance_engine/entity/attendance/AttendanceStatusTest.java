package sp.sistemaspalacios.attendance_engine.entity.attendance;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AttendanceStatusTest {

    @Test
    void pending_canMoveToEveryOtherState() {
        assertThat(AttendanceStatus.PENDING.allowedTransitions())
                .containsExactlyInAnyOrder(AttendanceStatus.COMPLETE, AttendanceStatus.MODIFIED,
                        AttendanceStatus.INCONSISTENT, AttendanceStatus.UNDER_REVIEW, AttendanceStatus.ABSENT);
    }

    @Test
    void absent_isTerminal() {
        assertThat(AttendanceStatus.ABSENT.allowedTransitions()).isEmpty();
        assertThat(AttendanceStatus.ABSENT.canTransitionTo(AttendanceStatus.INCONSISTENT)).isFalse();
        assertThat(AttendanceStatus.ABSENT.isApprovable()).isFalse();
    }

    @Test
    void everyStateExceptAbsent_canBecomeInconsistent() {
        for (AttendanceStatus status : AttendanceStatus.values()) {
            assertThat(status.canTransitionTo(AttendanceStatus.INCONSISTENT))
                    .as(status.name())
                    .isEqualTo(status != AttendanceStatus.ABSENT);
        }
    }

    @Test
    void workTimeAndAttentionFlags() {
        assertThat(AttendanceStatus.MODIFIED.countsAsWorkTime()).isTrue();
        assertThat(AttendanceStatus.INCONSISTENT.countsAsWorkTime()).isFalse();
        assertThat(AttendanceStatus.UNDER_REVIEW.requiresAttention()).isTrue();
        assertThat(AttendanceStatus.COMPLETE.requiresAttention()).isFalse();
    }
}
