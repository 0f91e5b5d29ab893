package sp.sistemaspalacios.attendance_engine.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.repository.punch.PunchEventRepository;
import sp.sistemaspalacios.attendance_engine.service.batch.AttendanceBatchService;
import sp.sistemaspalacios.attendance_engine.service.classification.HourClassificationService;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;
import sp.sistemaspalacios.attendance_engine.service.matching.PunchMatchingService;
import sp.sistemaspalacios.attendance_engine.service.payroll.OvertimePayService;
import sp.sistemaspalacios.attendance_engine.service.reconciliation.AttendanceReconciliationService;
import sp.sistemaspalacios.attendance_engine.service.review.AttendanceReviewService;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class AttendanceEngineConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(AttendanceEngineConfiguration.class));

    @Test
    void registersCoreServicesWithoutStores() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(TimeService.class);
            assertThat(context).hasSingleBean(HourClassificationService.class);
            assertThat(context).hasSingleBean(PunchMatchingService.class);
            assertThat(context).hasSingleBean(OvertimePayService.class);
            assertThat(context).hasSingleBean(Clock.class);
            assertThat(context).doesNotHaveBean(AttendanceReconciliationService.class);
            assertThat(context).doesNotHaveBean(AttendanceReviewService.class);
            assertThat(context.getBean(Clock.class).getZone()).isEqualTo(AttendanceEngineConfiguration.DEFAULT_ZONE);
        });
    }

    @Test
    void bindsShiftProperties() {
        runner.withPropertyValues(
                        "attendance.shift.standard-shift-minutes=420",
                        "attendance.shift.duplicate-threshold-minutes=3",
                        "attendance.shift.rest-days=SUNDAY")
                .run(context -> {
                    ShiftConfiguration config = context.getBean(ShiftConfiguration.class);
                    assertThat(config.getStandardShiftMinutes()).isEqualTo(420);
                    assertThat(config.getDuplicateThresholdMinutes()).isEqualTo(3);
                    assertThat(config.getRestDays()).containsExactly(DayOfWeek.SUNDAY);
                    assertThat(config.getRecargoLimitMinutes()).isEqualTo(120);
                });
    }

    @Test
    void rejectsOutOfRangeProperties() {
        runner.withPropertyValues("attendance.shift.standard-shift-minutes=30")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void registersOrchestrationWhenStoresArePresent() {
        runner.withBean(AttendanceRecordRepository.class, () -> mock(AttendanceRecordRepository.class))
                .withBean(PunchEventRepository.class, () -> mock(PunchEventRepository.class))
                .withBean(MasterDataRepository.class, () -> mock(MasterDataRepository.class))
                .run(context -> {
                    assertThat(context).hasSingleBean(AttendanceReconciliationService.class);
                    assertThat(context).hasSingleBean(AttendanceReviewService.class);
                    assertThat(context).hasSingleBean(AttendanceBatchService.class);
                    assertThat(context).hasBean("reconciliationExecutor");
                });
    }

    @Test
    void reconciliationNeedsPunchStore() {
        runner.withBean(AttendanceRecordRepository.class, () -> mock(AttendanceRecordRepository.class))
                .withBean(MasterDataRepository.class, () -> mock(MasterDataRepository.class))
                .run(context -> {
                    assertThat(context).doesNotHaveBean(AttendanceReconciliationService.class);
                    assertThat(context).hasSingleBean(AttendanceReviewService.class);
                    assertThat(context).hasSingleBean(AttendanceBatchService.class);
                });
    }

    @Test
    void hostClockTakesPrecedence() {
        Clock fixed = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        runner.withBean(Clock.class, () -> fixed)
                .run(context -> assertThat(context.getBean(Clock.class)).isSameAs(fixed));
    }
}
