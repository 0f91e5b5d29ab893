package sp.sistemaspalacios.attendance_engine.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import sp.sistemaspalacios.attendance_engine.repository.attendance.AttendanceRecordRepository;
import sp.sistemaspalacios.attendance_engine.repository.masterData.MasterDataRepository;
import sp.sistemaspalacios.attendance_engine.repository.punch.PunchEventRepository;
import sp.sistemaspalacios.attendance_engine.service.aggregation.AttendanceAggregationService;
import sp.sistemaspalacios.attendance_engine.service.batch.AttendanceBatchService;
import sp.sistemaspalacios.attendance_engine.service.classification.HourClassificationService;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;
import sp.sistemaspalacios.attendance_engine.service.consistency.AttendanceConsistencyService;
import sp.sistemaspalacios.attendance_engine.service.matching.PunchMatchingService;
import sp.sistemaspalacios.attendance_engine.service.payroll.OvertimePayService;
import sp.sistemaspalacios.attendance_engine.service.reconciliation.AttendanceReconciliationService;
import sp.sistemaspalacios.attendance_engine.service.repair.AttendanceRepairService;
import sp.sistemaspalacios.attendance_engine.service.review.AttendanceReviewService;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.Executor;

/**
 * Registra el núcleo de cálculo siempre, y los servicios de orquestación solo
 * cuando el anfitrión provee los almacenes que consumen.
 */
@AutoConfiguration
@EnableConfigurationProperties(ShiftConfiguration.class)
@ComponentScan(basePackageClasses = {
        TimeService.class,
        HourClassificationService.class,
        PunchMatchingService.class,
        AttendanceConsistencyService.class,
        AttendanceRepairService.class,
        AttendanceAggregationService.class,
        OvertimePayService.class
})
public class AttendanceEngineConfiguration {

    static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Guayaquil");

    @Bean
    @ConditionalOnMissingBean
    public Clock attendanceClock() {
        return Clock.system(DEFAULT_ZONE);
    }

    @Bean(name = "reconciliationExecutor")
    @ConditionalOnMissingBean(name = "reconciliationExecutor")
    public Executor reconciliationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(8);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("conciliacion-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({AttendanceRecordRepository.class, PunchEventRepository.class, MasterDataRepository.class})
    public AttendanceReconciliationService attendanceReconciliationService(
            AttendanceRecordRepository recordRepository,
            PunchEventRepository punchRepository,
            MasterDataRepository masterDataRepository,
            PunchMatchingService matchingService,
            HourClassificationService classificationService,
            AttendanceConsistencyService consistencyService,
            AttendanceRepairService repairService,
            Clock clock,
            @Qualifier("reconciliationExecutor") Executor executor) {
        return new AttendanceReconciliationService(recordRepository, punchRepository, masterDataRepository,
                matchingService, classificationService, consistencyService, repairService, clock, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({AttendanceRecordRepository.class, MasterDataRepository.class})
    public AttendanceReviewService attendanceReviewService(AttendanceRecordRepository recordRepository,
                                                           MasterDataRepository masterDataRepository,
                                                           AttendanceConsistencyService consistencyService,
                                                           HourClassificationService classificationService,
                                                           Clock clock) {
        return new AttendanceReviewService(recordRepository, masterDataRepository, consistencyService,
                classificationService, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean({AttendanceRecordRepository.class, MasterDataRepository.class})
    public AttendanceBatchService attendanceBatchService(AttendanceRecordRepository recordRepository,
                                                         MasterDataRepository masterDataRepository,
                                                         AttendanceConsistencyService consistencyService,
                                                         AttendanceRepairService repairService,
                                                         AttendanceAggregationService aggregationService) {
        return new AttendanceBatchService(recordRepository, masterDataRepository, consistencyService,
                repairService, aggregationService);
    }
}
