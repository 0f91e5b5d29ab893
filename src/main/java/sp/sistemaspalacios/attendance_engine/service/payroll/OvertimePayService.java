package sp.sistemaspalacios.attendance_engine.service.payroll;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.hours.HoursBreakdown;
import sp.sistemaspalacios.attendance_engine.dto.payroll.OvertimePayBreakdown;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Valoriza un desglose de horas: cada recargo paga la hora más su porcentaje
 * (1.25, 1.50, 2.00 con las tasas por defecto) y las nocturnas suman solo el
 * adicional nocturno sobre la hora base.
 */
@Service
public class OvertimePayService {

    private static final int MONEY_SCALE = 2;

    public OvertimePayBreakdown calculate(HoursBreakdown hours, BigDecimal hourlyRate, ShiftConfiguration config) {
        if (hours == null) {
            throw new IllegalArgumentException("El desglose de horas es obligatorio.");
        }
        if (hourlyRate == null || hourlyRate.signum() < 0) {
            throw new IllegalArgumentException("El valor hora debe ser mayor o igual a cero: " + hourlyRate);
        }
        ShiftConfigurationValidator.validate(config);

        BigDecimal regular = money(hours.regular().multiply(hourlyRate));
        BigDecimal recargo = money(hours.recargo25().multiply(premium(hourlyRate, config.getRecargoRate())));
        BigDecimal suplementario = money(hours.suplementario50().multiply(premium(hourlyRate, config.getSuplementarioRate())));
        BigDecimal extraordinario = money(hours.extraordinario100().multiply(premium(hourlyRate, config.getExtraordinarioRate())));
        BigDecimal night = money(hours.nocturnas().multiply(hourlyRate).multiply(config.getNightRate()));

        return OvertimePayBreakdown.builder()
                .hourlyRate(hourlyRate)
                .regularAmount(regular)
                .recargoAmount(recargo)
                .suplementarioAmount(suplementario)
                .extraordinarioAmount(extraordinario)
                .nightPremiumAmount(night)
                .totalAmount(regular.add(recargo).add(suplementario).add(extraordinario).add(night))
                .build();
    }

    /** Valor hora = sueldo mensual / horas mensuales configuradas (240 por defecto). */
    public BigDecimal hourlyRateFromMonthlySalary(BigDecimal monthlySalary, ShiftConfiguration config) {
        if (monthlySalary == null || monthlySalary.signum() < 0) {
            throw new IllegalArgumentException("El sueldo mensual debe ser mayor o igual a cero: " + monthlySalary);
        }
        ShiftConfigurationValidator.validate(config);
        return monthlySalary.divide(BigDecimal.valueOf(config.getMonthlyHours()), 4, RoundingMode.HALF_UP);
    }

    private BigDecimal premium(BigDecimal hourlyRate, BigDecimal rate) {
        return hourlyRate.multiply(BigDecimal.ONE.add(rate));
    }

    private BigDecimal money(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
