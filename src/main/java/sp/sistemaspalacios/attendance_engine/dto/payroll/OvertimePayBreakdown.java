package sp.sistemaspalacios.attendance_engine.dto.payroll;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/** Valores monetarios por categoría de horas, redondeados a centavos. */
@Value
@Builder
public class OvertimePayBreakdown {
    BigDecimal hourlyRate;
    BigDecimal regularAmount;
    BigDecimal recargoAmount;
    BigDecimal suplementarioAmount;
    BigDecimal extraordinarioAmount;
    BigDecimal nightPremiumAmount;
    BigDecimal totalAmount;

    public BigDecimal getOvertimeAmount() {
        return recargoAmount.add(suplementarioAmount).add(extraordinarioAmount);
    }
}
