package sp.sistemaspalacios.attendance_engine.dto.hours;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Desglose de horas de un día: regulares, total extra, los tres recargos
 * (25 %, 50 %, 100 %) y las nocturnas.
 * <p>
 * Las nocturnas son informativas y se superponen a las demás categorías;
 * no forman parte de {@link #totalWorked()}.
 */
public record HoursBreakdown(BigDecimal regular,
                             BigDecimal overtime,
                             BigDecimal recargo25,
                             BigDecimal suplementario50,
                             BigDecimal extraordinario100,
                             BigDecimal nocturnas) {

    public HoursBreakdown {
        Objects.requireNonNull(regular, "regular");
        Objects.requireNonNull(overtime, "overtime");
        Objects.requireNonNull(recargo25, "recargo25");
        Objects.requireNonNull(suplementario50, "suplementario50");
        Objects.requireNonNull(extraordinario100, "extraordinario100");
        Objects.requireNonNull(nocturnas, "nocturnas");
    }

    public static HoursBreakdown zero() {
        return new HoursBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    /** Construye el desglose calculando el total extra como suma de los tres recargos. */
    public static HoursBreakdown of(BigDecimal regular, BigDecimal recargo25, BigDecimal suplementario50,
                                    BigDecimal extraordinario100, BigDecimal nocturnas) {
        return new HoursBreakdown(regular, recargo25.add(suplementario50).add(extraordinario100),
                recargo25, suplementario50, extraordinario100, nocturnas);
    }

    public BigDecimal tierSum() {
        return recargo25.add(suplementario50).add(extraordinario100);
    }

    public BigDecimal totalWorked() {
        return regular.add(tierSum());
    }

    public boolean hasNegative() {
        return regular.signum() < 0 || overtime.signum() < 0 || recargo25.signum() < 0
                || suplementario50.signum() < 0 || extraordinario100.signum() < 0 || nocturnas.signum() < 0;
    }
}
