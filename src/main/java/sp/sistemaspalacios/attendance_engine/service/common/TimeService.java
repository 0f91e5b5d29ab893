package sp.sistemaspalacios.attendance_engine.service.common;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.report.Granularity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;

@Service
public class TimeService {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    /** Parsea "HH:mm" estrictamente. */
    public LocalTime parse(String hhmm) {
        if (hhmm == null) throw new IllegalArgumentException("Hora nula");
        try {
            return LocalTime.parse(hhmm.trim(), HH_MM);
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Hora inválida (HH:mm): " + hhmm);
        }
    }

    /** Formatea a "HH:mm". */
    public String format(LocalTime t) {
        return (t == null) ? "--:--" : t.format(HH_MM);
    }

    /**
     * Segundos → horas con un único redondeo HALF_UP a la escala indicada.
     * Es el único punto donde se redondea.
     */
    public BigDecimal secondsToHours(long seconds, int scale) {
        return BigDecimal.valueOf(seconds).divide(SECONDS_PER_HOUR, scale, RoundingMode.HALF_UP);
    }

    // ===== VENTANAS DE TIEMPO =====

    /** Primer día de la ventana que contiene la fecha. */
    public LocalDate periodStart(LocalDate date, Granularity granularity) {
        switch (granularity) {
            case WEEK:
                return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            case MONTH:
                return date.withDayOfMonth(1);
            default:
                return date;
        }
    }

    /**
     * Etiqueta canónica de la ventana: "2025-03-04", "2025-W10" (semana ISO) o "2025-03".
     */
    public String periodKey(LocalDate date, Granularity granularity) {
        switch (granularity) {
            case WEEK:
                return String.format("%d-W%02d",
                        date.get(IsoFields.WEEK_BASED_YEAR),
                        date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
            case MONTH:
                return String.format("%d-%02d", date.getYear(), date.getMonthValue());
            default:
                return date.toString();
        }
    }

    /** Días laborables del rango [from, to] según días de descanso y feriados configurados. */
    public int workingDaysBetween(LocalDate from, LocalDate to, ShiftConfiguration config) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("El rango de fechas es obligatorio");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Rango inválido: " + from + " > " + to);
        }
        int days = 0;
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            if (!config.isRestDay(d)) {
                days++;
            }
        }
        return days;
    }
}
