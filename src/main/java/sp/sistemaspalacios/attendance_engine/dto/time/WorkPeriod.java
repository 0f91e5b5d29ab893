package sp.sistemaspalacios.attendance_engine.dto.time;

import java.time.LocalTime;

/**
 * Par entrada/salida de un día. Cualquiera de los extremos puede faltar
 * mientras el día no se haya resuelto.
 */
public record WorkPeriod(LocalTime entry, LocalTime exit) {

    public boolean isComplete() {
        return entry != null && exit != null;
    }

    public boolean isReversed() {
        return isComplete() && exit.isBefore(entry);
    }
}
