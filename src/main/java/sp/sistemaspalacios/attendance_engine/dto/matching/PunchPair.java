package sp.sistemaspalacios.attendance_engine.dto.matching;

import sp.sistemaspalacios.attendance_engine.dto.time.WorkPeriod;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;

import java.util.ArrayList;
import java.util.List;

/**
 * Par entrada/salida armado a partir de marcaciones. Un extremo puede faltar.
 */
public record PunchPair(PunchEvent entry, PunchEvent exit) {

    public WorkPeriod toWorkPeriod() {
        return new WorkPeriod(
                entry == null ? null : entry.getTimestamp().toLocalTime(),
                exit == null ? null : exit.getTimestamp().toLocalTime());
    }

    public boolean isComplete() {
        return entry != null && exit != null;
    }

    public List<PunchEvent> events() {
        List<PunchEvent> events = new ArrayList<>(2);
        if (entry != null) events.add(entry);
        if (exit != null) events.add(exit);
        return events;
    }
}
