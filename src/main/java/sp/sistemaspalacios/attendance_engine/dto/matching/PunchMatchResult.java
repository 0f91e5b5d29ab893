package sp.sistemaspalacios.attendance_engine.dto.matching;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

@Value
@Builder
public class PunchMatchResult {
    Long employeeId;
    LocalDate date;

    /** Como máximo dos pares, en orden cronológico. */
    @Singular
    List<PunchPair> pairs;

    /** Marcaciones descartadas por duplicadas dentro del umbral. */
    @Singular
    List<PunchEvent> duplicates;

    /** Marcaciones posteriores al segundo par: van a revisión manual. */
    @Singular
    List<PunchEvent> reviewEvents;

    @Singular
    List<AttendanceIssue> issues;

    /** Marcaciones consumidas por el emparejamiento (pares y duplicadas). */
    public List<PunchEvent> consumedEvents() {
        List<PunchEvent> consumed = new ArrayList<>();
        for (PunchPair pair : pairs) {
            consumed.addAll(pair.events());
        }
        consumed.addAll(duplicates);
        return consumed;
    }

    public boolean hasOpenPair() {
        return pairs.stream().anyMatch(p -> !p.isComplete());
    }
}
