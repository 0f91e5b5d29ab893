package sp.sistemaspalacios.attendance_engine.repository.punch;

import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

public interface PunchEventRepository {

    List<PunchEvent> findUnprocessed(Long employeeId, LocalDate date);

    /** Marca las marcaciones como procesadas enlazándolas al registro resultante. */
    void markProcessed(Collection<Long> eventIds, Long attendanceRecordId);
}
