package sp.sistemaspalacios.attendance_engine.exception;

import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;

public class InvalidStatusTransitionException extends RuntimeException {

    private final AttendanceStatus from;
    private final AttendanceStatus to;

    public InvalidStatusTransitionException(AttendanceStatus from, AttendanceStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public AttendanceStatus getFrom() {
        return from;
    }

    public AttendanceStatus getTo() {
        return to;
    }
}
