package sp.sistemaspalacios.attendance_engine.service.matching;

import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchMatchResult;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchPair;
import sp.sistemaspalacios.attendance_engine.entity.punch.MovementType;
import sp.sistemaspalacios.attendance_engine.entity.punch.PunchEvent;
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Empareja las marcaciones de un empleado en un día.
 * <ol>
 *   <li>Ordena por hora.</li>
 *   <li>Infiere el tipo de las marcaciones sin tipo por posición: tras una
 *   entrada va una salida; en otro caso, entrada.</li>
 *   <li>Fusiona marcaciones del mismo tipo efectivo dentro del umbral (queda la primera).</li>
 *   <li>Arma hasta dos pares entrada/salida; el resto va a revisión.</li>
 * </ol>
 * Toda inferencia o ambigüedad se reporta como hallazgo, nunca se oculta.
 */
@Service
public class PunchMatchingService {

    private static final int MAX_PAIRS = 2;

    private static final Comparator<PunchEvent> CHRONOLOGICAL = Comparator
            .comparing(PunchEvent::getTimestamp)
            .thenComparing(PunchEvent::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    public PunchMatchResult match(List<PunchEvent> events, ShiftConfiguration config) {
        ShiftConfigurationValidator.validate(config);
        return match(events, config.getDuplicateThresholdMinutes(), config.getMinimumConfidence());
    }

    public PunchMatchResult match(List<PunchEvent> events, int thresholdMinutes, BigDecimal minimumConfidence) {
        AttendanceRecordValidator.requireSingleEmployeeDay(events);
        if (thresholdMinutes < 0) {
            throw new IllegalArgumentException("El umbral de duplicados no puede ser negativo.");
        }

        PunchMatchResult.PunchMatchResultBuilder result = PunchMatchResult.builder();
        if (events.isEmpty()) {
            return result.build();
        }

        List<PunchEvent> sorted = new ArrayList<>(events);
        sorted.sort(CHRONOLOGICAL);
        Long employeeId = sorted.get(0).getEmployeeId();
        LocalDate date = sorted.get(0).getDate();
        result.employeeId(employeeId).date(date);

        // ==========================================
        // PASO 1: INFERENCIA POR POSICIÓN
        // ==========================================

        List<ResolvedPunch> resolved = new ArrayList<>(sorted.size());
        MovementType previous = null;
        for (PunchEvent event : sorted) {
            ResolvedPunch punch = new ResolvedPunch(event);
            if (punch.type == MovementType.UNKNOWN) {
                punch.type = (previous == MovementType.ENTRY) ? MovementType.EXIT : MovementType.ENTRY;
                result.issue(issue(IssueType.INFERRED_MOVEMENT, employeeId, date, event,
                        String.format("Marcación %s sin tipo; se asume %s por posición",
                                event.getTimestamp().toLocalTime(), punch.type)));
            }
            previous = punch.type;
            resolved.add(punch);
        }

        // ==========================================
        // PASO 2: DUPLICADOS DEL MISMO TIPO
        // ==========================================

        List<ResolvedPunch> kept = new ArrayList<>();
        Duration threshold = Duration.ofMinutes(thresholdMinutes);
        for (ResolvedPunch punch : resolved) {
            ResolvedPunch last = kept.isEmpty() ? null : kept.get(kept.size() - 1);
            if (last != null && isDuplicateOf(last, punch, threshold)) {
                result.duplicate(punch.event);
                continue;
            }
            kept.add(punch);

            BigDecimal confidence = punch.event.getConfidence();
            if (confidence != null && minimumConfidence != null && confidence.compareTo(minimumConfidence) < 0) {
                result.issue(issue(IssueType.LOW_CONFIDENCE, employeeId, date, punch.event,
                        String.format("Confianza %s inferior al mínimo %s", confidence, minimumConfidence)));
            }
        }

        // ==========================================
        // PASO 3: EMPAREJAMIENTO
        // ==========================================

        List<PunchPair> pairs = new ArrayList<>(MAX_PAIRS);
        PunchEvent open = null;
        int index = 0;
        for (; index < kept.size(); index++) {
            if (pairs.size() == MAX_PAIRS) {
                break;
            }
            ResolvedPunch punch = kept.get(index);
            if (punch.type == MovementType.ENTRY) {
                if (open != null) {
                    result.issue(issue(IssueType.AMBIGUOUS_SEQUENCE, employeeId, date, punch.event,
                            String.format("Dos entradas seguidas (%s y %s) sin salida intermedia",
                                    open.getTimestamp().toLocalTime(), punch.event.getTimestamp().toLocalTime())));
                    pairs.add(new PunchPair(open, null));
                    open = null;
                    if (pairs.size() == MAX_PAIRS) {
                        break;
                    }
                }
                open = punch.event;
            } else {
                if (open != null) {
                    pairs.add(new PunchPair(open, punch.event));
                    open = null;
                } else {
                    result.issue(issue(IssueType.AMBIGUOUS_SEQUENCE, employeeId, date, punch.event,
                            String.format("Salida %s sin entrada previa", punch.event.getTimestamp().toLocalTime())));
                    pairs.add(new PunchPair(null, punch.event));
                }
            }
        }
        if (open != null) {
            pairs.add(new PunchPair(open, null));
        }
        result.pairs(pairs);

        if (index < kept.size()) {
            List<PunchEvent> excess = new ArrayList<>();
            for (int i = index; i < kept.size(); i++) {
                excess.add(kept.get(i).event);
            }
            result.reviewEvents(excess);
            result.issue(issue(IssueType.EXCESS_PUNCHES, employeeId, date, excess.get(0),
                    String.format("%d marcaciones después del segundo par requieren revisión manual", excess.size())));
        }

        return result.build();
    }

    private boolean isDuplicateOf(ResolvedPunch last, ResolvedPunch punch, Duration threshold) {
        Duration gap = Duration.between(last.event.getTimestamp(), punch.event.getTimestamp());
        return gap.compareTo(threshold) <= 0 && last.type == punch.type;
    }

    private static MovementType typeOf(PunchEvent event) {
        return event.getMovementType() == null ? MovementType.UNKNOWN : event.getMovementType();
    }

    private AttendanceIssue issue(IssueType type, Long employeeId, LocalDate date, PunchEvent event, String message) {
        return AttendanceIssue.builder()
                .type(type)
                .employeeId(employeeId)
                .date(date)
                .field("marcacion:" + event.getId())
                .message(message)
                .build();
    }

    /** Marcación con su tipo efectivo (el del dispositivo o el inferido). */
    private static final class ResolvedPunch {
        private final PunchEvent event;
        private MovementType type;

        private ResolvedPunch(PunchEvent event) {
            this.event = event;
            this.type = typeOf(event);
        }
    }
}
