package sp.sistemaspalacios.attendance_engine.service.consistency;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import sp.sistemaspalacios.attendance_engine.config.ShiftConfiguration;
import sp.sistemaspalacios.attendance_engine.dto.attendance.AttendanceIssue;
import sp.sistemaspalacios.attendance_engine.dto.attendance.ConsistencyContext;
import sp.sistemaspalacios.attendance_engine.dto.attendance.IssueType;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchMatchResult;
import sp.sistemaspalacios.attendance_engine.dto.matching.PunchPair;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceRecord;
import sp.sistemaspalacios.attendance_engine.entity.attendance.AttendanceStatus;
import sp.sistemaspalacios.attendance_engine.service.common.TimeService;
import sp.sistemaspalacios.attendance_engine.validator.attendance.AttendanceRecordValidator;
import sp.sistemaspalacios.attendance_engine.validator.config.ShiftConfigurationValidator;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Evalúa un registro contra el conjunto fijo y ordenado de reglas de
 * consistencia. Solo lectura: dos ejecuciones sobre la misma entrada
 * devuelven la misma lista.
 */
@Service
@RequiredArgsConstructor
public class AttendanceConsistencyService {

    private static final Comparator<AttendanceRecord> BY_ID =
            Comparator.comparing(AttendanceRecord::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final TimeService timeService;

    public List<AttendanceIssue> check(AttendanceRecord record, ConsistencyContext context, ShiftConfiguration config) {
        AttendanceRecordValidator.requireWellFormed(record);
        ShiftConfigurationValidator.validate(config);
        if (context == null) {
            throw new IllegalArgumentException("El contexto de verificación es obligatorio.");
        }

        List<AttendanceIssue> issues = new ArrayList<>();
        if (record.isDeleted()) {
            return issues;
        }

        checkIncompletePairs(record, issues);
        checkTimeOrder(record, issues);
        checkNegativeHours(record, issues);
        checkOvertimeTotal(record, issues);
        checkDuplicates(record, context.sameDayRecords(), config, issues);
        checkOrphanedEmployee(record, context.employeeResolvable(), issues);
        return issues;
    }

    /**
     * Verifica un conjunto de registros persistidos, indexando los hallazgos
     * por id. Los duplicados se buscan dentro de cada grupo empleado/día del
     * propio conjunto.
     */
    public Map<Long, List<AttendanceIssue>> checkAll(List<AttendanceRecord> records,
                                                     Predicate<Long> employeeResolvable,
                                                     ShiftConfiguration config) {
        if (records == null) {
            throw new IllegalArgumentException("La lista de registros es obligatoria.");
        }
        Set<Long> ids = new HashSet<>();
        for (AttendanceRecord record : records) {
            if (record == null || record.getId() == null) {
                throw new IllegalArgumentException("La verificación en lote requiere registros persistidos (con id).");
            }
            if (!ids.add(record.getId())) {
                throw new IllegalArgumentException("Registro repetido en el lote: " + record.getId());
            }
        }

        Map<Long, List<AttendanceIssue>> result = new LinkedHashMap<>();
        Map<String, List<AttendanceRecord>> byEmployeeDay = records.stream()
                .collect(Collectors.groupingBy(r -> r.getEmployeeId() + "|" + r.getDate(), TreeMap::new, Collectors.toList()));

        records.stream().sorted(BY_ID).forEach(record -> {
            List<AttendanceRecord> siblings = byEmployeeDay.get(record.getEmployeeId() + "|" + record.getDate());
            ConsistencyContext context = new ConsistencyContext(employeeResolvable.test(record.getEmployeeId()), siblings);
            result.put(record.getId(), check(record, context, config));
        });
        return result;
    }

    /**
     * Hallazgos de un emparejamiento de marcaciones aún sin registro. Con el
     * día cerrado un par abierto ya es un par incompleto.
     */
    public List<AttendanceIssue> checkPairing(PunchMatchResult match, boolean dayClosed) {
        List<AttendanceIssue> issues = new ArrayList<>(match.getIssues());
        if (dayClosed) {
            for (int i = 0; i < match.getPairs().size(); i++) {
                PunchPair pair = match.getPairs().get(i);
                if (!pair.isComplete()) {
                    issues.add(AttendanceIssue.builder()
                            .type(IssueType.INCOMPLETE_PAIR)
                            .employeeId(match.getEmployeeId())
                            .date(match.getDate())
                            .field(pair.entry() == null ? entryField(i) : exitField(i))
                            .message("Par de marcaciones sin cerrar al finalizar el día")
                            .build());
                }
            }
        }
        return issues;
    }

    /**
     * Grupos de registros duplicados (mismo empleado y día, entradas o salidas
     * dentro del umbral). Cada grupo tiene al menos dos registros.
     */
    public List<List<AttendanceRecord>> findDuplicateGroups(List<AttendanceRecord> records, ShiftConfiguration config) {
        List<List<AttendanceRecord>> groups = new ArrayList<>();
        Map<String, List<AttendanceRecord>> byEmployeeDay = records.stream()
                .filter(r -> !r.isDeleted())
                .sorted(BY_ID)
                .collect(Collectors.groupingBy(r -> r.getEmployeeId() + "|" + r.getDate(), TreeMap::new, Collectors.toList()));

        for (List<AttendanceRecord> sameDay : byEmployeeDay.values()) {
            List<AttendanceRecord> pending = new ArrayList<>(sameDay);
            while (!pending.isEmpty()) {
                List<AttendanceRecord> group = new ArrayList<>();
                group.add(pending.remove(0));
                // Cierre transitivo de la relación de duplicado
                for (int i = 0; i < group.size(); i++) {
                    AttendanceRecord current = group.get(i);
                    for (int j = pending.size() - 1; j >= 0; j--) {
                        if (areDuplicates(current, pending.get(j), config)) {
                            group.add(pending.remove(j));
                        }
                    }
                }
                if (group.size() > 1) {
                    group.sort(BY_ID);
                    groups.add(group);
                }
            }
        }
        return groups;
    }

    public boolean areDuplicates(AttendanceRecord a, AttendanceRecord b, ShiftConfiguration config) {
        if (a.isDeleted() || b.isDeleted()) return false;
        if (Objects.equals(a.getId(), b.getId()) && a.getId() != null) return false;
        if (!Objects.equals(a.getEmployeeId(), b.getEmployeeId()) || !Objects.equals(a.getDate(), b.getDate())) {
            return false;
        }
        Duration threshold = Duration.ofMinutes(config.getDuplicateThresholdMinutes());
        if (a.getEntry() == null && a.getExit() == null && b.getEntry() == null && b.getExit() == null) {
            return true;
        }
        return within(a.getEntry(), b.getEntry(), threshold) || within(a.getExit(), b.getExit(), threshold);
    }

    // ==========================================
    // REGLAS (en orden fijo)
    // ==========================================

    private void checkIncompletePairs(AttendanceRecord record, List<AttendanceIssue> issues) {
        if (record.getStatus() == AttendanceStatus.PENDING) {
            return;
        }
        addIfOpen(record, record.getEntry(), record.getExit(), 0, issues);
        addIfOpen(record, record.getEntry2(), record.getExit2(), 1, issues);
    }

    private void addIfOpen(AttendanceRecord record, LocalTime entry, LocalTime exit, int index,
                           List<AttendanceIssue> issues) {
        if (entry != null && exit == null) {
            issues.add(issue(record, IssueType.INCOMPLETE_PAIR, exitField(index),
                    String.format("Entrada %s sin salida con estado %s", timeService.format(entry), record.getStatus())));
        } else if (entry == null && exit != null) {
            issues.add(issue(record, IssueType.INCOMPLETE_PAIR, entryField(index),
                    String.format("Salida %s sin entrada con estado %s", timeService.format(exit), record.getStatus())));
        }
    }

    private void checkTimeOrder(AttendanceRecord record, List<AttendanceIssue> issues) {
        if (record.getEntry() != null && record.getExit() != null && record.getExit().isBefore(record.getEntry())) {
            issues.add(issue(record, IssueType.TIME_ORDER_VIOLATION, "salida",
                    String.format("Salida %s anterior a la entrada %s",
                            timeService.format(record.getExit()), timeService.format(record.getEntry()))));
        }
        if (record.getEntry2() != null && record.getExit2() != null && record.getExit2().isBefore(record.getEntry2())) {
            issues.add(issue(record, IssueType.TIME_ORDER_VIOLATION, "salida2",
                    String.format("Segunda salida %s anterior a la segunda entrada %s",
                            timeService.format(record.getExit2()), timeService.format(record.getEntry2()))));
        }
        LocalTime firstEnd = record.getExit();
        if (firstEnd != null && record.getEntry2() != null && record.getEntry2().isBefore(firstEnd)) {
            issues.add(issue(record, IssueType.TIME_ORDER_VIOLATION, "entrada2",
                    String.format("Segunda entrada %s anterior al cierre del primer par %s",
                            timeService.format(record.getEntry2()), timeService.format(firstEnd))));
        }
    }

    private void checkNegativeHours(AttendanceRecord record, List<AttendanceIssue> issues) {
        addIfNegative(record, "horasRegulares", record.getRegularHours(), issues);
        addIfNegative(record, "horasExtras", record.getOvertimeHours(), issues);
        addIfNegative(record, "horasRecargo", record.getRecargo25Hours(), issues);
        addIfNegative(record, "horasSuplementarias", record.getSuplementario50Hours(), issues);
        addIfNegative(record, "horasExtraordinarias", record.getExtraordinario100Hours(), issues);
        addIfNegative(record, "horasNocturnas", record.getNightHours(), issues);
    }

    private void addIfNegative(AttendanceRecord record, String field, BigDecimal value, List<AttendanceIssue> issues) {
        if (value.signum() < 0) {
            issues.add(issue(record, IssueType.NEGATIVE_HOURS, field,
                    String.format("Valor negativo en %s: %s", field, value.toPlainString())));
        }
    }

    private void checkOvertimeTotal(AttendanceRecord record, List<AttendanceIssue> issues) {
        BigDecimal tiers = record.getHours().tierSum();
        if (record.getOvertimeHours().compareTo(tiers) != 0) {
            issues.add(issue(record, IssueType.OVERTIME_TOTAL_MISMATCH, "horasExtras",
                    String.format("Total de extras %s distinto de la suma de recargos %s",
                            record.getOvertimeHours().toPlainString(), tiers.toPlainString())));
        }
    }

    private void checkDuplicates(AttendanceRecord record, List<AttendanceRecord> sameDay,
                                 ShiftConfiguration config, List<AttendanceIssue> issues) {
        sameDay.stream()
                .filter(other -> other != record)
                .filter(other -> areDuplicates(record, other, config))
                .sorted(BY_ID)
                .forEach(other -> issues.add(issue(record, IssueType.DUPLICATE, "id",
                        String.format("Duplicado del registro %s (mismo empleado y día)", other.getId()))));
    }

    private void checkOrphanedEmployee(AttendanceRecord record, boolean resolvable, List<AttendanceIssue> issues) {
        if (!resolvable) {
            issues.add(issue(record, IssueType.ORPHANED_EMPLOYEE, "employeeId",
                    String.format("El empleado %d ya no existe en datos maestros", record.getEmployeeId())));
        }
    }

    // ===== MÉTODOS DE UTILIDAD =====

    private boolean within(LocalTime a, LocalTime b, Duration threshold) {
        if (a == null || b == null) return false;
        return Duration.between(a, b).abs().compareTo(threshold) <= 0;
    }

    private AttendanceIssue issue(AttendanceRecord record, IssueType type, String field, String message) {
        return AttendanceIssue.builder()
                .type(type)
                .recordId(record.getId())
                .employeeId(record.getEmployeeId())
                .date(record.getDate())
                .field(field)
                .message(message)
                .build();
    }

    private static String entryField(int index) {
        return index == 0 ? "entrada" : "entrada2";
    }

    private static String exitField(int index) {
        return index == 0 ? "salida" : "salida2";
    }
}
