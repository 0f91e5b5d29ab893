package sp.sistemaspalacios.attendance_engine.dto.batch;

import lombok.Value;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Resultados por elemento de una operación en lote, en el orden de entrada.
 * Un elemento fallido no detiene el lote; el llamador decide si reintenta.
 */
@Value
public class BatchReport {
    List<BatchItemResult> items;
    boolean cancelled;

    public BatchReport(List<BatchItemResult> items, boolean cancelled) {
        this.items = List.copyOf(items);
        this.cancelled = cancelled;
    }

    public Map<ItemOutcome, Long> countByOutcome() {
        Map<ItemOutcome, Long> counts = new EnumMap<>(ItemOutcome.class);
        for (BatchItemResult item : items) {
            counts.merge(item.getOutcome(), 1L, Long::sum);
        }
        return counts;
    }

    public long count(ItemOutcome outcome) {
        return items.stream().filter(i -> i.getOutcome() == outcome).count();
    }

    /** Ids a reintentar: fallidos y no procesados por cancelación. */
    public List<Long> retryableIds() {
        return items.stream()
                .filter(i -> i.getOutcome() == ItemOutcome.FAILED || i.getOutcome() == ItemOutcome.CANCELLED)
                .map(BatchItemResult::getId)
                .collect(Collectors.toList());
    }

    /** Ids confirmados en esta ejecución, para pasarlos como ya confirmados al reintentar. */
    public List<Long> committedIds() {
        return items.stream()
                .filter(i -> i.getOutcome() == ItemOutcome.UPDATED || i.getOutcome() == ItemOutcome.UNCHANGED
                        || i.getOutcome() == ItemOutcome.SKIPPED)
                .map(BatchItemResult::getId)
                .collect(Collectors.toList());
    }
}
