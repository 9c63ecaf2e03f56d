package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.model.CostRecord;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.springframework.stereotype.Repository;

/**
 * Append-only buffer of ingested records.
 */
@Repository
public class InMemoryCostRecordSource implements CostRecordSource {

    private final CopyOnWriteArrayList<CostRecord> records = new CopyOnWriteArrayList<>();

    public int append(Collection<CostRecord> newRecords) {
        List<CostRecord> usable = newRecords.stream()
                .filter(record -> record != null && record.timestamp() != null && record.amount() != null)
                .toList();
        records.addAll(usable);
        return usable.size();
    }

    @Override
    public List<CostRecord> recordsBetween(Instant from, Instant to) {
        return records.stream()
                .filter(record -> !record.timestamp().isBefore(from) && record.timestamp().isBefore(to))
                .toList();
    }

    public int size() {
        return records.size();
    }

    @Override
    public int evictBefore(Instant cutoff) {
        int before = records.size();
        records.removeIf(record -> record.timestamp().isBefore(cutoff));
        return before - records.size();
    }
}
