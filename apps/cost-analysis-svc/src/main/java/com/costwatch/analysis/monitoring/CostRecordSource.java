package com.costwatch.analysis.monitoring;

import com.costwatch.analysis.model.CostRecord;
import java.time.Instant;
import java.util.List;

/**
 * Supplies already-fetched billing records to scheduled monitoring.
 */
public interface CostRecordSource {

    /**
     * Records with {@code from <= timestamp < to}.
     */
    List<CostRecord> recordsBetween(Instant from, Instant to);

    /**
     * Drops records older than {@code cutoff}; returns how many were removed.
     */
    int evictBefore(Instant cutoff);
}
