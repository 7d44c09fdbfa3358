package com.vtrates.domain.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one aggregation run
 */
public record UpdateResult(
        String runId,
        boolean success,
        Map<CurrencyClass, RateCounts> counts,
        List<SourceReport> sources,
        int totalSaved,
        long elapsedMs,
        Instant lastRefresh,
        String error
) {

    public UpdateResult {
        Map<CurrencyClass, RateCounts> copy = new EnumMap<>(CurrencyClass.class);
        for (CurrencyClass currencyClass : CurrencyClass.values()) {
            copy.put(currencyClass, RateCounts.zero());
        }
        if (counts != null) {
            copy.putAll(counts);
        }
        counts = Map.copyOf(copy);
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static UpdateResult failed(String runId, Map<CurrencyClass, RateCounts> counts,
                                      List<SourceReport> sources, long elapsedMs, String error) {
        return new UpdateResult(runId, false, counts, sources, 0, elapsedMs, null, error);
    }

    public RateCounts countsFor(CurrencyClass currencyClass) {
        return counts.get(currencyClass);
    }

    public int totalRejected() {
        return counts.values().stream().mapToInt(RateCounts::rejected).sum();
    }

    public int totalFetched() {
        return counts.values().stream().mapToInt(RateCounts::fetched).sum();
    }

    public long successfulSources() {
        return sources.stream().filter(SourceReport::success).count();
    }
}
