package com.vtrates.domain.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable entry of the append-only rate history
 */
public record HistoryEntry(
        String id,
        CurrencyPair pair,
        double rate,
        Instant timestamp,
        String source,
        Map<String, Object> meta
) {

    public HistoryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(timestamp, "timestamp");
        meta = meta == null ? Map.of() : Map.copyOf(meta);
    }

    public static String generateId(CurrencyPair pair, Instant timestamp, String runId) {
        return pair.key() + "_" + timestamp.toString().replace(':', '-') + "_" + runId;
    }
}
