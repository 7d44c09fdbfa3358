package com.vtrates.domain.model;

import java.time.Instant;

/**
 * Criteria for history queries; null fields match everything.
 */
public record HistoryFilter(String currency, CurrencyPair pair, String source, Instant since) {

    public static HistoryFilter all() {
        return new HistoryFilter(null, null, null, null);
    }

    public static HistoryFilter forCurrency(String currency) {
        return new HistoryFilter(currency, null, null, null);
    }

    public boolean matches(HistoryEntry entry) {
        if (currency != null && !entry.pair().involves(currency.trim().toUpperCase())) {
            return false;
        }
        if (pair != null && !pair.equals(entry.pair())) {
            return false;
        }
        if (source != null && !source.equalsIgnoreCase(entry.source())) {
            return false;
        }
        return since == null || !entry.timestamp().isBefore(since);
    }
}
