package com.vtrates.application.port.in;

import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateRecord;
import io.vertx.core.Future;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Input port for reading cached rates
 */
public interface RateQueryUseCase {

    /**
     * Look up a rate and annotate it with its freshness
     */
    Future<RateQuote> getRate(String from, String to);

    /**
     * Look up a rate for trading; fails with StaleRateException when older than the TTL
     */
    Future<RateRecord> getUsableRate(String from, String to);

    /**
     * Cached rates touching {@code currency} (all when null), highest first, at most {@code top}
     */
    Future<RateListing> listRates(String currency, Integer top);

    Future<List<HistoryEntry>> history(HistoryFilter filter, int limit);

    /**
     * Rate lookup result with freshness annotation
     */
    record RateQuote(RateRecord record, boolean fresh, Duration age, Duration ttl) {

        public double inverseRate() {
            return 1.0 / record.rate();
        }
    }

    /**
     * Snapshot listing for display
     */
    record RateListing(List<RateRecord> records, Instant lastRefresh, boolean fresh, int totalPairs) {
    }
}
