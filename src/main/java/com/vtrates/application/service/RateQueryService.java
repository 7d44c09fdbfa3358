package com.vtrates.application.service;

import com.vtrates.application.port.in.RateQueryUseCase;
import com.vtrates.application.port.out.RateCache;
import com.vtrates.domain.exception.CurrencyNotFoundException;
import com.vtrates.domain.exception.RateNotFoundException;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.CurrencyRegistry;
import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import io.vertx.core.Future;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;

/**
 * Read side of the rate cache used by the command surface and trading collaborators
 */
@Slf4j
@RequiredArgsConstructor
public class RateQueryService implements RateQueryUseCase {

    private final RateCache cache;
    private final CurrencyRegistry registry;
    private final FreshnessGate freshnessGate;
    private final RateValidator validator;
    private final Duration ratesTtl;

    @Override
    public Future<RateQuote> getRate(String from, String to) {
        CurrencyPair pair;
        try {
            pair = registry.pair(from, to);
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }

        return cache.get(pair)
                .map(found -> found.orElseThrow(() -> new RateNotFoundException(pair)))
                .map(record -> {
                    validator.requireWithinBounds(pair, record.rate());
                    boolean fresh = freshnessGate.isFresh(record, ratesTtl);
                    if (!fresh) {
                        log.warn("Rate {} is stale (updated {})", pair, record.updatedAt());
                    }
                    return new RateQuote(record, fresh, freshnessGate.age(record.updatedAt()), ratesTtl);
                });
    }

    @Override
    public Future<RateRecord> getUsableRate(String from, String to) {
        return getRate(from, to)
                .map(quote -> freshnessGate.requireFresh(quote.record(), ratesTtl));
    }

    @Override
    public Future<RateListing> listRates(String currency, Integer top) {
        if (currency != null && !currency.isBlank() && !registry.contains(currency)) {
            return Future.failedFuture(new CurrencyNotFoundException(currency));
        }
        if (top != null && top < 0) {
            return Future.failedFuture(new IllegalArgumentException("top must be non-negative"));
        }
        String filter = currency == null || currency.isBlank() ? null : currency;

        return cache.load().map(table -> listing(table, filter, top));
    }

    private RateListing listing(RateTable table, String currency, Integer top) {
        boolean fresh = table.lastRefresh()
                .map(lastRefresh -> freshnessGate.isFresh(lastRefresh, ratesTtl))
                .orElse(false);
        return new RateListing(table.list(currency, top), table.lastRefresh().orElse(null), fresh, table.size());
    }

    @Override
    public Future<List<HistoryEntry>> history(HistoryFilter filter, int limit) {
        if (limit < 0) {
            return Future.failedFuture(new IllegalArgumentException("limit must be non-negative"));
        }
        return cache.history(filter == null ? HistoryFilter.all() : filter, limit);
    }
}
