package com.vtrates.application.port.out;

import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import io.vertx.core.Future;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Output port for the durable rate snapshot and its append-only history
 */
public interface RateCache {

    /**
     * Atomically replace the snapshot with {@code table} and append {@code observed} to history.
     * Records carried over from an earlier snapshot belong in {@code table} only.
     * On failure the previous snapshot stays intact.
     */
    Future<Void> save(RateTable table, List<RateRecord> observed);

    /**
     * Save a table whose direct records were all observed in this run
     */
    default Future<Void> save(RateTable table) {
        return save(table, table.directRecords());
    }

    /**
     * Current snapshot, or an empty table when none was saved yet
     */
    Future<RateTable> load();

    /**
     * Look up a rate: direct key, then stored inverse, then bridge through the base currency
     */
    Future<Optional<RateRecord>> get(CurrencyPair pair);

    /**
     * History entries matching {@code filter}, newest first, at most {@code limit}
     */
    Future<List<HistoryEntry>> history(HistoryFilter filter, int limit);

    /**
     * Remove history entries older than {@code maxAge}
     * @return number of removed entries
     */
    Future<Integer> pruneHistory(Duration maxAge);
}
