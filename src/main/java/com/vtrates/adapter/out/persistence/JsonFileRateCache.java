package com.vtrates.adapter.out.persistence;

import com.vtrates.application.port.out.RateCache;
import com.vtrates.domain.exception.PersistenceException;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.HistoryEntry;
import com.vtrates.domain.model.HistoryFilter;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.file.CopyOptions;
import io.vertx.core.file.FileSystem;
import io.vertx.core.file.OpenOptions;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.core.shareddata.Lock;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * File implementation of RateCache.
 * The snapshot and the history are each replaced by write-to-temp then atomic move,
 * so readers never observe a partial file. Writers are serialized by a local lock.
 */
@Slf4j
public class JsonFileRateCache implements RateCache {

    private static final String LOCK_PREFIX = "vtrates.rate-cache:";
    private static final String TEMP_SUFFIX = ".tmp";
    private static final long DEFAULT_LOCK_TIMEOUT_MS = 30_000;

    private final Vertx vertx;
    private final Path snapshotPath;
    private final Path historyPath;
    private final String baseCurrency;
    private final Clock clock;
    private final long lockTimeoutMs;

    public JsonFileRateCache(Vertx vertx, Path snapshotPath, Path historyPath, String baseCurrency, Clock clock) {
        this(vertx, snapshotPath, historyPath, baseCurrency, clock, DEFAULT_LOCK_TIMEOUT_MS);
    }

    public JsonFileRateCache(Vertx vertx, Path snapshotPath, Path historyPath, String baseCurrency, Clock clock,
                             long lockTimeoutMs) {
        this.vertx = vertx;
        this.snapshotPath = snapshotPath.toAbsolutePath();
        this.historyPath = historyPath.toAbsolutePath();
        this.baseCurrency = baseCurrency;
        this.clock = clock;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public Future<Void> save(RateTable table, List<RateRecord> observed) {
        log.info("Saving {} rates to {}", table.size(), snapshotPath);

        // History first: a failed history write must not leave a new snapshot behind
        return withWriteLock(() -> appendHistory(observed)
                .compose(v -> writeAtomically(snapshotPath, Buffer.buffer(RateJsonCodec.encodeTable(table).encodePrettily()))))
                .onSuccess(v -> log.info("Saved {} rates to {}", table.size(), snapshotPath))
                .onFailure(error -> log.error("Failed to save rates to {}: {}", snapshotPath, error.getMessage()));
    }

    @Override
    public Future<RateTable> load() {
        FileSystem fs = vertx.fileSystem();
        return fs.exists(snapshotPath.toString())
                .compose(exists -> {
                    if (!exists) {
                        log.debug("No snapshot at {}, returning empty table", snapshotPath);
                        return Future.succeededFuture(RateTable.empty());
                    }
                    return fs.readFile(snapshotPath.toString())
                            .map(buffer -> RateJsonCodec.decodeTable(buffer.toJsonObject()));
                })
                .recover(error -> Future.failedFuture(
                        new PersistenceException("Failed to read rate snapshot " + snapshotPath, error)));
    }

    @Override
    public Future<Optional<RateRecord>> get(CurrencyPair pair) {
        return load().map(table -> table.lookup(pair, baseCurrency));
    }

    @Override
    public Future<List<HistoryEntry>> history(HistoryFilter filter, int limit) {
        return readHistory().map(entries -> entries.stream()
                .filter(filter::matches)
                .sorted(Comparator.comparing(HistoryEntry::timestamp).reversed())
                .limit(Math.max(0, limit))
                .toList());
    }

    @Override
    public Future<Integer> pruneHistory(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        return withWriteLock(() -> readHistory().compose(entries -> {
            List<HistoryEntry> kept = entries.stream()
                    .filter(entry -> !entry.timestamp().isBefore(cutoff))
                    .toList();
            int removed = entries.size() - kept.size();
            if (removed == 0) {
                return Future.succeededFuture(0);
            }
            return writeAtomically(historyPath, RateJsonCodec.encodeHistory(kept).toBuffer())
                    .map(v -> {
                        log.info("Pruned {} history entries older than {}", removed, cutoff);
                        return removed;
                    });
        }));
    }

    private Future<Void> appendHistory(List<RateRecord> observed) {
        List<RateRecord> direct = observed.stream().filter(RateRecord::isDirect).toList();
        if (direct.isEmpty()) {
            return Future.succeededFuture();
        }

        Instant timestamp = clock.instant();
        String runId = UUID.randomUUID().toString().substring(0, 8);

        return readHistory().compose(existing -> {
            List<HistoryEntry> entries = new ArrayList<>(existing);
            for (RateRecord record : direct) {
                entries.add(new HistoryEntry(
                        HistoryEntry.generateId(record.pair(), timestamp, runId),
                        record.pair(),
                        record.rate(),
                        timestamp,
                        record.source(),
                        Map.of("origin", record.origin().getValue(),
                                "updated_at", record.updatedAt().toString(),
                                "run_id", runId)));
            }
            log.debug("Appending {} entries to history {}", direct.size(), historyPath);
            return writeAtomically(historyPath, RateJsonCodec.encodeHistory(entries).toBuffer());
        });
    }

    private Future<List<HistoryEntry>> readHistory() {
        FileSystem fs = vertx.fileSystem();
        return fs.exists(historyPath.toString())
                .compose(exists -> {
                    if (!exists) {
                        return Future.succeededFuture(List.<HistoryEntry>of());
                    }
                    return fs.readFile(historyPath.toString())
                            .map(buffer -> RateJsonCodec.decodeHistory(parseJson(buffer)));
                })
                .recover(error -> Future.failedFuture(
                        new PersistenceException("Failed to read rate history " + historyPath, error)));
    }

    private static Object parseJson(Buffer buffer) {
        String text = buffer.toString().trim();
        return text.startsWith("[") ? new JsonArray(text) : new JsonObject(text);
    }

    /**
     * Write {@code data} to a sibling temp file, flush it, then move it over {@code target}
     */
    private Future<Void> writeAtomically(Path target, Buffer data) {
        FileSystem fs = vertx.fileSystem();
        String temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX).toString();
        OpenOptions options = new OpenOptions()
                .setWrite(true)
                .setCreate(true)
                .setTruncateExisting(true)
                .setDsync(true);

        return fs.mkdirs(target.getParent().toString())
                .compose(v -> fs.open(temp, options))
                .compose(file -> file.write(data).compose(
                        v -> file.close(),
                        error -> file.close().transform(ar -> Future.<Void>failedFuture(error))))
                .compose(v -> fs.move(temp, target.toString(),
                        new CopyOptions().setReplaceExisting(true).setAtomicMove(true)))
                .recover(error -> Future.failedFuture(
                        new PersistenceException("Failed to write " + target, error)));
    }

    private <T> Future<T> withWriteLock(Supplier<Future<T>> action) {
        return vertx.sharedData()
                .getLocalLockWithTimeout(LOCK_PREFIX + snapshotPath, lockTimeoutMs)
                .recover(error -> Future.failedFuture(
                        new PersistenceException("Could not acquire write lock for " + snapshotPath, error)))
                .compose(lock -> runAndRelease(lock, action));
    }

    private static <T> Future<T> runAndRelease(Lock lock, Supplier<Future<T>> action) {
        Future<T> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = Future.failedFuture(e);
        }
        return result.onComplete(ar -> lock.release());
    }
}
