package com.vtrates.application.service;

import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.application.port.out.RateCache;
import com.vtrates.application.port.out.RateSource;
import com.vtrates.domain.exception.NoSourcesAvailableException;
import com.vtrates.domain.exception.SourceTimeoutException;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.CurrencyRegistry;
import com.vtrates.domain.model.RateCounts;
import com.vtrates.domain.model.RateRecord;
import com.vtrates.domain.model.RateTable;
import com.vtrates.domain.model.SourceReport;
import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Application service implementing the rate update use case.
 * Fetches every source concurrently, merges newest-wins, derives inverse and
 * bridge rates, validates the result and replaces the cached snapshot.
 */
@Slf4j
public class RateAggregator implements RateUpdateUseCase {

    public static final String ALL_SOURCES = "all";

    private final Vertx vertx;
    private final List<RateSource> sources;
    private final RateCache cache;
    private final CurrencyRegistry registry;
    private final RateValidator validator;
    private final RetryPolicy retryPolicy;
    private final Duration sourceTimeout;
    private final List<String> sourcePriority;
    private final Clock clock;

    public RateAggregator(Vertx vertx,
                          List<RateSource> sources,
                          RateCache cache,
                          CurrencyRegistry registry,
                          RateValidator validator,
                          RetryPolicy retryPolicy,
                          Duration sourceTimeout,
                          List<String> sourcePriority,
                          Clock clock) {
        this.vertx = vertx;
        this.sources = List.copyOf(sources);
        this.cache = cache;
        this.registry = registry;
        this.validator = validator;
        this.retryPolicy = retryPolicy;
        this.sourceTimeout = sourceTimeout;
        this.sourcePriority = List.copyOf(sourcePriority);
        this.clock = clock;
    }

    @Override
    public List<String> sourceNames() {
        return sources.stream().map(RateSource::name).toList();
    }

    private Set<String> acceptedNames() {
        Set<String> names = new TreeSet<>(sourceNames());
        sources.stream().map(RateSource::provider).filter(Objects::nonNull).forEach(names::add);
        return names;
    }

    @Override
    public Future<UpdateResult> run() {
        return run(null);
    }

    @Override
    public Future<UpdateResult> run(String sourceName) {
        List<RateSource> selected;
        try {
            selected = select(sourceName);
        } catch (IllegalArgumentException e) {
            return Future.failedFuture(e);
        }

        boolean partial = selected.size() < sources.size();
        String runId = UUID.randomUUID().toString().substring(0, 8);
        long started = System.nanoTime();

        log.info("Rate update {} started with sources {}", runId,
                selected.stream().map(RateSource::name).toList());

        List<Future<SourceOutcome>> fetches = selected.stream()
                .map(this::fetchBounded)
                .toList();

        return Future.all(fetches)
                .compose(all -> {
                    List<SourceOutcome> outcomes = fetches.stream().map(Future::result).toList();
                    Future<RateTable> previous = partial ? cache.load() : Future.succeededFuture(RateTable.empty());
                    return previous.compose(previousTable ->
                            completeRun(runId, selected, outcomes, previousTable, started));
                });
    }

    private List<RateSource> select(String sourceName) {
        if (sourceName == null || sourceName.isBlank() || ALL_SOURCES.equalsIgnoreCase(sourceName)) {
            return sources;
        }
        String wanted = sourceName.trim().toLowerCase();
        List<RateSource> matching = sources.stream()
                .filter(source -> wanted.equals(source.name()) || wanted.equals(source.provider()))
                .toList();
        if (matching.isEmpty()) {
            throw new IllegalArgumentException("Unknown rate source '" + sourceName + "', expected one of "
                    + acceptedNames() + " or " + ALL_SOURCES);
        }
        return matching;
    }

    /**
     * Fetch one source with retry, bounded by the per-source timeout.
     * The returned future never fails; failures are captured in the outcome.
     */
    private Future<SourceOutcome> fetchBounded(RateSource source) {
        Promise<SourceOutcome> promise = Promise.promise();
        AtomicBoolean abandoned = new AtomicBoolean(false);
        long started = System.nanoTime();

        long timerId = vertx.setTimer(sourceTimeout.toMillis(), id -> {
            abandoned.set(true);
            SourceTimeoutException timeout = new SourceTimeoutException(source.name(),
                    "no response within " + sourceTimeout.toMillis() + " ms");
            if (promise.tryComplete(SourceOutcome.failure(source, timeout, elapsedMs(started)))) {
                log.warn("Source {} timed out after {} ms", source.name(), sourceTimeout.toMillis());
            }
        });

        FutureCombinators.withTiming("fetch " + source.name(), () ->
                        FutureCombinators.withRetry(vertx, retryPolicy, source.name(), abandoned::get, source::fetch))
                .onComplete(ar -> {
                    vertx.cancelTimer(timerId);
                    if (ar.succeeded()) {
                        Map<CurrencyPair, Double> rates = ar.result() == null ? Map.of() : ar.result();
                        promise.tryComplete(SourceOutcome.success(source, rates, clock.instant(), elapsedMs(started)));
                    } else {
                        log.warn("Source {} failed: {}", source.name(), ar.cause().getMessage());
                        promise.tryComplete(SourceOutcome.failure(source, ar.cause(), elapsedMs(started)));
                    }
                });

        return promise.future();
    }

    private Future<UpdateResult> completeRun(String runId,
                                             List<RateSource> selected,
                                             List<SourceOutcome> outcomes,
                                             RateTable previous,
                                             long started) {
        Map<CurrencyClass, RateCounts> counts = new EnumMap<>(CurrencyClass.class);
        for (CurrencyClass currencyClass : CurrencyClass.values()) {
            counts.put(currencyClass, RateCounts.zero());
        }
        List<SourceReport> reports = outcomes.stream().map(SourceOutcome::toReport).toList();

        List<SourceOutcome> succeeded = outcomes.stream().filter(SourceOutcome::succeeded).toList();
        if (succeeded.isEmpty()) {
            NoSourcesAvailableException error = new NoSourcesAvailableException(
                    "All " + outcomes.size() + " rate sources failed, cache left unchanged");
            log.error("Rate update {} failed", runId, error);
            return Future.succeededFuture(UpdateResult.failed(runId, counts, reports, elapsedMs(started), error.getMessage()));
        }

        Map<CurrencyPair, RateRecord> direct = new LinkedHashMap<>();
        Set<RateRecord> carried = carryForward(previous, selected, direct);
        for (SourceOutcome outcome : succeeded) {
            mergeOutcome(outcome, direct, counts);
        }
        List<RateRecord> observed = direct.values().stream()
                .filter(record -> !carried.contains(record))
                .toList();

        if (direct.isEmpty()) {
            NoSourcesAvailableException error = new NoSourcesAvailableException(
                    "Sources responded but no valid rate was received, cache left unchanged");
            log.error("Rate update {} failed", runId, error);
            return Future.succeededFuture(UpdateResult.failed(runId, counts, reports, elapsedMs(started), error.getMessage()));
        }

        Instant lastRefresh = clock.instant();
        RateTable table = buildTable(direct, counts, lastRefresh);
        table.records().keySet().forEach(pair -> counts.computeIfPresent(registry.classify(pair), (k, c) -> c.plusSaved(1)));

        return cache.save(table, observed)
                .map(v -> {
                    UpdateResult result = new UpdateResult(runId, true, counts, reports, table.size(),
                            elapsedMs(started), lastRefresh, null);
                    log.info("Rate update {} finished: {} pairs saved, {} rejected, {}/{} sources ok in {} ms",
                            runId, result.totalSaved(), result.totalRejected(),
                            result.successfulSources(), outcomes.size(), result.elapsedMs());
                    return result;
                })
                .onFailure(error -> log.error("Rate update {} could not persist the snapshot", runId, error));
    }

    /**
     * Keep direct records of sources that were not part of this run
     * @return the carried records, which are not new observations
     */
    private Set<RateRecord> carryForward(RateTable previous, List<RateSource> selected,
                                         Map<CurrencyPair, RateRecord> direct) {
        Set<String> selectedNames = selected.stream().map(RateSource::name).collect(Collectors.toSet());
        Set<RateRecord> carried = new HashSet<>();
        for (RateRecord record : previous.directRecords()) {
            if (!selectedNames.contains(record.source()) && validator.validate(record.pair(), record.rate()).isValid()) {
                mergeCandidate(direct, record);
                carried.add(record);
            }
        }
        return carried;
    }

    private void mergeOutcome(SourceOutcome outcome, Map<CurrencyPair, RateRecord> direct,
                              Map<CurrencyClass, RateCounts> counts) {
        outcome.rates().forEach((pair, rate) -> {
            CurrencyClass currencyClass = registry.classify(pair);
            counts.computeIfPresent(currencyClass, (k, c) -> c.plusFetched(1));

            if (!registry.contains(pair.from()) || !registry.contains(pair.to())) {
                counts.computeIfPresent(currencyClass, (k, c) -> c.plusRejected(1));
                log.warn("Rejected rate {} from {}: currency not registered", pair, outcome.source().name());
                return;
            }

            ValidationResult validation = validator.validate(pair, rate == null ? Double.NaN : rate);
            if (!validation.isValid()) {
                counts.computeIfPresent(currencyClass, (k, c) -> c.plusRejected(1));
                log.warn("Rejected rate from {}: {}", outcome.source().name(), validation.errors());
                return;
            }
            mergeCandidate(direct, RateRecord.direct(pair, rate, outcome.completedAt(), outcome.source().name()));
        });
    }

    /**
     * Keep one record per unordered pair: the newest, ties broken by source priority.
     * A candidate for B_A competes with an existing A_B.
     */
    private void mergeCandidate(Map<CurrencyPair, RateRecord> direct, RateRecord candidate) {
        RateRecord sameDirection = direct.get(candidate.pair());
        RateRecord opposite = direct.get(candidate.pair().inverse());
        RateRecord incumbent = sameDirection != null ? sameDirection : opposite;

        if (incumbent == null || isPreferred(candidate, incumbent)) {
            if (opposite != null) {
                direct.remove(opposite.pair());
            }
            direct.put(candidate.pair(), candidate);
        }
    }

    boolean isPreferred(RateRecord candidate, RateRecord incumbent) {
        int byTime = candidate.updatedAt().compareTo(incumbent.updatedAt());
        if (byTime != 0) {
            return byTime > 0;
        }
        return priorityOf(candidate.source()) < priorityOf(incumbent.source());
    }

    private int priorityOf(String sourceName) {
        int index = sourcePriority.indexOf(sourceName);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    private RateTable buildTable(Map<CurrencyPair, RateRecord> direct, Map<CurrencyClass, RateCounts> counts,
                                 Instant lastRefresh) {
        Map<CurrencyPair, RateRecord> records = new LinkedHashMap<>(direct);
        for (RateRecord record : direct.values()) {
            RateRecord inverse = record.invert();
            records.putIfAbsent(inverse.pair(), inverse);
        }

        addBridges(records, counts);
        return new RateTable(records, lastRefresh, RateTable.DEFAULT_SOURCE);
    }

    /**
     * For currencies A, B both convertible to the base currency and without a
     * direct rate, store rate(A,B) = rate(A,base) * rate(base,B) and its inverse.
     */
    private void addBridges(Map<CurrencyPair, RateRecord> records, Map<CurrencyClass, RateCounts> counts) {
        String base = registry.baseCurrency();
        Set<String> bridgeable = new TreeSet<>();
        for (CurrencyPair pair : records.keySet()) {
            if (pair.to().equals(base)) {
                bridgeable.add(pair.from());
            }
        }

        List<String> codes = new ArrayList<>(bridgeable);
        for (int i = 0; i < codes.size(); i++) {
            for (int j = i + 1; j < codes.size(); j++) {
                CurrencyPair pair = new CurrencyPair(codes.get(i), codes.get(j));
                if (records.containsKey(pair) || records.containsKey(pair.inverse())) {
                    continue;
                }

                RateRecord toBase = records.get(new CurrencyPair(pair.from(), base));
                RateRecord fromBase = records.get(new CurrencyPair(base, pair.to()));
                RateRecord bridged = RateTable.compose(pair, toBase, fromBase, base);

                ValidationResult validation = validator.validate(pair, bridged.rate());
                if (!validation.isValid()) {
                    counts.computeIfPresent(registry.classify(pair), (k, c) -> c.plusRejected(1));
                    log.warn("Rejected bridged rate: {}", validation.errors());
                    continue;
                }
                records.put(pair, bridged);
                records.put(pair.inverse(), bridged.invert());
            }
        }
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private record SourceOutcome(RateSource source,
                                 Map<CurrencyPair, Double> rates,
                                 Instant completedAt,
                                 Throwable error,
                                 long elapsedMs) {

        static SourceOutcome success(RateSource source, Map<CurrencyPair, Double> rates, Instant completedAt,
                                     long elapsedMs) {
            return new SourceOutcome(source, rates, completedAt, null, elapsedMs);
        }

        static SourceOutcome failure(RateSource source, Throwable error, long elapsedMs) {
            return new SourceOutcome(source, Map.of(), null, error, elapsedMs);
        }

        boolean succeeded() {
            return error == null;
        }

        SourceReport toReport() {
            return succeeded()
                    ? SourceReport.success(source.name(), rates.size(), elapsedMs)
                    : SourceReport.failure(source.name(), elapsedMs, error);
        }
    }
}
