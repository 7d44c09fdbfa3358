package com.vtrates.domain.model;

import java.time.Instant;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of all current rates keyed by pair, with one refresh timestamp
 * for the whole table. Immutable.
 */
public final class RateTable {

    public static final String DEFAULT_SOURCE = "ParserService";
    public static final String BRIDGE_SOURCE_PREFIX = "bridge:";

    private final Map<CurrencyPair, RateRecord> records;
    private final Instant lastRefresh;
    private final String source;

    public RateTable(Map<CurrencyPair, RateRecord> records, Instant lastRefresh, String source) {
        Map<CurrencyPair, RateRecord> copy = new LinkedHashMap<>();
        records.forEach((pair, record) -> {
            if (!pair.equals(record.pair())) {
                throw new IllegalArgumentException("Record " + record.pair() + " stored under key " + pair);
            }
            copy.put(pair, record);
        });
        this.records = Collections.unmodifiableMap(copy);
        this.lastRefresh = lastRefresh;
        this.source = source == null ? DEFAULT_SOURCE : source;
    }

    public static RateTable empty() {
        return new RateTable(Map.of(), null, DEFAULT_SOURCE);
    }

    public static RateTable of(List<RateRecord> records, Instant lastRefresh) {
        Map<CurrencyPair, RateRecord> map = new LinkedHashMap<>();
        records.forEach(record -> map.put(record.pair(), record));
        return new RateTable(map, lastRefresh, DEFAULT_SOURCE);
    }

    public Map<CurrencyPair, RateRecord> records() {
        return records;
    }

    public Optional<Instant> lastRefresh() {
        return Optional.ofNullable(lastRefresh);
    }

    public String source() {
        return source;
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public Optional<RateRecord> find(CurrencyPair pair) {
        return Optional.ofNullable(records.get(pair));
    }

    public List<RateRecord> directRecords() {
        return records.values().stream()
                .filter(RateRecord::isDirect)
                .toList();
    }

    /**
     * Resolve a rate in priority order: direct key, stored inverse (1/rate),
     * then a bridge through {@code baseCurrency} computed on the fly.
     */
    public Optional<RateRecord> lookup(CurrencyPair pair, String baseCurrency) {
        RateRecord direct = records.get(pair);
        if (direct != null) {
            return Optional.of(direct);
        }

        RateRecord reverse = records.get(pair.inverse());
        if (reverse != null) {
            return Optional.of(reverse.invert());
        }

        if (pair.involves(baseCurrency)) {
            return Optional.empty();
        }
        return bridge(pair.from(), pair.to(), baseCurrency);
    }

    private Optional<RateRecord> bridge(String from, String to, String base) {
        Optional<RateRecord> toBase = legToBase(from, base);
        Optional<RateRecord> fromBase = legToBase(to, base).map(RateRecord::invert);
        if (toBase.isEmpty() || fromBase.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(compose(new CurrencyPair(from, to), toBase.get(), fromBase.get(), base));
    }

    private Optional<RateRecord> legToBase(String code, String base) {
        CurrencyPair pair = new CurrencyPair(code, base);
        RateRecord direct = records.get(pair);
        if (direct != null) {
            return Optional.of(direct);
        }
        return Optional.ofNullable(records.get(pair.inverse())).map(RateRecord::invert);
    }

    /**
     * rate(A,B) = rate(A,base) * rate(base,B); the result is as old as its older leg.
     */
    public static RateRecord compose(CurrencyPair pair, RateRecord toBase, RateRecord fromBase, String base) {
        Instant updatedAt = toBase.updatedAt().isBefore(fromBase.updatedAt())
                ? toBase.updatedAt()
                : fromBase.updatedAt();
        return new RateRecord(pair, toBase.rate() * fromBase.rate(), updatedAt,
                BRIDGE_SOURCE_PREFIX + base, RateOrigin.BRIDGE);
    }

    /**
     * Records touching {@code currency} (or all when null), highest rate first, at most {@code top}.
     */
    public List<RateRecord> list(String currency, Integer top) {
        String code = CurrencyPair.normalize(currency);
        return records.values().stream()
                .filter(record -> code == null || record.pair().involves(code))
                .sorted(Comparator.comparingDouble(RateRecord::rate).reversed()
                        .thenComparing(record -> record.pair().key()))
                .limit(top == null ? Long.MAX_VALUE : Math.max(0, top))
                .toList();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RateTable other)) return false;
        return records.equals(other.records)
                && Objects.equals(lastRefresh, other.lastRefresh)
                && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(records, lastRefresh, source);
    }

    @Override
    public String toString() {
        return "RateTable{" + records.size() + " pairs, lastRefresh=" + lastRefresh + "}";
    }
}
