package com.vtrates.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A single rate in the table.
 */
public record RateRecord(
        CurrencyPair pair,
        double rate,
        Instant updatedAt,
        String source,
        RateOrigin origin
) {

    public RateRecord {
        Objects.requireNonNull(pair, "pair");
        Objects.requireNonNull(updatedAt, "updatedAt");
        Objects.requireNonNull(origin, "origin");
        if (!Double.isFinite(rate) || rate <= 0) {
            throw new IllegalArgumentException("Rate for " + pair + " must be a positive finite number: " + rate);
        }
        if (source == null || source.isBlank()) {
            source = "unknown";
        }
    }

    public static RateRecord direct(CurrencyPair pair, double rate, Instant updatedAt, String source) {
        return new RateRecord(pair, rate, updatedAt, source, RateOrigin.DIRECT);
    }

    /**
     * Record for the opposite direction, rate = 1 / rate.
     * The inverse of a bridged record stays a bridge.
     */
    public RateRecord invert() {
        RateOrigin inverseOrigin = origin == RateOrigin.BRIDGE ? RateOrigin.BRIDGE : RateOrigin.INVERSE;
        return new RateRecord(pair.inverse(), 1.0 / rate, updatedAt, source, inverseOrigin);
    }

    public Duration age(Instant now) {
        return Duration.between(updatedAt, now);
    }

    public boolean isDirect() {
        return origin == RateOrigin.DIRECT;
    }
}
