package com.vtrates.application.service;

import com.vtrates.domain.exception.StaleRateException;
import com.vtrates.domain.model.RateRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a cached rate is still usable.
 * A record is fresh iff {@code now - updatedAt < ttl}; an age equal to the ttl is stale.
 */
public class FreshnessGate {

    private final Clock clock;

    public FreshnessGate(Clock clock) {
        this.clock = clock;
    }

    public boolean isFresh(RateRecord record, Duration ttl) {
        return isFresh(record.updatedAt(), ttl);
    }

    public boolean isFresh(Instant updatedAt, Duration ttl) {
        if (updatedAt == null) {
            return false;
        }
        return age(updatedAt).compareTo(ttl) < 0;
    }

    public Duration age(Instant updatedAt) {
        return Duration.between(updatedAt, clock.instant());
    }

    /**
     * @throws StaleRateException when the record is not fresh
     */
    public RateRecord requireFresh(RateRecord record, Duration ttl) {
        if (!isFresh(record, ttl)) {
            throw new StaleRateException(record.pair(), age(record.updatedAt()), ttl);
        }
        return record;
    }
}
