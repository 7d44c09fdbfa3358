package com.vtrates.domain.exception;

import com.vtrates.domain.model.CurrencyPair;

import java.time.Duration;

/**
 * Cached rate is older than the configured TTL.
 * Recoverable by running an update.
 */
public class StaleRateException extends RateServiceException {

    private final CurrencyPair pair;
    private final Duration age;
    private final Duration ttl;

    public StaleRateException(CurrencyPair pair, Duration age, Duration ttl) {
        super(String.format("Rate %s is stale: age %ss, ttl %ss. Run update-rates",
                pair, age.toSeconds(), ttl.toSeconds()));
        this.pair = pair;
        this.age = age;
        this.ttl = ttl;
    }

    public CurrencyPair getPair() {
        return pair;
    }

    public Duration getAge() {
        return age;
    }

    public Duration getTtl() {
        return ttl;
    }
}
