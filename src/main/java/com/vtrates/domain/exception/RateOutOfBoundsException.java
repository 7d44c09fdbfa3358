package com.vtrates.domain.exception;

import com.vtrates.domain.model.CurrencyPair;

/**
 * Rate outside the configured [min, max] band
 */
public class RateOutOfBoundsException extends RateServiceException {

    private final CurrencyPair pair;
    private final double rate;

    public RateOutOfBoundsException(CurrencyPair pair, double rate, double minRate, double maxRate) {
        super(String.format("Rate %s=%s is outside [%s, %s]", pair, rate, minRate, maxRate));
        this.pair = pair;
        this.rate = rate;
    }

    public CurrencyPair getPair() {
        return pair;
    }

    public double getRate() {
        return rate;
    }
}
