package com.vtrates.domain.exception;

import com.vtrates.domain.model.CurrencyPair;

/**
 * No direct, inverse or bridged rate exists for a pair
 */
public class RateNotFoundException extends RateServiceException {

    private final CurrencyPair pair;

    public RateNotFoundException(CurrencyPair pair) {
        super("No rate available for " + pair.from() + " -> " + pair.to());
        this.pair = pair;
    }

    public CurrencyPair getPair() {
        return pair;
    }
}
