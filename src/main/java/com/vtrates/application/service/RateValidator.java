package com.vtrates.application.service;

import com.vtrates.domain.exception.RateOutOfBoundsException;
import com.vtrates.domain.model.CurrencyPair;

import java.util.ArrayList;
import java.util.List;

/**
 * Validates rates against the configured [minRate, maxRate] band.
 * Both directions of a pair must lie inside the band, so every accepted rate
 * has a storable inverse.
 */
public class RateValidator {

    private final double minRate;
    private final double maxRate;

    public RateValidator(double minRate, double maxRate) {
        if (!(minRate > 0) || !(minRate < maxRate)) {
            throw new IllegalArgumentException("Rate bounds must satisfy 0 < min < max: " + minRate + ", " + maxRate);
        }
        this.minRate = minRate;
        this.maxRate = maxRate;
    }

    public ValidationResult validate(CurrencyPair pair, double rate) {
        List<String> errors = new ArrayList<>();

        if (!Double.isFinite(rate) || rate <= 0) {
            errors.add("rate for " + pair + " must be a positive finite number: " + rate);
        } else {
            if (!isWithinBounds(rate)) {
                errors.add("rate for " + pair + " is outside [" + minRate + ", " + maxRate + "]: " + rate);
            }
            if (!isWithinBounds(1.0 / rate)) {
                errors.add("inverse rate for " + pair + " is outside [" + minRate + ", " + maxRate + "]: " + (1.0 / rate));
            }
        }

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        } else {
            return ValidationResult.invalid(errors);
        }
    }

    public boolean isWithinBounds(double rate) {
        return rate >= minRate && rate <= maxRate;
    }

    /**
     * @throws RateOutOfBoundsException when the rate is outside the band
     */
    public double requireWithinBounds(CurrencyPair pair, double rate) {
        if (!Double.isFinite(rate) || !isWithinBounds(rate)) {
            throw new RateOutOfBoundsException(pair, rate, minRate, maxRate);
        }
        return rate;
    }
}
