package com.vtrates.application.port.out;

import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import io.vertx.core.Future;

import java.util.Map;

/**
 * Output port for one external rate provider.
 * A source covers only its own currency domain; the aggregator merges across sources.
 */
public interface RateSource {

    /**
     * Stable lower-case name, used for source selection and priority ordering
     */
    String name();

    /**
     * Provider this source answers for when selected by name.
     * A stand-in source returns the name of the live provider it replaces.
     */
    default String provider() {
        return name();
    }

    /**
     * Currency domain this source is responsible for
     */
    CurrencyClass domain();

    /**
     * Fetch the current rates of this source.
     * @return Future with rates keyed by pair, or failed with a
     *         {@link com.vtrates.domain.exception.RateSourceException}
     */
    Future<Map<CurrencyPair, Double>> fetch();
}
