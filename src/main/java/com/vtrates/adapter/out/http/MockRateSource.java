package com.vtrates.adapter.out.http;

import com.vtrates.application.port.out.RateSource;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic offline rates, used when a live source has no credentials.
 * Quotes are held against USD and rebased when the base currency differs.
 */
@Slf4j
public class MockRateSource implements RateSource {

    public static final String FIAT_NAME = "mock-fiat";
    public static final String CRYPTO_NAME = "mock-crypto";

    static final String QUOTE_CURRENCY = "USD";

    static final Map<String, Double> FIAT_USD = Map.of(
            "EUR", 1.0786,
            "GBP", 1.2543,
            "RUB", 0.01016,
            "JPY", 0.0067,
            "CHF", 1.1245,
            "CAD", 0.7312,
            "AUD", 0.6598,
            "CNY", 0.1381);

    static final Map<String, Double> CRYPTO_USD = Map.of(
            "BTC", 59337.21,
            "ETH", 3720.00,
            "SOL", 145.12,
            "BNB", 580.40,
            "XRP", 0.5210,
            "ADA", 0.4530,
            "DOGE", 0.1240,
            "DOT", 7.1200);

    private final String name;
    private final String provider;
    private final CurrencyClass domain;
    private final List<String> codes;
    private final String baseCurrency;

    MockRateSource(String name, String provider, CurrencyClass domain, List<String> codes, String baseCurrency) {
        this.name = name;
        this.provider = provider;
        this.domain = domain;
        this.codes = List.copyOf(codes);
        this.baseCurrency = baseCurrency;
    }

    public static MockRateSource fiat(List<String> codes, String baseCurrency) {
        return new MockRateSource(FIAT_NAME, ExchangeRateApiSource.NAME, CurrencyClass.FIAT, codes, baseCurrency);
    }

    public static MockRateSource crypto(List<String> codes, String baseCurrency) {
        return new MockRateSource(CRYPTO_NAME, CoinGeckoRateSource.NAME, CurrencyClass.CRYPTO, codes, baseCurrency);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String provider() {
        return provider;
    }

    @Override
    public CurrencyClass domain() {
        return domain;
    }

    @Override
    public Future<Map<CurrencyPair, Double>> fetch() {
        Double baseInUsd = usdValue(baseCurrency);
        if (baseInUsd == null) {
            log.warn("{} has no quote for base currency {}, returning no rates", name, baseCurrency);
            return Future.succeededFuture(Map.of());
        }

        Map<String, Double> table = domain == CurrencyClass.CRYPTO ? CRYPTO_USD : FIAT_USD;
        Map<CurrencyPair, Double> rates = new LinkedHashMap<>();
        for (String code : codes) {
            Double inUsd = table.get(code);
            if (inUsd == null || code.equals(baseCurrency)) {
                continue;
            }
            rates.put(new CurrencyPair(code, baseCurrency), inUsd / baseInUsd);
        }
        log.debug("{} produced {} rates", name, rates.size());
        return Future.succeededFuture(rates);
    }

    private static Double usdValue(String code) {
        if (QUOTE_CURRENCY.equals(code)) {
            return 1.0;
        }
        Double fiat = FIAT_USD.get(code);
        return fiat != null ? fiat : CRYPTO_USD.get(code);
    }
}
