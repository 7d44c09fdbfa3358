package com.vtrates.domain.model;

import com.vtrates.domain.exception.CurrencyNotFoundException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of currencies the service tracks.
 * Built once from configuration and passed to collaborators.
 */
public class CurrencyRegistry {

    private static final Map<String, String> KNOWN_NAMES = Map.ofEntries(
            Map.entry("USD", "US Dollar"),
            Map.entry("EUR", "Euro"),
            Map.entry("GBP", "British Pound"),
            Map.entry("RUB", "Russian Ruble"),
            Map.entry("JPY", "Japanese Yen"),
            Map.entry("CHF", "Swiss Franc"),
            Map.entry("CAD", "Canadian Dollar"),
            Map.entry("AUD", "Australian Dollar"),
            Map.entry("CNY", "Chinese Yuan"),
            Map.entry("BTC", "Bitcoin"),
            Map.entry("ETH", "Ethereum"),
            Map.entry("SOL", "Solana"),
            Map.entry("BNB", "BNB"),
            Map.entry("XRP", "XRP"),
            Map.entry("ADA", "Cardano"),
            Map.entry("DOGE", "Dogecoin"),
            Map.entry("DOT", "Polkadot")
    );

    private final String baseCurrency;
    private final Map<String, Currency> currencies;

    private CurrencyRegistry(String baseCurrency, Map<String, Currency> currencies) {
        this.baseCurrency = baseCurrency;
        this.currencies = Collections.unmodifiableMap(currencies);
    }

    /**
     * Base currency is registered as fiat.
     */
    public static CurrencyRegistry of(String baseCurrency, Collection<String> fiatCodes, Collection<String> cryptoCodes) {
        String base = CurrencyPair.normalize(baseCurrency);
        CurrencyPair.requireValidCode(base);

        Map<String, Currency> currencies = new LinkedHashMap<>();
        currencies.put(base, currency(base, CurrencyClass.FIAT));
        for (String code : fiatCodes) {
            String normalized = CurrencyPair.normalize(code);
            currencies.putIfAbsent(normalized, currency(normalized, CurrencyClass.FIAT));
        }
        for (String code : cryptoCodes) {
            String normalized = CurrencyPair.normalize(code);
            if (currencies.containsKey(normalized)) {
                throw new IllegalArgumentException("Currency " + normalized + " is registered as both fiat and crypto");
            }
            currencies.put(normalized, currency(normalized, CurrencyClass.CRYPTO));
        }
        return new CurrencyRegistry(base, currencies);
    }

    private static Currency currency(String code, CurrencyClass currencyClass) {
        return new Currency(code, KNOWN_NAMES.getOrDefault(code, code), currencyClass);
    }

    public String baseCurrency() {
        return baseCurrency;
    }

    public Currency get(String code) {
        return find(code).orElseThrow(() -> new CurrencyNotFoundException(code));
    }

    public Optional<Currency> find(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(currencies.get(CurrencyPair.normalize(code)));
    }

    public boolean contains(String code) {
        return find(code).isPresent();
    }

    /**
     * Build a pair, requiring both codes to be registered
     */
    public CurrencyPair pair(String from, String to) {
        Currency fromCurrency = get(from);
        Currency toCurrency = get(to);
        return new CurrencyPair(fromCurrency.code(), toCurrency.code());
    }

    /**
     * CRYPTO when either side is a crypto currency, otherwise FIAT.
     * Codes missing from the registry count as fiat.
     */
    public CurrencyClass classify(CurrencyPair pair) {
        boolean crypto = find(pair.from()).map(Currency::isCrypto).orElse(false)
                || find(pair.to()).map(Currency::isCrypto).orElse(false);
        return crypto ? CurrencyClass.CRYPTO : CurrencyClass.FIAT;
    }

    public List<Currency> all() {
        return List.copyOf(currencies.values());
    }

    public List<Currency> byClass(CurrencyClass currencyClass) {
        return currencies.values().stream()
                .filter(c -> c.currencyClass() == currencyClass)
                .toList();
    }
}
