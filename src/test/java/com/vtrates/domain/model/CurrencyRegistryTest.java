package com.vtrates.domain.model;

import com.vtrates.domain.exception.CurrencyNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CurrencyRegistryTest {

    private final CurrencyRegistry registry = CurrencyRegistry.of("usd", List.of("EUR", "GBP"), List.of("btc", "ETH"));

    @Test
    void of_shouldRegisterBaseAsFiat() {
        assertEquals("USD", registry.baseCurrency());
        assertEquals(CurrencyClass.FIAT, registry.get("USD").currencyClass());
        assertEquals("US Dollar", registry.get("usd").name());
        assertEquals(5, registry.all().size());
    }

    @Test
    void get_shouldFailForUnknownCode() {
        CurrencyNotFoundException error = assertThrows(CurrencyNotFoundException.class, () -> registry.get("XYZ"));
        assertEquals("XYZ", error.getCode());
        assertTrue(registry.find("XYZ").isEmpty());
        assertFalse(registry.contains(null));
    }

    @Test
    void of_shouldRejectCodeInBothClasses() {
        assertThrows(IllegalArgumentException.class,
                () -> CurrencyRegistry.of("USD", List.of("BTC"), List.of("BTC")));
    }

    @Test
    void pair_shouldRequireRegisteredCodes() {
        assertEquals(new CurrencyPair("BTC", "EUR"), registry.pair("btc", "eur"));
        assertThrows(CurrencyNotFoundException.class, () -> registry.pair("BTC", "JPY"));
    }

    @Test
    void classify_shouldTreatAnyCryptoSideAsCrypto() {
        assertEquals(CurrencyClass.CRYPTO, registry.classify(new CurrencyPair("BTC", "USD")));
        assertEquals(CurrencyClass.CRYPTO, registry.classify(new CurrencyPair("USD", "ETH")));
        assertEquals(CurrencyClass.FIAT, registry.classify(new CurrencyPair("EUR", "USD")));
        assertEquals(List.of("BTC", "ETH"),
                registry.byClass(CurrencyClass.CRYPTO).stream().map(Currency::code).toList());
    }
}
