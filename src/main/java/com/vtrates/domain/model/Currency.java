package com.vtrates.domain.model;

import java.util.Objects;

/**
 * A tradable currency known to the registry
 */
public record Currency(String code, String name, CurrencyClass currencyClass) {

    public Currency {
        CurrencyPair.requireValidCode(code);
        Objects.requireNonNull(currencyClass, "currencyClass");
        if (name == null || name.isBlank()) {
            name = code;
        }
    }

    public boolean isCrypto() {
        return currencyClass == CurrencyClass.CRYPTO;
    }

    public String displayInfo() {
        return String.format("[%s] %s - %s", currencyClass.getValue(), code, name);
    }
}
