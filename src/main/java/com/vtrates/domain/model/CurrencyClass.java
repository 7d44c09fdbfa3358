package com.vtrates.domain.model;

/**
 * Domain a currency belongs to
 */
public enum CurrencyClass {
    FIAT("FIAT"),
    CRYPTO("CRYPTO");

    private final String value;

    CurrencyClass(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CurrencyClass fromValue(String value) {
        for (CurrencyClass type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown currency class: " + value);
    }

    public static boolean isValid(String value) {
        for (CurrencyClass type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
