package com.vtrates.domain.model;

/**
 * How a rate record came into the table
 */
public enum RateOrigin {
    DIRECT("DIRECT"),     // fetched from a source
    INVERSE("INVERSE"),   // 1 / rate of a direct record
    BRIDGE("BRIDGE");     // composed through the base currency

    private final String value;

    RateOrigin(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static RateOrigin fromValue(String value) {
        for (RateOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Unknown rate origin: " + value);
    }

    public static boolean isValid(String value) {
        for (RateOrigin origin : values()) {
            if (origin.value.equalsIgnoreCase(value)) {
                return true;
            }
        }
        return false;
    }
}
