package com.vtrates.domain.model;

import java.util.regex.Pattern;

/**
 * Ordered currency pair, serialized as {@code FROM_TO}.
 */
public record CurrencyPair(String from, String to) {

    private static final Pattern CODE_PATTERN = Pattern.compile("[A-Z]{2,5}");
    private static final String SEPARATOR = "_";

    public CurrencyPair {
        requireValidCode(from);
        requireValidCode(to);
        if (from.equals(to)) {
            throw new IllegalArgumentException("Currency pair must have distinct currencies: " + from);
        }
    }

    public static CurrencyPair of(String from, String to) {
        return new CurrencyPair(normalize(from), normalize(to));
    }

    /**
     * Parse the {@code FROM_TO} key used in snapshot and history files
     */
    public static CurrencyPair parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Currency pair key is required");
        }
        String[] parts = key.split(SEPARATOR);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Currency pair key must look like FROM_TO: " + key);
        }
        return of(parts[0], parts[1]);
    }

    public static boolean isValidCode(String code) {
        return code != null && CODE_PATTERN.matcher(code).matches();
    }

    static void requireValidCode(String code) {
        if (!isValidCode(code)) {
            throw new IllegalArgumentException("Currency code must be 2-5 uppercase letters: " + code);
        }
    }

    static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase();
    }

    public CurrencyPair inverse() {
        return new CurrencyPair(to, from);
    }

    public boolean involves(String code) {
        return from.equals(code) || to.equals(code);
    }

    public String key() {
        return from + SEPARATOR + to;
    }

    @Override
    public String toString() {
        return key();
    }
}
