package com.vtrates.domain.exception;

public class CurrencyNotFoundException extends RateServiceException {

    private final String code;

    public CurrencyNotFoundException(String code) {
        super("Unknown currency '" + code + "'");
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
