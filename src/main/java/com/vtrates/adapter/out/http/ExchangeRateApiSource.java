package com.vtrates.adapter.out.http;

import com.vtrates.application.port.out.RateSource;
import com.vtrates.domain.exception.MalformedResponseException;
import com.vtrates.domain.exception.RateLimitedException;
import com.vtrates.domain.exception.RateSourceException;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fiat rates from ExchangeRate-API ({@code /v6/{key}/latest/{BASE}}).
 * The API quotes BASE to CODE; this source emits CODE_BASE = 1 / quote.
 */
@Slf4j
public class ExchangeRateApiSource implements RateSource {

    public static final String NAME = "exchangerate";

    private final WebClient client;
    private final String url;
    private final String apiKey;
    private final List<String> fiatCodes;
    private final String baseCurrency;
    private final Duration requestTimeout;

    public ExchangeRateApiSource(WebClient client, String url, String apiKey, List<String> fiatCodes,
                                 String baseCurrency, Duration requestTimeout) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("ExchangeRate-API requires an API key");
        }
        this.client = client;
        this.url = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.apiKey = apiKey;
        this.fiatCodes = List.copyOf(fiatCodes);
        this.baseCurrency = baseCurrency;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CurrencyClass domain() {
        return CurrencyClass.FIAT;
    }

    @Override
    public Future<Map<CurrencyPair, Double>> fetch() {
        if (fiatCodes.isEmpty()) {
            return Future.succeededFuture(Map.of());
        }

        log.debug("Fetching fiat rates from ExchangeRate-API for base {}", baseCurrency);
        return client.getAbs(url + "/" + apiKey + "/latest/" + baseCurrency)
                .timeout(requestTimeout.toMillis())
                .send()
                .transform(ar -> {
                    if (ar.failed()) {
                        return Future.failedFuture(HttpFailures.classify(NAME, ar.cause()));
                    }
                    try {
                        return Future.succeededFuture(parse(ar.result()));
                    } catch (RateSourceException e) {
                        return Future.failedFuture(e);
                    }
                });
    }

    private Map<CurrencyPair, Double> parse(HttpResponse<Buffer> response) {
        JsonObject body = null;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException | ClassCastException e) {
            RateSourceException statusError = HttpFailures.checkStatus(NAME, response);
            throw statusError != null ? statusError
                    : new MalformedResponseException(NAME, "response is not a JSON object", e);
        }

        // The API reports errors in the body, often with a 4xx status
        if (body != null && "error".equals(body.getString("result"))) {
            throw apiError(body.getString("error-type", "unknown error"));
        }
        RateSourceException statusError = HttpFailures.checkStatus(NAME, response);
        if (statusError != null) {
            throw statusError;
        }
        if (body == null || !"success".equals(body.getString("result"))) {
            throw new MalformedResponseException(NAME, "missing result=success in response");
        }

        String baseCode = body.getString("base_code", baseCurrency);
        if (!baseCurrency.equalsIgnoreCase(baseCode)) {
            throw new MalformedResponseException(NAME, "response base " + baseCode + " differs from " + baseCurrency);
        }

        JsonObject quotes = body.getJsonObject("conversion_rates", body.getJsonObject("rates"));
        if (quotes == null) {
            throw new MalformedResponseException(NAME, "response has no conversion_rates");
        }

        Map<CurrencyPair, Double> rates = new LinkedHashMap<>();
        for (String code : fiatCodes) {
            if (code.equals(baseCurrency)) {
                continue;
            }
            Object quote = quotes.getValue(code);
            if (quote == null) {
                log.warn("ExchangeRate-API response has no quote for {}", code);
                continue;
            }
            if (!(quote instanceof Number number) || number.doubleValue() <= 0) {
                throw new MalformedResponseException(NAME, "quote for " + code + " is not a positive number: " + quote);
            }
            rates.put(new CurrencyPair(code, baseCurrency), 1.0 / number.doubleValue());
        }

        if (rates.isEmpty()) {
            throw new MalformedResponseException(NAME, "response contained none of the requested currencies");
        }
        log.info("ExchangeRate-API returned {} rates", rates.size());
        return rates;
    }

    private RateSourceException apiError(String errorType) {
        if ("quota-reached".equals(errorType)) {
            return new RateLimitedException(NAME, "quota reached");
        }
        return new MalformedResponseException(NAME, "API error: " + errorType);
    }
}
