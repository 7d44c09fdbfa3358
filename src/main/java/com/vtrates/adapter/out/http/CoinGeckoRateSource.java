package com.vtrates.adapter.out.http;

import com.vtrates.application.port.out.RateSource;
import com.vtrates.domain.exception.MalformedResponseException;
import com.vtrates.domain.exception.RateSourceException;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.CurrencyPair;
import io.vertx.core.Future;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Crypto rates against the base currency from the CoinGecko simple price API
 */
@Slf4j
public class CoinGeckoRateSource implements RateSource {

    public static final String NAME = "coingecko";
    static final String API_KEY_HEADER = "x-cg-demo-api-key";

    private final WebClient client;
    private final String url;
    private final String apiKey;
    private final List<String> cryptoCodes;
    private final Map<String, String> cryptoIds;
    private final String baseCurrency;
    private final Duration requestTimeout;

    public CoinGeckoRateSource(WebClient client, String url, String apiKey, List<String> cryptoCodes,
                               Map<String, String> cryptoIds, String baseCurrency, Duration requestTimeout) {
        this.client = client;
        this.url = url;
        this.apiKey = apiKey;
        this.cryptoCodes = List.copyOf(cryptoCodes);
        this.cryptoIds = Map.copyOf(cryptoIds);
        this.baseCurrency = baseCurrency;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public CurrencyClass domain() {
        return CurrencyClass.CRYPTO;
    }

    @Override
    public Future<Map<CurrencyPair, Double>> fetch() {
        Map<String, String> idToCode = new LinkedHashMap<>();
        for (String code : cryptoCodes) {
            String id = cryptoIds.get(code);
            if (id == null) {
                log.debug("No CoinGecko id configured for {}, skipping", code);
                continue;
            }
            idToCode.put(id, code);
        }
        if (idToCode.isEmpty()) {
            return Future.succeededFuture(Map.of());
        }

        String vsCurrency = baseCurrency.toLowerCase();
        HttpRequest<Buffer> request = client.getAbs(url)
                .addQueryParam("ids", String.join(",", idToCode.keySet()))
                .addQueryParam("vs_currencies", vsCurrency)
                .timeout(requestTimeout.toMillis());
        if (apiKey != null && !apiKey.isBlank()) {
            request.putHeader(API_KEY_HEADER, apiKey);
        }

        log.debug("Fetching {} crypto rates from CoinGecko", idToCode.size());
        return request.send().transform(ar -> {
            if (ar.failed()) {
                return Future.failedFuture(HttpFailures.classify(NAME, ar.cause()));
            }
            try {
                return Future.succeededFuture(parse(ar.result(), idToCode, vsCurrency));
            } catch (RateSourceException e) {
                return Future.failedFuture(e);
            }
        });
    }

    private Map<CurrencyPair, Double> parse(HttpResponse<Buffer> response, Map<String, String> idToCode,
                                            String vsCurrency) {
        RateSourceException statusError = HttpFailures.checkStatus(NAME, response);
        if (statusError != null) {
            throw statusError;
        }

        JsonObject body;
        try {
            body = response.bodyAsJsonObject();
        } catch (DecodeException | ClassCastException e) {
            throw new MalformedResponseException(NAME, "response is not a JSON object", e);
        }
        if (body == null) {
            throw new MalformedResponseException(NAME, "empty response body");
        }

        Map<CurrencyPair, Double> rates = new LinkedHashMap<>();
        idToCode.forEach((id, code) -> {
            Object entry = body.getValue(id);
            if (!(entry instanceof JsonObject prices)) {
                log.warn("CoinGecko response has no price for {} ({})", code, id);
                return;
            }
            Object price = prices.getValue(vsCurrency);
            if (!(price instanceof Number number)) {
                throw new MalformedResponseException(NAME, "price of " + id + " is not a number: " + price);
            }
            rates.put(new CurrencyPair(code, baseCurrency), number.doubleValue());
        });

        if (rates.isEmpty()) {
            throw new MalformedResponseException(NAME, "response contained none of the requested currencies");
        }
        log.info("CoinGecko returned {} rates", rates.size());
        return rates;
    }
}
