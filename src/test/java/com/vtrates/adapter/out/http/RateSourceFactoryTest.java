package com.vtrates.adapter.out.http;

import com.vtrates.application.port.out.RateSource;
import com.vtrates.infrastructure.config.ConfigLoader;
import com.vtrates.infrastructure.config.ParserConfig;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.WebClient;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class RateSourceFactoryTest {

    private final WebClient client = mock(WebClient.class);

    private static ParserConfig config(JsonObject json, Map<String, String> env) {
        return ConfigLoader.fromJson(json, env);
    }

    private static List<String> names(List<RateSource> sources) {
        return sources.stream().map(RateSource::name).toList();
    }

    @Test
    void create_shouldUseLiveSourcesWhenConfigured() {
        ParserConfig config = config(new JsonObject(), Map.of("EXCHANGERATE_API_KEY", "key"));

        List<RateSource> sources = RateSourceFactory.create(client, config);

        assertEquals(List.of("exchangerate", "coingecko"), names(sources));
        assertInstanceOf(ExchangeRateApiSource.class, sources.get(0));
        assertInstanceOf(CoinGeckoRateSource.class, sources.get(1));
        assertEquals(names(sources), sources.stream().map(RateSource::provider).toList());
    }

    @Test
    void create_shouldFallBackToMocksWithoutCredentials() {
        JsonObject json = new JsonObject().put("sources", new JsonObject()
                .put("coingecko", new JsonObject().put("public-api", false)));

        List<RateSource> sources = RateSourceFactory.create(client, config(json, Map.of()));

        assertEquals(List.of(MockRateSource.FIAT_NAME, MockRateSource.CRYPTO_NAME), names(sources));
        // stand-ins stay selectable under the provider names
        assertEquals(List.of(ExchangeRateApiSource.NAME, CoinGeckoRateSource.NAME),
                sources.stream().map(RateSource::provider).toList());
    }

    @Test
    void create_shouldSkipEmptyDomains() {
        JsonObject json = new JsonObject()
                .put("fiat-currencies", new JsonArray())
                .put("crypto-currencies", new JsonArray().add("BTC"));

        List<RateSource> sources = RateSourceFactory.create(client, config(json, Map.of()));

        assertEquals(List.of("coingecko"), names(sources));
    }
}
