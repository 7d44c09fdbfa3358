package com.vtrates.adapter.out.http;

import com.vtrates.application.port.out.RateSource;
import com.vtrates.infrastructure.config.ParserConfig;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the rate sources for a configuration. A live source without credentials is replaced by its mock.
 */
@Slf4j
public final class RateSourceFactory {

    static final String USER_AGENT = "valutatrade-rates/1.0";

    private RateSourceFactory() {
    }

    public static WebClient createClient(Vertx vertx, ParserConfig config) {
        return WebClient.create(vertx, new WebClientOptions()
                .setUserAgent(USER_AGENT)
                .setConnectTimeout((int) config.requestTimeout().toMillis()));
    }

    public static List<RateSource> create(WebClient client, ParserConfig config) {
        List<RateSource> sources = new ArrayList<>();
        String base = config.baseCurrency();

        if (!config.fiatCurrencies().isEmpty()) {
            ParserConfig.ExchangeRateApi api = config.exchangeRateApi();
            if (api != null && api.hasApiKey()) {
                sources.add(new ExchangeRateApiSource(client, api.url(), api.apiKey(),
                        config.fiatCurrencies(), base, config.requestTimeout()));
            } else {
                log.warn("ExchangeRate-API key missing, using {}", MockRateSource.FIAT_NAME);
                sources.add(MockRateSource.fiat(config.fiatCurrencies(), base));
            }
        }

        if (!config.cryptoCurrencies().isEmpty()) {
            ParserConfig.CoinGecko coinGecko = config.coinGecko();
            if (coinGecko != null && coinGecko.isUsable()) {
                sources.add(new CoinGeckoRateSource(client, coinGecko.url(), coinGecko.apiKey(),
                        config.cryptoCurrencies(), config.cryptoIds(), base, config.requestTimeout()));
            } else {
                log.warn("CoinGecko disabled, using {}", MockRateSource.CRYPTO_NAME);
                sources.add(MockRateSource.crypto(config.cryptoCurrencies(), base));
            }
        }

        log.info("Configured rate sources: {}", sources.stream().map(RateSource::name).toList());
        return sources;
    }
}
