package com.vtrates.infrastructure.config;

import com.vtrates.application.service.RetryPolicy;
import lombok.Builder;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Static configuration of the rate service.
 * Loaded once at startup by {@link ConfigLoader} and never mutated.
 */
@Builder(toBuilder = true)
public record ParserConfig(
        String baseCurrency,
        List<String> fiatCurrencies,
        List<String> cryptoCurrencies,
        Map<String, String> cryptoIds,
        Duration requestTimeout,
        Duration sourceTimeout,
        Duration ratesTtl,
        Duration updateInterval,
        double minRate,
        double maxRate,
        List<String> sourcePriority,
        RetryPolicy retry,
        Storage storage,
        CoinGecko coinGecko,
        ExchangeRateApi exchangeRateApi,
        int httpPort,
        boolean schedulerEnabled
) {

    public ParserConfig {
        fiatCurrencies = fiatCurrencies == null ? List.of() : List.copyOf(fiatCurrencies);
        cryptoCurrencies = cryptoCurrencies == null ? List.of() : List.copyOf(cryptoCurrencies);
        cryptoIds = cryptoIds == null ? Map.of() : Map.copyOf(cryptoIds);
        sourcePriority = sourcePriority == null ? List.of() : List.copyOf(sourcePriority);
    }

    public record Storage(Path dataDir, String ratesFile, String historyFile, Duration historyRetention) {

        public Path ratesPath() {
            return dataDir.resolve(ratesFile);
        }

        public Path historyPath() {
            return dataDir.resolve(historyFile);
        }
    }

    /**
     * CoinGecko works without a key on its public tier; {@code publicApi=false} forces the mock.
     */
    public record CoinGecko(String url, String apiKey, boolean publicApi) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }

        public boolean isUsable() {
            return publicApi || hasApiKey();
        }
    }

    public record ExchangeRateApi(String url, String apiKey) {

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
