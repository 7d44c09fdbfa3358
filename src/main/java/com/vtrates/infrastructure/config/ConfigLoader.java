package com.vtrates.infrastructure.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtrates.application.service.RetryPolicy;
import com.vtrates.application.service.ValidationResult;
import com.vtrates.domain.model.CurrencyPair;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link ParserConfig} from application.yml and environment overrides.
 */
@Slf4j
public final class ConfigLoader {

    public static final String CONFIG_PROPERTY = "vtrates.config";
    public static final String CONFIG_ENV = "VTRATES_CONFIG";
    private static final String DEFAULT_RESOURCE = "application.yml";

    static final String ENV_EXCHANGERATE_API_KEY = "EXCHANGERATE_API_KEY";
    static final String ENV_COINGECKO_API_KEY = "COINGECKO_API_KEY";
    static final String ENV_RATES_TTL = "RATES_TTL_SECONDS";
    static final String ENV_UPDATE_INTERVAL = "UPDATE_INTERVAL_SECONDS";
    static final String ENV_DATA_DIR = "VTRATES_DATA_DIR";
    static final String ENV_HTTP_PORT = "VTRATES_HTTP_PORT";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    public static ParserConfig load() {
        String explicit = System.getProperty(CONFIG_PROPERTY, System.getenv(CONFIG_ENV));
        return load(explicit, System.getenv());
    }

    /**
     * @param explicitPath file to read instead of the classpath application.yml, may be null
     * @param env          environment variables applied on top of the file
     */
    public static ParserConfig load(String explicitPath, Map<String, String> env) {
        JsonObject json;
        if (explicitPath != null && !explicitPath.isBlank()) {
            json = readFile(Path.of(explicitPath));
            log.info("Loaded configuration from {}", explicitPath);
        } else {
            json = readClasspath(DEFAULT_RESOURCE);
            log.info("Loaded configuration from classpath {}", DEFAULT_RESOURCE);
        }
        return fromJson(json, env);
    }

    static JsonObject readFile(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return readYaml(is);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read configuration file " + path, e);
        }
    }

    static JsonObject readClasspath(String resource) {
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException(resource + " not found in classpath");
            }
            return readYaml(is);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read " + resource, e);
        }
    }

    @SuppressWarnings("unchecked")
    static JsonObject readYaml(InputStream is) throws IOException {
        JsonNode tree = YAML.readTree(is);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            return new JsonObject();
        }
        if (!tree.isObject()) {
            throw new IOException("Configuration root must be a mapping");
        }
        return new JsonObject(YAML.convertValue(tree, Map.class));
    }

    /**
     * Bind a parsed document to {@link ParserConfig}, falling back to defaults for missing keys
     */
    public static ParserConfig fromJson(JsonObject json, Map<String, String> env) {
        JsonObject retry = section(json, "retry");
        JsonObject storage = section(json, "storage");
        JsonObject sources = section(json, "sources");
        JsonObject coinGecko = section(sources, "coingecko");
        JsonObject exchangeRate = section(sources, "exchangerate");
        JsonObject http = section(json, "http");
        JsonObject scheduler = section(json, "scheduler");

        long ttlSeconds = envLong(env, ENV_RATES_TTL, json.getLong("rates-ttl-seconds", 300L));
        long intervalSeconds = envLong(env, ENV_UPDATE_INTERVAL, json.getLong("update-interval-seconds", 300L));
        String dataDir = env.getOrDefault(ENV_DATA_DIR, storage.getString("data-dir", "data"));
        int port = (int) envLong(env, ENV_HTTP_PORT, http.getLong("port", 8080L));

        ParserConfig config = ParserConfig.builder()
                .baseCurrency(json.getString("base-currency", "USD").trim().toUpperCase())
                .fiatCurrencies(upper(json.getJsonArray("fiat-currencies",
                        new JsonArray(List.of("EUR", "GBP", "RUB", "JPY", "CHF", "CAD", "AUD", "CNY")))))
                .cryptoCurrencies(upper(json.getJsonArray("crypto-currencies",
                        new JsonArray(List.of("BTC", "ETH", "SOL", "BNB", "XRP", "ADA", "DOGE", "DOT")))))
                .cryptoIds(cryptoIds(json.getJsonObject("crypto-ids")))
                .requestTimeout(Duration.ofMillis(json.getLong("request-timeout-ms", 10_000L)))
                .sourceTimeout(Duration.ofMillis(json.getLong("source-timeout-ms", 30_000L)))
                .ratesTtl(Duration.ofSeconds(ttlSeconds))
                .updateInterval(Duration.ofSeconds(intervalSeconds))
                .minRate(json.getDouble("min-rate", 1e-9))
                .maxRate(json.getDouble("max-rate", 1e9))
                .sourcePriority(lower(json.getJsonArray("source-priority",
                        new JsonArray(List.of("exchangerate", "coingecko", "mock-fiat", "mock-crypto")))))
                .retry(retryPolicy(retry))
                .storage(new ParserConfig.Storage(
                        Path.of(dataDir),
                        storage.getString("rates-file", "rates.json"),
                        storage.getString("history-file", "exchange_rates.json"),
                        Duration.ofDays(storage.getLong("history-retention-days", 30L))))
                .coinGecko(new ParserConfig.CoinGecko(
                        coinGecko.getString("url", "https://api.coingecko.com/api/v3/simple/price"),
                        env.getOrDefault(ENV_COINGECKO_API_KEY, coinGecko.getString("api-key")),
                        coinGecko.getBoolean("public-api", true)))
                .exchangeRateApi(new ParserConfig.ExchangeRateApi(
                        exchangeRate.getString("url", "https://v6.exchangerate-api.com/v6"),
                        env.getOrDefault(ENV_EXCHANGERATE_API_KEY, exchangeRate.getString("api-key"))))
                .httpPort(port)
                .schedulerEnabled(scheduler.getBoolean("enabled", true))
                .build();

        ValidationResult validation = validate(config);
        if (!validation.isValid()) {
            throw new IllegalArgumentException("Invalid configuration: " + validation.errors());
        }
        if (!config.exchangeRateApi().hasApiKey()) {
            log.warn("{} is not set, fiat rates will come from the mock source", ENV_EXCHANGERATE_API_KEY);
        }
        return config;
    }

    public static ValidationResult validate(ParserConfig config) {
        List<String> errors = new ArrayList<>();

        if (!CurrencyPair.isValidCode(config.baseCurrency())) {
            errors.add("base-currency must be 2-5 uppercase letters");
        }
        for (String code : config.fiatCurrencies()) {
            if (!CurrencyPair.isValidCode(code)) {
                errors.add("fiat currency code is invalid: " + code);
            }
        }
        for (String code : config.cryptoCurrencies()) {
            if (!CurrencyPair.isValidCode(code)) {
                errors.add("crypto currency code is invalid: " + code);
            }
            if (config.fiatCurrencies().contains(code)) {
                errors.add("currency listed as both fiat and crypto: " + code);
            }
        }
        if (!(config.minRate() > 0)) {
            errors.add("min-rate must be positive");
        }
        if (!(config.minRate() < config.maxRate())) {
            errors.add("min-rate must be lower than max-rate");
        }
        requirePositive(config.requestTimeout(), "request-timeout-ms", errors);
        requirePositive(config.sourceTimeout(), "source-timeout-ms", errors);
        requirePositive(config.ratesTtl(), "rates-ttl-seconds", errors);
        requirePositive(config.updateInterval(), "update-interval-seconds", errors);
        if (config.httpPort() < 0 || config.httpPort() > 65535) {
            errors.add("http.port must be between 0 and 65535");
        }

        return errors.isEmpty() ? ValidationResult.valid() : ValidationResult.invalid(errors);
    }

    private static void requirePositive(Duration duration, String key, List<String> errors) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            errors.add(key + " must be positive");
        }
    }

    private static RetryPolicy retryPolicy(JsonObject retry) {
        int maxAttempts = retry.getInteger("max-attempts", 3);
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Invalid configuration: [retry.max-attempts must be at least 1]");
        }
        return new RetryPolicy(
                maxAttempts,
                Duration.ofMillis(retry.getLong("initial-delay-ms", 500L)),
                retry.getDouble("multiplier", 2.0),
                Duration.ofMillis(retry.getLong("max-delay-ms", 5_000L)));
    }

    private static Map<String, String> cryptoIds(JsonObject json) {
        Map<String, String> ids = new LinkedHashMap<>(Map.of(
                "BTC", "bitcoin",
                "ETH", "ethereum",
                "SOL", "solana",
                "BNB", "binancecoin",
                "XRP", "ripple",
                "ADA", "cardano",
                "DOGE", "dogecoin",
                "DOT", "polkadot"));
        if (json != null) {
            json.forEach(entry -> ids.put(entry.getKey().toUpperCase(), String.valueOf(entry.getValue())));
        }
        return ids;
    }

    private static JsonObject section(JsonObject parent, String key) {
        JsonObject section = parent.getJsonObject(key);
        return section == null ? new JsonObject() : section;
    }

    private static List<String> upper(JsonArray array) {
        return array.stream().map(v -> String.valueOf(v).trim().toUpperCase()).toList();
    }

    private static List<String> lower(JsonArray array) {
        return array.stream().map(v -> String.valueOf(v).trim().toLowerCase()).toList();
    }

    private static long envLong(Map<String, String> env, String key, long fallback) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Environment variable " + key + " must be a number: " + value, e);
        }
    }
}
