package com.vtrates.adapter.in.web;

import com.vtrates.adapter.out.http.RateSourceFactory;
import com.vtrates.adapter.out.persistence.JsonFileRateCache;
import com.vtrates.application.port.in.RateQueryUseCase;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.application.port.out.RateCache;
import com.vtrates.application.port.out.RateSource;
import com.vtrates.application.service.FreshnessGate;
import com.vtrates.application.service.RateAggregator;
import com.vtrates.application.service.RateQueryService;
import com.vtrates.application.service.RateRefreshScheduler;
import com.vtrates.application.service.RateValidator;
import com.vtrates.domain.model.CurrencyRegistry;
import com.vtrates.infrastructure.config.ParserConfig;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.handler.BodyHandler;
import io.vertx.ext.web.handler.LoggerHandler;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * HTTP Server Verticle - handles all HTTP requests
 * Infrastructure component that wires up the hexagonal architecture
 */
@Slf4j
public class HttpServerVerticle extends AbstractVerticle {

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final ParserConfig config;
    private final Clock clock;

    private WebClient webClient;
    private RateUpdateUseCase updateUseCase;
    private RateQueryUseCase queryUseCase;
    private RateRefreshSchedulerUseCase scheduler;
    private RateCache rateCache;
    private HttpServer server;

    public HttpServerVerticle(ParserConfig config) {
        this(config, Clock.systemUTC());
    }

    public HttpServerVerticle(ParserConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        log.info("Starting HTTP Server Verticle...");

        initializeStorage()
                .compose(v -> {
                    log.info("Data directory ready: {}", config.storage().dataDir().toAbsolutePath());
                    return initializeServices();
                })
                .compose(v -> {
                    log.info("All services initialized successfully");
                    return startHttpServer();
                })
                .onSuccess(v -> {
                    log.info("HTTP Server Verticle started successfully on port {}", actualPort());
                    startPromise.complete();
                })
                .onFailure(error -> {
                    log.error("Failed to start HTTP Server Verticle", error);
                    startPromise.fail(error);
                });
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        Future<Void> stopped = scheduler == null ? Future.succeededFuture() : scheduler.stop(SHUTDOWN_TIMEOUT);
        stopped.onComplete(ar -> {
            if (webClient != null) {
                webClient.close();
            }
            log.info("HTTP Server Verticle stopped");
            stopPromise.complete();
        });
    }

    private Future<Void> initializeStorage() {
        return vertx.fileSystem().mkdirs(config.storage().dataDir().toAbsolutePath().toString());
    }

    private Future<Void> initializeServices() {
        CurrencyRegistry registry = CurrencyRegistry.of(
                config.baseCurrency(), config.fiatCurrencies(), config.cryptoCurrencies());

        // Output ports (adapters)
        rateCache = new JsonFileRateCache(vertx,
                config.storage().ratesPath(),
                config.storage().historyPath(),
                config.baseCurrency(),
                clock);
        webClient = RateSourceFactory.createClient(vertx, config);
        List<RateSource> sources = RateSourceFactory.create(webClient, config);

        // Application services (use cases)
        RateValidator validator = new RateValidator(config.minRate(), config.maxRate());
        updateUseCase = new RateAggregator(
                vertx,
                sources,
                rateCache,
                registry,
                validator,
                config.retry(),
                config.sourceTimeout(),
                config.sourcePriority(),
                clock);
        queryUseCase = new RateQueryService(
                rateCache,
                registry,
                new FreshnessGate(clock),
                validator,
                config.ratesTtl());
        scheduler = new RateRefreshScheduler(
                vertx,
                updateUseCase,
                config.updateInterval(),
                config.ratesTtl(),
                clock);

        log.info("Services wired up (Hexagonal Architecture)");

        Future<Void> pruned = rateCache.pruneHistory(config.storage().historyRetention())
                .<Void>mapEmpty()
                .recover(error -> {
                    log.warn("Could not prune rate history: {}", error.getMessage());
                    return Future.succeededFuture();
                });

        if (!config.schedulerEnabled()) {
            log.info("Rate refresh scheduler disabled by configuration");
            return pruned;
        }
        return pruned.compose(v -> {
            log.info("Starting rate refresh scheduler...");
            return scheduler.start();
        });
    }

    private Future<Void> startHttpServer() {
        Router router = Router.router(vertx);

        // Global handlers
        router.route().handler(LoggerHandler.create());
        router.route().handler(BodyHandler.create());

        WebRouter webRouter = new WebRouter(router, updateUseCase, queryUseCase, scheduler);
        webRouter.setupRoutes();

        return vertx.createHttpServer()
                .requestHandler(router)
                .listen(config.httpPort())
                .onSuccess(listening -> {
                    server = listening;
                    log.info("HTTP server listening on port {}", listening.actualPort());
                })
                .mapEmpty();
    }

    /**
     * Port the server is bound to; differs from the configured one when that is 0
     */
    public int actualPort() {
        return server == null ? config.httpPort() : server.actualPort();
    }
}
