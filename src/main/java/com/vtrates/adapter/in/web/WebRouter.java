package com.vtrates.adapter.in.web;

import com.vtrates.adapter.in.web.history.RateHistoryHandler;
import com.vtrates.adapter.in.web.rates.RateListHandler;
import com.vtrates.adapter.in.web.rates.RateLookupHandler;
import com.vtrates.adapter.in.web.scheduler.SchedulerStatusHandler;
import com.vtrates.adapter.in.web.update.RateUpdateHandler;
import com.vtrates.application.port.in.RateQueryUseCase;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import com.vtrates.application.port.in.RateUpdateUseCase;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import lombok.RequiredArgsConstructor;

/**
 * Router configuration for rate endpoints
 */
@RequiredArgsConstructor
public class WebRouter {

    static final String SERVICE_NAME = "valutatrade-rates";
    static final String VERSION = "1.0.0";

    private final Router router;
    private final RateUpdateUseCase updateUseCase;
    private final RateQueryUseCase queryUseCase;
    private final RateRefreshSchedulerUseCase scheduler;

    public void setupRoutes() {
        router.route().handler(ctx -> {
            ctx.response()
                    .putHeader("Access-Control-Allow-Origin", "*")
                    .putHeader("Access-Control-Allow-Methods", "GET, POST, OPTIONS")
                    .putHeader("Access-Control-Allow-Headers", "Content-Type, Authorization, X-Requested-With");
            ctx.next();
        });

        router.options("/api/*").handler(ctx -> ctx.response().setStatusCode(204).end());

        router.post("/api/rates/update").handler(new RateUpdateHandler(updateUseCase, scheduler));

        // history before the two-segment lookup route
        router.get("/api/rates/history").handler(new RateHistoryHandler(queryUseCase));
        router.get("/api/rates").handler(new RateListHandler(queryUseCase));
        router.get("/api/rates/:from/:to").handler(new RateLookupHandler(queryUseCase));

        router.get("/api/scheduler").handler(new SchedulerStatusHandler(scheduler));

        router.get("/health")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end(new JsonObject()
                                .put("status", "UP")
                                .put("service", SERVICE_NAME)
                                .put("scheduler", scheduler.status().running() ? "RUNNING" : "STOPPED")
                                .encode()));

        router.get("/")
                .handler(ctx -> ctx.response()
                        .putHeader("Content-Type", "application/json")
                        .end(new JsonObject()
                                .put("name", "ValutaTrade Rates Service")
                                .put("version", VERSION)
                                .put("sources", updateUseCase.sourceNames())
                                .encode()));

        // Default route - 404
        router.route().last().handler(ctx -> HttpResponses.sendError(ctx, 404, "Endpoint not found"));
    }
}
