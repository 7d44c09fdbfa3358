package com.vtrates.adapter.in.web.scheduler;

import com.vtrates.adapter.in.web.HttpResponses;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles GET /api/scheduler
 */
@RequiredArgsConstructor
public class SchedulerStatusHandler implements Handler<RoutingContext> {

    private final RateRefreshSchedulerUseCase scheduler;

    @Override
    public void handle(RoutingContext context) {
        HttpResponses.sendJson(context, 200, SchedulerStatusResponse.from(scheduler.status()));
    }
}
