package com.vtrates.adapter.in.web.update;

import com.vtrates.adapter.in.web.HttpResponses;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.application.service.RateAggregator;
import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * HTTP handler for manual rate refresh
 * Handles POST /api/rates/update[?source=X]
 */
@Slf4j
@RequiredArgsConstructor
public class RateUpdateHandler implements Handler<RoutingContext> {

    private final RateUpdateUseCase updateUseCase;
    private final RateRefreshSchedulerUseCase scheduler;

    @Override
    public void handle(RoutingContext context) {
        String source = HttpResponses.stringParam(context, "source");
        log.info("Rate update requested (source: {})", source == null ? RateAggregator.ALL_SOURCES : source);

        // Full runs go through the scheduler so they show up in its status
        Future<UpdateResult> run = source == null || RateAggregator.ALL_SOURCES.equalsIgnoreCase(source)
                ? scheduler.runNow()
                : updateUseCase.run(source);

        run.onSuccess(result -> HttpResponses.sendJson(context, result.success() ? 200 : 503,
                        UpdateResultResponse.from(result)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
