package com.vtrates.adapter.in.web.rates;

import com.vtrates.adapter.in.web.HttpResponses;
import com.vtrates.application.port.in.RateQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles GET /api/rates/:from/:to[?strict=true].
 * Strict lookups answer 409 for a stale rate instead of annotating it.
 */
@RequiredArgsConstructor
public class RateLookupHandler implements Handler<RoutingContext> {

    private final RateQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        String from = context.pathParam("from");
        String to = context.pathParam("to");

        if (Boolean.parseBoolean(context.request().getParam("strict"))) {
            queryUseCase.getUsableRate(from, to)
                    .onSuccess(record -> HttpResponses.sendJson(context, 200, RateQuoteResponse.usable(record)))
                    .onFailure(error -> HttpResponses.sendFailure(context, error));
            return;
        }

        queryUseCase.getRate(from, to)
                .onSuccess(quote -> HttpResponses.sendJson(context, 200, RateQuoteResponse.from(quote)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
