package com.vtrates.adapter.in.web.rates;

import com.vtrates.adapter.in.web.HttpResponses;
import com.vtrates.application.port.in.RateQueryUseCase;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

/**
 * Handles GET /api/rates[?currency=C&top=N]
 */
@RequiredArgsConstructor
public class RateListHandler implements Handler<RoutingContext> {

    private final RateQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        Integer top;
        try {
            top = HttpResponses.intParam(context, "top");
        } catch (IllegalArgumentException e) {
            HttpResponses.sendFailure(context, e);
            return;
        }

        queryUseCase.listRates(HttpResponses.stringParam(context, "currency"), top)
                .onSuccess(listing -> HttpResponses.sendJson(context, 200, RateListingResponse.from(listing)))
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }
}
