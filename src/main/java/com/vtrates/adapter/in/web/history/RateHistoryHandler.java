package com.vtrates.adapter.in.web.history;

import com.vtrates.adapter.in.web.HttpResponses;
import com.vtrates.application.port.in.RateQueryUseCase;
import com.vtrates.domain.model.CurrencyPair;
import com.vtrates.domain.model.HistoryFilter;
import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Handles GET /api/rates/history[?currency=C&pair=FROM_TO&source=S&since=ISO&limit=N]
 */
@RequiredArgsConstructor
public class RateHistoryHandler implements Handler<RoutingContext> {

    static final int DEFAULT_LIMIT = 50;

    private final RateQueryUseCase queryUseCase;

    @Override
    public void handle(RoutingContext context) {
        HistoryFilter filter;
        int limit;
        try {
            String pair = HttpResponses.stringParam(context, "pair");
            filter = new HistoryFilter(
                    HttpResponses.stringParam(context, "currency"),
                    pair == null ? null : CurrencyPair.parse(pair),
                    HttpResponses.stringParam(context, "source"),
                    since(HttpResponses.stringParam(context, "since")));
            Integer requested = HttpResponses.intParam(context, "limit");
            limit = requested == null ? DEFAULT_LIMIT : requested;
        } catch (IllegalArgumentException e) {
            HttpResponses.sendFailure(context, e);
            return;
        }

        queryUseCase.history(filter, limit)
                .onSuccess(entries -> {
                    List<HistoryEntryResponse> body = entries.stream()
                            .map(HistoryEntryResponse::from)
                            .toList();
                    HttpResponses.sendJson(context, 200, new HistoryResponse(body.size(), body));
                })
                .onFailure(error -> HttpResponses.sendFailure(context, error));
    }

    private static Instant since(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Query parameter 'since' must be an ISO-8601 instant: " + value, e);
        }
    }
}
