package com.vtrates.adapter.in.web.rates;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vtrates.application.port.in.RateQueryUseCase.RateListing;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateListingResponse(
        String lastRefresh,
        boolean fresh,
        int totalPairs,
        int count,
        List<RateRecordResponse> rates
) {
    public static RateListingResponse from(RateListing listing) {
        List<RateRecordResponse> rates = listing.records().stream()
                .map(RateRecordResponse::from)
                .toList();
        return new RateListingResponse(
                listing.lastRefresh() == null ? null : listing.lastRefresh().toString(),
                listing.fresh(),
                listing.totalPairs(),
                rates.size(),
                rates);
    }
}
