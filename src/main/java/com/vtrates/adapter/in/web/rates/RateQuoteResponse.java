package com.vtrates.adapter.in.web.rates;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vtrates.application.port.in.RateQueryUseCase.RateQuote;
import com.vtrates.domain.model.RateRecord;

/**
 * DTO for a single rate lookup, annotated with freshness
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RateQuoteResponse(
        String from,
        String to,
        double rate,
        double inverseRate,
        String updatedAt,
        String source,
        String origin,
        boolean fresh,
        Long ageSeconds,
        Long ttlSeconds
) {
    public static RateQuoteResponse from(RateQuote quote) {
        RateRecord record = quote.record();
        return new RateQuoteResponse(
                record.pair().from(),
                record.pair().to(),
                record.rate(),
                quote.inverseRate(),
                record.updatedAt().toString(),
                record.source(),
                record.origin().getValue(),
                quote.fresh(),
                quote.age().toSeconds(),
                quote.ttl().toSeconds());
    }

    /**
     * A rate that already passed the freshness check
     */
    public static RateQuoteResponse usable(RateRecord record) {
        return new RateQuoteResponse(
                record.pair().from(),
                record.pair().to(),
                record.rate(),
                1.0 / record.rate(),
                record.updatedAt().toString(),
                record.source(),
                record.origin().getValue(),
                true,
                null,
                null);
    }
}
