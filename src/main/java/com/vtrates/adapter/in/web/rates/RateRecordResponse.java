package com.vtrates.adapter.in.web.rates;

import com.vtrates.domain.model.RateRecord;

/**
 * DTO for one cached rate
 */
public record RateRecordResponse(
        String pair,
        String from,
        String to,
        double rate,
        String updatedAt,
        String source,
        String origin
) {
    public static RateRecordResponse from(RateRecord record) {
        return new RateRecordResponse(
                record.pair().key(),
                record.pair().from(),
                record.pair().to(),
                record.rate(),
                record.updatedAt().toString(),
                record.source(),
                record.origin().getValue());
    }
}
