package com.vtrates.adapter.in.web.update;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vtrates.domain.model.CurrencyClass;
import com.vtrates.domain.model.RateCounts;
import com.vtrates.domain.model.SourceReport;
import com.vtrates.domain.model.UpdateResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DTO for the outcome of an update run
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UpdateResultResponse(
        String status,
        String message,
        String runId,
        boolean success,
        int totalFetched,
        int totalSaved,
        int totalRejected,
        long elapsedMs,
        String lastRefresh,
        Map<String, RateCounts> counts,
        List<SourceReport> sources
) {
    public static UpdateResultResponse from(UpdateResult result) {
        Map<String, RateCounts> counts = new LinkedHashMap<>();
        for (CurrencyClass currencyClass : CurrencyClass.values()) {
            counts.put(currencyClass.getValue(), result.countsFor(currencyClass));
        }
        return new UpdateResultResponse(
                result.success() ? "success" : "error",
                result.success() ? "Saved " + result.totalSaved() + " rates" : result.error(),
                result.runId(),
                result.success(),
                result.totalFetched(),
                result.totalSaved(),
                result.totalRejected(),
                result.elapsedMs(),
                result.lastRefresh() == null ? null : result.lastRefresh().toString(),
                counts,
                result.sources());
    }
}
