package com.vtrates.adapter.in.web.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vtrates.adapter.in.web.update.UpdateResultResponse;
import com.vtrates.application.port.in.RateRefreshSchedulerUseCase.SchedulerStatus;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SchedulerStatusResponse(
        boolean running,
        boolean inFlight,
        long scheduledRuns,
        long successfulRuns,
        long failedRuns,
        long skippedRuns,
        String lastRunAt,
        String nextRunAt,
        long updateIntervalSeconds,
        long ratesTtlSeconds,
        UpdateResultResponse lastResult
) {
    public static SchedulerStatusResponse from(SchedulerStatus status) {
        return new SchedulerStatusResponse(
                status.running(),
                status.inFlight(),
                status.scheduledRuns(),
                status.successfulRuns(),
                status.failedRuns(),
                status.skippedRuns(),
                format(status.lastRunAt()),
                format(status.nextRunAt()),
                status.updateInterval().toSeconds(),
                status.ratesTtl().toSeconds(),
                status.lastResult() == null ? null : UpdateResultResponse.from(status.lastResult()));
    }

    private static String format(Instant instant) {
        return instant == null ? null : instant.toString();
    }
}
