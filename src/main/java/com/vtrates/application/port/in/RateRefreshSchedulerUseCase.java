package com.vtrates.application.port.in;

import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;

import java.time.Duration;
import java.time.Instant;

/**
 * Input port for periodic rate refresh
 */
public interface RateRefreshSchedulerUseCase {

    /**
     * Start periodic refresh, running the first update immediately
     */
    Future<Void> start();

    /**
     * Stop scheduling and wait up to {@code timeout} for an in-flight run
     */
    Future<Void> stop(Duration timeout);

    /**
     * Manually trigger a run outside the schedule
     */
    Future<UpdateResult> runNow();

    SchedulerStatus status();

    record SchedulerStatus(
            boolean running,
            boolean inFlight,
            long scheduledRuns,
            long successfulRuns,
            long failedRuns,
            long skippedRuns,
            Instant lastRunAt,
            Instant nextRunAt,
            UpdateResult lastResult,
            Duration updateInterval,
            Duration ratesTtl
    ) {
    }
}
