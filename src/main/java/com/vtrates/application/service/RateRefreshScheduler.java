package com.vtrates.application.service;

import com.vtrates.application.port.in.RateRefreshSchedulerUseCase;
import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodic rate refresh on a Vert.x timer.
 * Manual runs may overlap scheduled ones; the cache's atomic replace keeps the snapshot consistent.
 */
@Slf4j
public class RateRefreshScheduler implements RateRefreshSchedulerUseCase {

    private final Vertx vertx;
    private final RateUpdateUseCase updater;
    private final Duration updateInterval;
    private final Duration ratesTtl;
    private final Clock clock;

    private final AtomicLong scheduledRuns = new AtomicLong();
    private final AtomicLong successfulRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();
    private final AtomicLong skippedRuns = new AtomicLong();

    private volatile Long timerId;
    private volatile Future<UpdateResult> inFlight;
    private volatile Instant lastRunAt;
    private volatile Instant nextRunAt;
    private volatile UpdateResult lastResult;

    public RateRefreshScheduler(Vertx vertx, RateUpdateUseCase updater, Duration updateInterval,
                                Duration ratesTtl, Clock clock) {
        this.vertx = vertx;
        this.updater = updater;
        this.updateInterval = updateInterval;
        this.ratesTtl = ratesTtl;
        this.clock = clock;
    }

    @Override
    public synchronized Future<Void> start() {
        if (timerId != null) {
            log.warn("Rate refresh scheduler is already running");
            return Future.succeededFuture();
        }

        log.info("Starting rate refresh scheduler (interval: {}s)", updateInterval.toSeconds());

        timerId = vertx.setPeriodic(updateInterval.toMillis(), id -> {
            log.info("Periodic rate refresh triggered");
            runScheduled();
        });

        // First run immediately; its outcome does not prevent scheduling
        return runScheduled()
                .onSuccess(result -> log.info("Rate refresh scheduler started"))
                .recover(error -> {
                    log.error("Initial rate refresh failed, scheduler keeps running", error);
                    return Future.succeededFuture();
                })
                .mapEmpty();
    }

    @Override
    public Future<Void> stop(Duration timeout) {
        Future<UpdateResult> running;
        synchronized (this) {
            if (timerId != null) {
                vertx.cancelTimer(timerId);
                timerId = null;
                nextRunAt = null;
                log.info("Rate refresh scheduler stopped");
            }
            running = inFlight;
        }

        if (running == null || running.isComplete()) {
            return Future.succeededFuture();
        }

        Promise<Void> stopped = Promise.promise();
        long waitTimer = vertx.setTimer(Math.max(1, timeout.toMillis()), id -> {
            if (stopped.tryComplete()) {
                log.warn("In-flight rate refresh still running after {} ms, abandoning it", timeout.toMillis());
            }
        });
        running.onComplete(ar -> {
            vertx.cancelTimer(waitTimer);
            stopped.tryComplete();
        });
        return stopped.future();
    }

    @Override
    public Future<UpdateResult> runNow() {
        log.info("Manual rate refresh triggered");
        lastRunAt = clock.instant();
        return updater.run()
                .onComplete(this::record);
    }

    private synchronized Future<UpdateResult> runScheduled() {
        Future<UpdateResult> current = inFlight;
        if (current != null && !current.isComplete()) {
            long skipped = skippedRuns.incrementAndGet();
            log.warn("Previous scheduled refresh still running, skipping this one ({} skipped so far)", skipped);
            return current;
        }

        long run = scheduledRuns.incrementAndGet();
        Instant now = clock.instant();
        lastRunAt = now;
        nextRunAt = timerId == null ? null : now.plus(updateInterval);
        log.info("Starting scheduled rate refresh #{}", run);

        Future<UpdateResult> started;
        try {
            started = updater.run();
        } catch (RuntimeException e) {
            started = Future.failedFuture(e);
        }
        inFlight = started.onComplete(this::record);
        return inFlight;
    }

    private void record(AsyncResult<UpdateResult> ar) {
        if (ar.succeeded()) {
            lastResult = ar.result();
            if (ar.result().success()) {
                successfulRuns.incrementAndGet();
            } else {
                failedRuns.incrementAndGet();
                log.error("Rate refresh {} failed: {}", ar.result().runId(), ar.result().error());
            }
        } else {
            failedRuns.incrementAndGet();
            log.error("Rate refresh failed with error", ar.cause());
        }
    }

    @Override
    public SchedulerStatus status() {
        Future<UpdateResult> current = inFlight;
        return new SchedulerStatus(
                timerId != null,
                current != null && !current.isComplete(),
                scheduledRuns.get(),
                successfulRuns.get(),
                failedRuns.get(),
                skippedRuns.get(),
                lastRunAt,
                nextRunAt,
                lastResult,
                updateInterval,
                ratesTtl
        );
    }
}
