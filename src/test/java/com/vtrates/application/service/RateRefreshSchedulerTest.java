package com.vtrates.application.service;

import com.vtrates.application.port.in.RateRefreshSchedulerUseCase.SchedulerStatus;
import com.vtrates.application.port.in.RateUpdateUseCase;
import com.vtrates.domain.model.UpdateResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.vtrates.TestFutures.await;
import static com.vtrates.TestFutures.awaitResult;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit test for RateRefreshScheduler
 */
class RateRefreshSchedulerTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    @Mock
    private RateUpdateUseCase updater;

    private Vertx vertx;
    private AutoCloseable mocks;
    private RateRefreshScheduler scheduler;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        vertx = Vertx.vertx();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (scheduler != null) {
            await(scheduler.stop(Duration.ofMillis(100)));
        }
        if (vertx != null) {
            CountDownLatch latch = new CountDownLatch(1);
            vertx.close().onComplete(ar -> latch.countDown());
            latch.await(5, TimeUnit.SECONDS);
        }
        if (mocks != null) {
            mocks.close();
        }
    }

    private static UpdateResult success() {
        return new UpdateResult("run1", true, Map.of(), List.of(), 4, 12, Instant.now(), null);
    }

    private RateRefreshScheduler scheduler(Duration interval) {
        scheduler = new RateRefreshScheduler(vertx, updater, interval, TTL, Clock.systemUTC());
        return scheduler;
    }

    @Test
    void start_shouldRunImmediatelyAndSchedule() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(success()));

        awaitResult(scheduler(Duration.ofHours(1)).start());

        verify(updater, times(1)).run();
        SchedulerStatus status = scheduler.status();
        assertTrue(status.running());
        assertFalse(status.inFlight());
        assertEquals(1, status.scheduledRuns());
        assertEquals(1, status.successfulRuns());
        assertNotNull(status.lastRunAt());
        assertNotNull(status.nextRunAt());
        assertEquals("run1", status.lastResult().runId());
        assertEquals(TTL, status.ratesTtl());
    }

    @Test
    void start_shouldSurviveFailedFirstRun() throws InterruptedException {
        when(updater.run()).thenReturn(Future.failedFuture(new IllegalStateException("boom")));

        awaitResult(scheduler(Duration.ofHours(1)).start());

        assertTrue(scheduler.status().running());
        assertEquals(1, scheduler.status().failedRuns());
    }

    @Test
    void start_shouldCountUnsuccessfulResultAsFailure() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(
                UpdateResult.failed("run2", Map.of(), List.of(), 5, "All 2 rate sources failed")));

        awaitResult(scheduler(Duration.ofHours(1)).start());

        assertEquals(0, scheduler.status().successfulRuns());
        assertEquals(1, scheduler.status().failedRuns());
    }

    @Test
    void periodicTick_shouldRunAgain() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(success()));

        awaitResult(scheduler(Duration.ofMillis(50)).start());
        Thread.sleep(300);

        verify(updater, atLeast(3)).run();
        assertTrue(scheduler.status().scheduledRuns() >= 3);
    }

    @Test
    void periodicTick_shouldSkipWhilePreviousRunInFlight() throws InterruptedException {
        Promise<UpdateResult> slow = Promise.promise();
        when(updater.run()).thenReturn(slow.future());

        Future<Void> started = scheduler(Duration.ofMillis(50)).start();
        Thread.sleep(300);

        SchedulerStatus status = scheduler.status();
        assertTrue(status.inFlight());
        assertEquals(1, status.scheduledRuns());
        assertTrue(status.skippedRuns() >= 2);
        verify(updater, times(1)).run();

        slow.complete(success());
        awaitResult(started);
        assertFalse(scheduler.status().inFlight());
    }

    @Test
    void stop_shouldCancelTimer() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(success()));
        awaitResult(scheduler(Duration.ofMillis(50)).start());

        awaitResult(scheduler.stop(Duration.ofSeconds(1)));
        long runs = scheduler.status().scheduledRuns();
        Thread.sleep(200);

        assertFalse(scheduler.status().running());
        assertNull(scheduler.status().nextRunAt());
        assertEquals(runs, scheduler.status().scheduledRuns());
    }

    @Test
    void stop_shouldGiveUpWaitingAfterTimeout() throws InterruptedException {
        when(updater.run()).thenReturn(Promise.<UpdateResult>promise().future());
        scheduler(Duration.ofHours(1)).start();

        long started = System.nanoTime();
        awaitResult(scheduler.stop(Duration.ofMillis(100)));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started) >= 90);
        assertFalse(scheduler.status().running());
    }

    @Test
    void runNow_shouldRecordResultOutsideSchedule() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(success()));

        UpdateResult result = awaitResult(scheduler(Duration.ofHours(1)).runNow());

        assertTrue(result.success());
        assertEquals(0, scheduler.status().scheduledRuns());
        assertEquals(1, scheduler.status().successfulRuns());
        assertFalse(scheduler.status().running());
    }

    @Test
    void runNow_shouldShowInLastRunAt() throws InterruptedException {
        when(updater.run()).thenReturn(Future.succeededFuture(success()));
        Instant before = Instant.now();

        awaitResult(scheduler(Duration.ofHours(1)).runNow());

        assertNotNull(scheduler.status().lastRunAt());
        assertFalse(scheduler.status().lastRunAt().isBefore(before.minusSeconds(1)));
        assertNotNull(scheduler.status().lastResult());
        assertNull(scheduler.status().nextRunAt());
    }
}
