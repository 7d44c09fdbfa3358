package com.vtrates.application.service;

import com.vtrates.domain.exception.RateSourceException;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Retry and timing wrappers for Future-producing calls, composed explicitly at call sites
 */
@Slf4j
public final class FutureCombinators {

    private FutureCombinators() {
    }

    public static <T> Future<T> withRetry(Vertx vertx, RetryPolicy policy, String name, Supplier<Future<T>> action) {
        return withRetry(vertx, policy, name, () -> false, action);
    }

    /**
     * Retry {@code action} while it fails with a retryable {@link RateSourceException}.
     * @param cancelled checked before every retry; once true the last failure is returned
     */
    public static <T> Future<T> withRetry(Vertx vertx, RetryPolicy policy, String name,
                                          BooleanSupplier cancelled, Supplier<Future<T>> action) {
        Promise<T> promise = Promise.promise();
        attempt(vertx, policy, name, cancelled, action, 1, promise);
        return promise.future();
    }

    private static <T> void attempt(Vertx vertx, RetryPolicy policy, String name, BooleanSupplier cancelled,
                                    Supplier<Future<T>> action, int attempt, Promise<T> promise) {
        invoke(action).onComplete(ar -> {
            if (ar.succeeded()) {
                promise.complete(ar.result());
                return;
            }

            Throwable error = ar.cause();
            if (attempt >= policy.maxAttempts() || !isRetryable(error) || cancelled.getAsBoolean()) {
                promise.fail(error);
                return;
            }

            Duration delay = policy.delayAfter(attempt);
            log.warn("{} attempt {}/{} failed: {}. Retrying in {} ms",
                    name, attempt, policy.maxAttempts(), error.getMessage(), delay.toMillis());

            if (delay.toMillis() < 1) {
                attempt(vertx, policy, name, cancelled, action, attempt + 1, promise);
            } else {
                vertx.setTimer(delay.toMillis(), id ->
                        attempt(vertx, policy, name, cancelled, action, attempt + 1, promise));
            }
        });
    }

    /**
     * Log how long {@code action} took to complete
     */
    public static <T> Future<T> withTiming(String name, Supplier<Future<T>> action) {
        long started = System.nanoTime();
        return invoke(action).onComplete(ar -> {
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
            if (ar.succeeded()) {
                log.debug("{} completed in {} ms", name, elapsedMs);
            } else {
                log.debug("{} failed after {} ms: {}", name, elapsedMs, ar.cause().getMessage());
            }
        });
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof RateSourceException sourceError && sourceError.isRetryable();
    }

    /**
     * Turn a synchronous throw or a null result into a failed future
     */
    static <T> Future<T> invoke(Supplier<Future<T>> action) {
        try {
            Future<T> future = action.get();
            if (future == null) {
                return Future.failedFuture(new IllegalStateException("Action returned no future"));
            }
            return future;
        } catch (RuntimeException e) {
            return Future.failedFuture(e);
        }
    }
}
