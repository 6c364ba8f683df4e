package io.tryjob4j.utils;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Timer-based waiting: re-evaluate a condition on a fixed interval without holding a thread
 * between evaluations.
 */
public final class AsyncConditions {
    private AsyncConditions() {
    }

    /**
     * Completes once {@code condition} returns true.
     *
     * <p>The first check runs immediately on {@code executor}; each failed check schedules the next
     * one {@code interval} later. The future fails with {@link TimeoutException} when
     * {@code timeout} elapses first, or with the condition's exception if it throws. Cancelling
     * the returned future stops further checks.
     *
     * @param timeout maximum time to wait; null waits indefinitely
     */
    public static CompletableFuture<Void> waitFor(ScheduledExecutorService executor,
                                                  BooleanSupplier condition,
                                                  Duration interval,
                                                  Duration timeout) {
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be a positive duration");
        }
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }

        CompletableFuture<Void> result = new CompletableFuture<>();
        long deadline = timeout == null ? 0L : System.nanoTime() + timeout.toNanos();
        Runnable check = new Runnable() {
            @Override
            public void run() {
                if (result.isDone()) {
                    return;
                }
                try {
                    if (condition.getAsBoolean()) {
                        result.complete(null);
                        return;
                    }
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                    return;
                }
                if (timeout != null && System.nanoTime() - deadline >= 0) {
                    result.completeExceptionally(new TimeoutException("condition not met within " + timeout));
                    return;
                }
                schedule(executor, this, interval.toNanos(), result);
            }
        };
        schedule(executor, check, 0, result);
        return result;
    }

    private static void schedule(ScheduledExecutorService executor,
                                 Runnable task,
                                 long delayNanos,
                                 CompletableFuture<Void> result) {
        try {
            executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
    }
}
