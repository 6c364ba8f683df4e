package io.tryjob4j.utils;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AsyncConditionsTest {

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void completesOnceConditionHolds() throws Exception {
        AtomicInteger checks = new AtomicInteger();

        CompletableFuture<Void> f = AsyncConditions.waitFor(executor,
                () -> checks.incrementAndGet() >= 3, Duration.ofMillis(10), Duration.ofSeconds(5));

        f.get(5, TimeUnit.SECONDS);
        assertEquals(3, checks.get());
    }

    @Test
    void failsWithTimeoutWhenConditionNeverHolds() {
        CompletableFuture<Void> f = AsyncConditions.waitFor(executor,
                () -> false, Duration.ofMillis(10), Duration.ofMillis(100));

        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        assertInstanceOf(TimeoutException.class, e.getCause());
    }

    @Test
    void propagatesConditionFailure() {
        CompletableFuture<Void> f = AsyncConditions.waitFor(executor,
                () -> {
                    throw new IllegalStateException("boom");
                }, Duration.ofMillis(10), null);

        ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void cancellingStopsFurtherChecks() throws Exception {
        AtomicInteger checks = new AtomicInteger();
        CompletableFuture<Void> f = AsyncConditions.waitFor(executor,
                () -> {
                    checks.incrementAndGet();
                    return false;
                }, Duration.ofMillis(10), null);

        Thread.sleep(50);
        f.cancel(false);
        int seen = checks.get();
        Thread.sleep(100);

        assertTrue(f.isCancelled());
        assertTrue(checks.get() <= seen + 1);
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class,
                () -> AsyncConditions.waitFor(executor, () -> true, Duration.ZERO, null));
    }
}
