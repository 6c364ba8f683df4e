package io.tryjob4j.internal.mongo;

import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.core.BuildCompletion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Build status feed over {@link MongoBuildsetStore}: each subscription re-reads the buildset's
 * results every {@code pollInterval} and forwards the entries it has not seen yet.
 */
public class MongoBuildStatusFeed implements BuildStatusFeed {
    private static final Logger log = LoggerFactory.getLogger(MongoBuildStatusFeed.class);

    private final MongoBuildsetStore store;
    private final ScheduledExecutorService executor;
    private final Duration pollInterval;

    public MongoBuildStatusFeed(MongoBuildsetStore store, ScheduledExecutorService executor, Duration pollInterval) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
    }

    /**
     * @throws IllegalArgumentException when the buildset is unknown
     */
    @Override
    public Subscription subscribe(String buildsetId, Consumer<BuildCompletion> listener) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        if (!store.exists(buildsetId)) {
            throw new IllegalArgumentException("unknown buildset: " + buildsetId);
        }

        Cursor cursor = new Cursor(buildsetId, listener);
        ScheduledFuture<?> task = executor.scheduleWithFixedDelay(
                cursor,
                0,
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
        return () -> task.cancel(false);
    }

    private class Cursor implements Runnable {
        private final String buildsetId;
        private final Consumer<BuildCompletion> listener;
        private int delivered;

        Cursor(String buildsetId, Consumer<BuildCompletion> listener) {
            this.buildsetId = buildsetId;
            this.listener = listener;
        }

        @Override
        public void run() {
            try {
                List<BuildCompletion> all = store.getCompletions(buildsetId);
                while (delivered < all.size()) {
                    listener.accept(all.get(delivered));
                    delivered++;
                }
            } catch (Exception e) {
                // the next tick retries
                log.warn("Build status poll failed buildsetId={} msg={}", buildsetId, e.getMessage(), e);
            }
        }
    }
}
