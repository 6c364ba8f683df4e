package io.tryjob4j;

import io.tryjob4j.core.BuildCompletion;

import java.util.function.Consumer;

/**
 * Read-only view of build results, keyed by buildset.
 */
public interface BuildStatusFeed {

    /**
     * Registers a listener for completions of the given buildset. Completions already known at
     * subscription time are replayed to the listener before this method returns or shortly after.
     * Listeners may be invoked from any thread.
     */
    Subscription subscribe(String buildsetId, Consumer<BuildCompletion> listener);

    interface Subscription {
        /**
         * Stops delivery to the listener. Never affects the builds themselves.
         */
        void cancel();
    }
}
