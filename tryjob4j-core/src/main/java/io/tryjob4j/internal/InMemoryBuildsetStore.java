package io.tryjob4j.internal;

import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.BuildsetStore;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.Buildset;
import io.tryjob4j.core.BuildsetRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Process-local buildset store and status feed.
 *
 * <p>Used by tests and by masters that keep no persistent buildset history. The build engine
 * reports results through {@link #recordCompletion(String, BuildCompletion)}.
 */
public class InMemoryBuildsetStore implements BuildsetStore, BuildStatusFeed {
    private static final Logger log = LoggerFactory.getLogger(InMemoryBuildsetStore.class);

    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, Buildset> buildsets = new LinkedHashMap<>();
    private final Map<String, List<BuildCompletion>> completions = new LinkedHashMap<>();
    private final Map<String, List<Consumer<BuildCompletion>>> listeners = new LinkedHashMap<>();
    private final List<Consumer<Buildset>> creationListeners = new CopyOnWriteArrayList<>();

    /**
     * Registers a hook invoked after each buildset is created. Stands in for the build engine
     * picking up new work.
     */
    public void onBuildsetCreated(Consumer<Buildset> listener) {
        creationListeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public String createBuildset(BuildsetRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        Buildset buildset;
        synchronized (this) {
            String id = "bs-" + sequence.incrementAndGet();
            buildset = Buildset.from(id, request, Instant.now());
            buildsets.put(id, buildset);
            completions.put(id, new ArrayList<>());
        }
        log.debug("Buildset created id={} scheduler={} builders={}",
                buildset.id(), buildset.schedulerName(), buildset.builderNames());

        for (Consumer<Buildset> l : creationListeners) {
            l.accept(buildset);
        }
        return buildset.id();
    }

    @Override
    public synchronized Optional<Buildset> getBuildset(String buildsetId) {
        return Optional.ofNullable(buildsets.get(buildsetId));
    }

    @Override
    public synchronized List<Buildset> getBuildsets() {
        return List.copyOf(buildsets.values());
    }

    public synchronized List<BuildCompletion> getCompletions(String buildsetId) {
        List<BuildCompletion> list = completions.get(buildsetId);
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Records a build status and pushes it to current subscribers of the buildset.
     *
     * @throws IllegalArgumentException when the buildset is unknown
     */
    public void recordCompletion(String buildsetId, BuildCompletion completion) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        Objects.requireNonNull(completion, "completion must not be null");

        List<Consumer<BuildCompletion>> targets;
        synchronized (this) {
            List<BuildCompletion> list = completions.get(buildsetId);
            if (list == null) {
                throw new IllegalArgumentException("unknown buildset: " + buildsetId);
            }
            list.add(completion);
            targets = List.copyOf(listeners.getOrDefault(buildsetId, List.of()));
        }
        for (Consumer<BuildCompletion> l : targets) {
            l.accept(completion);
        }
    }

    @Override
    public Subscription subscribe(String buildsetId, Consumer<BuildCompletion> listener) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        List<BuildCompletion> replay;
        synchronized (this) {
            if (!buildsets.containsKey(buildsetId)) {
                throw new IllegalArgumentException("unknown buildset: " + buildsetId);
            }
            listeners.computeIfAbsent(buildsetId, k -> new ArrayList<>()).add(listener);
            replay = List.copyOf(completions.get(buildsetId));
        }
        replay.forEach(listener);

        return () -> {
            synchronized (InMemoryBuildsetStore.this) {
                List<Consumer<BuildCompletion>> l = listeners.get(buildsetId);
                if (l != null) {
                    l.remove(listener);
                }
            }
        };
    }
}
