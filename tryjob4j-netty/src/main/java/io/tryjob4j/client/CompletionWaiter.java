package io.tryjob4j.client;

import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.utils.AsyncConditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Consumer;

/**
 * Collects pushed build results and completes once every watched builder reached a terminal
 * state. Checks run on the given executor every {@code checkInterval}; no thread is held in
 * between.
 */
public class CompletionWaiter implements Consumer<BuildCompletion> {
    private static final Logger log = LoggerFactory.getLogger(CompletionWaiter.class);

    public static final String ALL_COMPLETE = "All Builds Complete";

    private final ScheduledExecutorService executor;
    private final Duration checkInterval;
    private final Duration timeout;
    private final Map<String, BuildCompletion> latest = new ConcurrentHashMap<>();
    private volatile CompletableFuture<Void> pending;

    /**
     * @param timeout null waits indefinitely
     */
    public CompletionWaiter(ScheduledExecutorService executor, Duration checkInterval, Duration timeout) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.checkInterval = Objects.requireNonNull(checkInterval, "checkInterval must not be null");
        this.timeout = timeout;
    }

    @Override
    public void accept(BuildCompletion completion) {
        Objects.requireNonNull(completion, "completion must not be null");
        log.debug("Build status builder={} buildNumber={} result={}",
                completion.builderName(), completion.buildNumber(), completion.result());
        latest.merge(completion.builderName(), completion, (old, now) -> old.isTerminal() ? old : now);
    }

    /**
     * Waits for a terminal result of every builder.
     *
     * @return {@value #ALL_COMPLETE} followed by one summary line per builder, in the given order
     */
    public CompletableFuture<List<String>> await(List<String> builderNames) {
        List<String> builders = List.copyOf(builderNames);
        CompletableFuture<Void> done = AsyncConditions.waitFor(executor, () -> allTerminal(builders), checkInterval, timeout);
        pending = done;
        return done.thenApply(v -> summary(builders));
    }

    /**
     * Fails a running {@link #await(List)} with the given cause. No-op when nothing is pending.
     */
    public void abort(Throwable cause) {
        CompletableFuture<Void> p = pending;
        if (p != null) {
            p.completeExceptionally(cause);
        }
    }

    public List<String> summary(List<String> builderNames) {
        List<String> lines = new ArrayList<>(builderNames.size() + 1);
        lines.add(ALL_COMPLETE);
        for (String b : builderNames) {
            BuildCompletion c = latest.get(b);
            lines.add(c == null ? b + ": unknown (no result)" : c.summaryLine());
        }
        return lines;
    }

    private boolean allTerminal(List<String> builders) {
        for (String b : builders) {
            BuildCompletion c = latest.get(b);
            if (c == null || !c.isTerminal()) {
                return false;
            }
        }
        return true;
    }
}
