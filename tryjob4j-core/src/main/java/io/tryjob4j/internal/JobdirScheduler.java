package io.tryjob4j.internal;

import io.tryjob4j.BuildsetStore;
import io.tryjob4j.TryScheduler;
import io.tryjob4j.core.BuilderWhitelist;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.UnknownBuilderException;
import io.tryjob4j.internal.mailbox.MailboxBatch;
import io.tryjob4j.internal.mailbox.MailboxTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler fed through a mailbox directory.
 *
 * <p>While active, a tick on the master's event loop polls the mailbox every {@code pollInterval}
 * and creates one buildset per decoded job. There is no channel back to the submitting client,
 * so clients cannot wait for results on this path.
 *
 * <p>Typical usage:
 * <pre>{@code
 * JobdirScheduler sch = new JobdirScheduler("try", List.of("a"), mailbox,
 *         Duration.ofSeconds(10), store, eventLoop);
 * sch.start();
 * }</pre>
 */
public class JobdirScheduler implements TryScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobdirScheduler.class);

    private final String name;
    private final BuilderWhitelist whitelist;
    private final MailboxTransport mailbox;
    private final Duration pollInterval;
    private final BuildsetStore store;
    private final ScheduledExecutorService executor;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final Set<String> reportedMalformed = ConcurrentHashMap.newKeySet();
    private final Set<String> reportedUnreadable = ConcurrentHashMap.newKeySet();
    private volatile ScheduledFuture<?> tick;

    public JobdirScheduler(String name,
                           List<String> builderNames,
                           MailboxTransport mailbox,
                           Duration pollInterval,
                           BuildsetStore store,
                           ScheduledExecutorService executor) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.whitelist = new BuilderWhitelist(builderNames);
        this.mailbox = Objects.requireNonNull(mailbox, "mailbox must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be a positive duration");
        }
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> builderNames() {
        return whitelist.names();
    }

    public MailboxTransport mailbox() {
        return mailbox;
    }

    @Override
    public void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }
        try {
            mailbox.ensureLayout();
        } catch (RuntimeException e) {
            active.set(false);
            throw e;
        }

        log.info("Jobdir scheduler starting name={} jobdir={} pollInterval={} builders={}",
                name, mailbox.root(), pollInterval, whitelist.names());

        tick = executor.scheduleWithFixedDelay(
                this::pollSafely,
                0,
                pollInterval.toMillis(),
                TimeUnit.MILLISECONDS
        );
    }

    @Override
    public void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        ScheduledFuture<?> t = tick;
        if (t != null) {
            // entries not yet moved to cur/ stay pollable after a restart
            t.cancel(false);
            tick = null;
        }
        log.info("Jobdir scheduler stopped name={}", name);
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    /**
     * Runs one poll on the scheduler's executor, outside the regular tick.
     *
     * @return ids of the buildsets created by this poll
     */
    public CompletableFuture<List<String>> pollNow() {
        return CompletableFuture.supplyAsync(this::pollOnce, executor);
    }

    @Override
    public String ingest(Job job, String submitter) {
        Objects.requireNonNull(job, "job must not be null");

        List<String> builders = whitelist.resolve(job.builderNames());
        String who = job.who() != null ? job.who() : submitter;
        return store.createBuildset(BuildsetRequest.forJob(name, job, builders, who));
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (Exception e) {
            log.error("Jobdir poll failed name={} jobdir={} msg={}", name, mailbox.root(), e.getMessage(), e);
        }
    }

    private List<String> pollOnce() {
        MailboxBatch batch = mailbox.poll();
        if (batch.isEmpty()) {
            return List.of();
        }

        for (MailboxBatch.Malformed m : batch.malformed()) {
            String entry = m.entry().getFileName().toString();
            if (reportedMalformed.add(entry)) {
                log.warn("Jobdir skipping malformed job name={} entry={} msg={}", name, m.entry(), m.error().getMessage());
            } else {
                log.debug("Jobdir malformed job still present name={} entry={}", name, m.entry());
            }
        }

        for (MailboxBatch.Unreadable u : batch.unreadable()) {
            String entry = u.entry().getFileName().toString();
            if (reportedUnreadable.add(entry)) {
                log.warn("Jobdir skipping unreadable job name={} entry={} msg={}",
                        name, u.entry(), u.error().getMessage(), u.error());
            } else {
                log.debug("Jobdir unreadable job still present name={} entry={}", name, u.entry());
            }
        }

        List<String> created = new ArrayList<>(batch.jobs().size());
        for (Job job : batch.jobs()) {
            try {
                String buildsetId = ingest(job, null);
                created.add(buildsetId);
                log.info("Jobdir job accepted name={} jobId={} buildsetId={}", name, job.jobId(), buildsetId);
            } catch (UnknownBuilderException e) {
                log.warn("Jobdir job rejected name={} jobId={} unknownBuilders={}",
                        name, job.jobId(), e.getUnknownBuilders());
            } catch (Exception e) {
                log.error("Jobdir job failed name={} jobId={} msg={}", name, job.jobId(), e.getMessage(), e);
            }
        }
        log.debug("Jobdir polled name={} accepted={} malformed={} unreadable={}",
                name, created.size(), batch.malformed().size(), batch.unreadable().size());
        return created;
    }
}
