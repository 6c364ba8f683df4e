package io.tryjob4j.internal.mailbox;

import io.tryjob4j.core.Job;
import io.tryjob4j.core.MalformedJobException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of one {@link MailboxTransport#poll()}.
 *
 * @param jobs       decoded jobs, already moved to {@code cur/}, in listing order
 * @param malformed  entries that failed to decode; they stay in {@code new/}
 * @param unreadable entries that could not be read or moved; they stay in {@code new/} and are
 *                   retried on the next poll
 */
public record MailboxBatch(List<Job> jobs, List<Malformed> malformed, List<Unreadable> unreadable) {

    public MailboxBatch {
        jobs = List.copyOf(jobs);
        malformed = List.copyOf(malformed);
        unreadable = List.copyOf(unreadable);
    }

    public static MailboxBatch empty() {
        return new MailboxBatch(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return jobs.isEmpty() && malformed.isEmpty() && unreadable.isEmpty();
    }

    public record Malformed(Path entry, MalformedJobException error) {
    }

    public record Unreadable(Path entry, IOException error) {
    }
}
