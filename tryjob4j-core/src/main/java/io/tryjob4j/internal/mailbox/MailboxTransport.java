package io.tryjob4j.internal.mailbox;

import io.tryjob4j.core.Job;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.core.MalformedJobException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Maildir-style handoff of jobs through a directory with {@code new/}, {@code tmp/} and
 * {@code cur/} siblings.
 *
 * <p>Writers own an entry until it is renamed into {@code new/}; the consumer owns it afterwards.
 * The atomic rename is the only synchronization between the two sides.
 */
public class MailboxTransport {
    private static final Logger log = LoggerFactory.getLogger(MailboxTransport.class);

    public static final String NEW = "new";
    public static final String TMP = "tmp";
    public static final String CUR = "cur";

    private final Path root;
    private final JobCodec codec;

    public MailboxTransport(Path root, JobCodec codec) {
        this.root = Objects.requireNonNull(root, "root must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
    }

    public Path root() {
        return root;
    }

    public Path newDir() {
        return root.resolve(NEW);
    }

    public Path tmpDir() {
        return root.resolve(TMP);
    }

    public Path curDir() {
        return root.resolve(CUR);
    }

    /**
     * Creates the {@code new/tmp/cur} layout when missing.
     */
    public void ensureLayout() {
        try {
            Files.createDirectories(newDir());
            Files.createDirectories(tmpDir());
            Files.createDirectories(curDir());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to create mailbox layout under " + root, e);
        }
    }

    /**
     * Writes the job completely under {@code tmp/}, then renames it into {@code new/}.
     *
     * @return the path of the entry in {@code new/}
     */
    public Path deliver(Job job) {
        Objects.requireNonNull(job, "job must not be null");

        String fileName = newEntryName();
        Path tmp = tmpDir().resolve(fileName);
        Path target = newDir().resolve(fileName);

        try {
            Files.write(tmp, codec.encode(job), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("failed to deliver job " + job.jobId() + " into " + root, e);
        }

        log.debug("Mailbox delivered jobId={} entry={}", job.jobId(), target);
        return target;
    }

    /**
     * Consumes every decodable entry currently in {@code new/}. Never blocks.
     *
     * <p>A failure on one entry is reported in the batch and never affects the others; only a
     * failure to list {@code new/} itself propagates.
     */
    public MailboxBatch poll() {
        List<Path> entries = listNew();
        if (entries.isEmpty()) {
            return MailboxBatch.empty();
        }

        List<Job> jobs = new ArrayList<>(entries.size());
        List<MailboxBatch.Malformed> malformed = new ArrayList<>();
        List<MailboxBatch.Unreadable> unreadable = new ArrayList<>();

        for (Path entry : entries) {
            byte[] raw;
            try {
                raw = Files.readAllBytes(entry);
            } catch (NoSuchFileException e) {
                log.debug("Mailbox entry vanished before read entry={}", entry);
                continue;
            } catch (IOException e) {
                unreadable.add(new MailboxBatch.Unreadable(entry, e));
                continue;
            }

            Job job;
            try {
                job = codec.decode(raw);
            } catch (MalformedJobException e) {
                malformed.add(new MailboxBatch.Malformed(entry, e));
                continue;
            }

            try {
                if (markConsumed(entry)) {
                    jobs.add(job);
                }
            } catch (IOException e) {
                unreadable.add(new MailboxBatch.Unreadable(entry, e));
            }
        }
        return new MailboxBatch(jobs, malformed, unreadable);
    }

    private List<Path> listNew() {
        Path dir = newDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("failed to list mailbox " + dir, e);
        }
    }

    // false when another consumer got there first
    private boolean markConsumed(Path entry) throws IOException {
        Path target = curDir().resolve(entry.getFileName());
        try {
            Files.move(entry, target, StandardCopyOption.ATOMIC_MOVE);
            return true;
        } catch (NoSuchFileException | FileAlreadyExistsException e) {
            log.debug("Mailbox entry already consumed entry={}", entry);
            return false;
        }
    }

    private static String newEntryName() {
        return System.currentTimeMillis() + "-" + UUID.randomUUID() + ".job";
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Mailbox could not remove temp file path={} msg={}", path, e.getMessage());
        }
    }
}
