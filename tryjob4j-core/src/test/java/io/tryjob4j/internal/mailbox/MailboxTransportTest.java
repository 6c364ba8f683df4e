package io.tryjob4j.internal.mailbox;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.core.SourceStamp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class MailboxTransportTest {

    @TempDir
    Path jobdir;

    private MailboxTransport mailbox;

    @BeforeEach
    void setUp() {
        mailbox = new MailboxTransport(jobdir, new JobCodec(new ObjectMapper()));
        mailbox.ensureLayout();
    }

    @Test
    void deliverShouldLeaveOneEntryInNewAndNothingInTmp() throws IOException {
        Path entry = mailbox.deliver(job("j1", "a"));

        assertEquals(mailbox.newDir(), entry.getParent());
        assertTrue(entry.getFileName().toString().endsWith(".job"));
        assertEquals(1, count(mailbox.newDir()));
        assertEquals(0, count(mailbox.tmpDir()));
    }

    @Test
    void pollShouldYieldEachJobExactlyOnce() throws IOException {
        Job first = job("j1", "a");
        Job second = job("j2", "a", "b");
        mailbox.deliver(first);
        mailbox.deliver(second);

        MailboxBatch batch = mailbox.poll();

        assertEquals(2, batch.jobs().size());
        assertTrue(batch.jobs().containsAll(List.of(first, second)));
        assertTrue(batch.malformed().isEmpty());
        assertEquals(0, count(mailbox.newDir()));
        assertEquals(2, count(mailbox.curDir()));

        assertTrue(mailbox.poll().isEmpty());
    }

    @Test
    void pollShouldLeaveMalformedEntriesInNew() throws IOException {
        Path bad = mailbox.newDir().resolve("0000-bad.job");
        Files.writeString(bad, "{broken", StandardCharsets.UTF_8);
        mailbox.deliver(job("j1", "a"));

        MailboxBatch batch = mailbox.poll();

        assertEquals(1, batch.jobs().size());
        assertEquals(1, batch.malformed().size());
        assertEquals(bad, batch.malformed().get(0).entry());
        assertTrue(Files.exists(bad));

        MailboxBatch again = mailbox.poll();
        assertTrue(again.jobs().isEmpty());
        assertEquals(1, again.malformed().size());
    }

    @Test
    void unreadableEntryShouldNotCostTheOtherJobs() throws IOException {
        Path kernelMemory = Path.of("/proc/self/mem");
        assumeTrue(Files.isRegularFile(kernelMemory), "needs /proc/self/mem");
        Job good = job("j1", "a");
        mailbox.deliver(good);
        Path bad = Files.createSymbolicLink(mailbox.newDir().resolve("zzzz-bad.job"), kernelMemory);

        MailboxBatch batch = mailbox.poll();

        assertEquals(List.of(good), batch.jobs());
        assertEquals(1, batch.unreadable().size());
        assertEquals(bad, batch.unreadable().get(0).entry());
        assertTrue(Files.isSymbolicLink(bad));
        assertEquals(1, count(mailbox.curDir()));
    }

    @Test
    void pollShouldReturnEmptyBatchWhenLayoutIsMissing() {
        MailboxTransport missing = new MailboxTransport(jobdir.resolve("nope"), new JobCodec(new ObjectMapper()));

        assertTrue(missing.poll().isEmpty());
        assertFalse(Files.exists(missing.root()));
    }

    private static Job job(String id, String... builders) {
        return Job.builder()
                .jobId(id)
                .sourceStamp(SourceStamp.of("trunk", "rev-" + id, null))
                .builderNames(List.of(builders))
                .build();
    }

    private static long count(Path dir) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.count();
        }
    }
}
