package io.tryjob4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.BuildResult;
import io.tryjob4j.core.Buildset;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.Patch;
import io.tryjob4j.core.SourceStamp;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoBuildsetStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoBuildsetStore store;
    private ScheduledExecutorService executor;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "tryjob4j_test");
        mongoTemplate.dropCollection(BuildsetDocument.class);
        store = new MongoBuildsetStore(mongoTemplate, new ObjectMapper());
        executor = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        mongoTemplate.dropCollection(BuildsetDocument.class);
    }

    @Test
    void createdBuildsetShouldReadBackUnchanged() {
        Job job = Job.builder()
                .jobId("job-1")
                .sourceStamp(new SourceStamp("trunk", "abc", new Patch(1, "diff body"), "repo", "proj"))
                .comment("try it")
                .property("owner", "alice")
                .build();

        String id = store.createBuildset(BuildsetRequest.forJob("try", job, List.of("a", "b"), "alice"));
        Buildset bs = store.getBuildset(id).orElseThrow();

        assertEquals("try", bs.schedulerName());
        assertEquals(job.sourceStamp(), bs.sourceStamp());
        assertEquals(List.of("a", "b"), bs.builderNames());
        assertEquals("'try' job by user alice", bs.reason());
        assertEquals("try it", bs.comment());
        assertEquals("job-1", bs.externalJobId());
        assertEquals(Map.of("owner", "alice"), bs.properties());
        assertNotNull(bs.submittedAt());
        assertEquals(1, store.getBuildsets().size());
    }

    @Test
    void completionsShouldBeAppendedInReportOrder() {
        String id = store.createBuildset(request("job-1"));

        store.recordCompletion(id, new BuildCompletion("a", 1, BuildResult.RUNNING, null));
        store.recordCompletion(id, new BuildCompletion("a", 1, BuildResult.SUCCESS, "finished"));

        List<BuildCompletion> results = store.getCompletions(id);
        assertEquals(2, results.size());
        assertEquals(BuildResult.SUCCESS, results.get(1).result());
        assertEquals("finished", results.get(1).detail());
    }

    @Test
    void unknownBuildsetShouldBeRejected() {
        BuildCompletion c = new BuildCompletion("a", 1, BuildResult.SUCCESS, null);

        assertThrows(IllegalArgumentException.class, () -> store.recordCompletion("000000000000000000000000", c));
        assertFalse(store.getBuildset("000000000000000000000000").isPresent());
    }

    @Test
    void feedShouldReplayAndThenForwardNewResults() throws InterruptedException {
        MongoBuildStatusFeed feed = new MongoBuildStatusFeed(store, executor, Duration.ofMillis(50));
        String id = store.createBuildset(request("job-1"));
        store.recordCompletion(id, new BuildCompletion("a", 1, BuildResult.SUCCESS, "finished"));

        List<BuildCompletion> received = new CopyOnWriteArrayList<>();
        BuildStatusFeed.Subscription sub = feed.subscribe(id, received::add);
        store.recordCompletion(id, new BuildCompletion("b", 2, BuildResult.FAILURE, "failed"));

        boolean reached = waitUntil(5, TimeUnit.SECONDS, () -> received.size() == 2);
        sub.cancel();

        assertTrue(reached);
        assertEquals("a", received.get(0).builderName());
        assertEquals("b", received.get(1).builderName());
    }

    private static BuildsetRequest request(String jobId) {
        Job job = Job.builder().jobId(jobId).sourceStamp(SourceStamp.of(null, "r1", null)).build();
        return BuildsetRequest.forJob("try", job, List.of("a", "b"), null);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
