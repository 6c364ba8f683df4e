package io.tryjob4j.internal.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.tryjob4j.core.AuthenticationException;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.BuildResult;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.core.MalformedJobException;
import io.tryjob4j.core.SourceStamp;
import io.tryjob4j.core.TransportException;
import io.tryjob4j.internal.InMemoryBuildsetStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class UserpassSchedulerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JobCodec codec = new JobCodec(objectMapper);

    private EventLoopGroup group;
    private InMemoryBuildsetStore store;
    private UserpassScheduler scheduler;

    @BeforeEach
    void setUp() {
        group = new NioEventLoopGroup(2);
        store = new InMemoryBuildsetStore();
        scheduler = newScheduler(store);
        scheduler.start();
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
        group.shutdownGracefully(0, 1, TimeUnit.SECONDS).syncUninterruptibly();
    }

    @Test
    void startShouldRegisterTheBoundPort() {
        assertTrue(scheduler.isActive());
        assertEquals(1, scheduler.registrations().size());
        SchedulerRegistration registration = scheduler.registrations().get(0);
        assertEquals("try", registration.schedulerName());
        assertTrue(registration.getPort() > 0);

        scheduler.stop();
        assertFalse(scheduler.isActive());
        assertTrue(scheduler.registrations().isEmpty());
    }

    @Test
    void bindingATakenPortShouldFail() {
        UserpassScheduler clash = new UserpassScheduler("clash", List.of("a"), "127.0.0.1", port(),
                Map.of("u", "p"), store, store, group, objectMapper);

        assertThrows(TransportException.class, clash::start);
        assertFalse(clash.isActive());
    }

    @Test
    void requestsBeforeLoginAreRejectedAndTheConnectionClosed() throws Exception {
        TryRpcClient client = connect();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.listBuilders().get(5, TimeUnit.SECONDS));

        assertInstanceOf(AuthenticationException.class, e.getCause());
        client.closeFuture().get(5, TimeUnit.SECONDS);
        assertFalse(client.isOpen());
    }

    @Test
    void listBuildersHasNoSideEffect() throws Exception {
        TryRpcClient client = loggedIn();

        assertEquals(List.of("a", "b"), client.listBuilders().get(5, TimeUnit.SECONDS));
        assertTrue(store.getBuildsets().isEmpty());
        assertEquals(1, scheduler.sessions().size());
        client.close();
    }

    @Test
    void onlyOneJobPerSession() throws Exception {
        TryRpcClient client = loggedIn();

        RpcMessage.JobAccepted accepted = client.submitJob(encoded("j1", "a")).get(5, TimeUnit.SECONDS);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.submitJob(encoded("j2", "a")).get(5, TimeUnit.SECONDS));

        assertEquals(List.of("a"), accepted.builderNames());
        assertInstanceOf(TransportException.class, e.getCause());
        assertEquals(1, store.getBuildsets().size());
        client.close();
    }

    @Test
    void emptyBuilderListResolvesToTheWhitelist() throws Exception {
        TryRpcClient client = loggedIn();

        RpcMessage.JobAccepted accepted = client.submitJob(encoded("j1")).get(5, TimeUnit.SECONDS);

        assertEquals(List.of("a", "b"), accepted.builderNames());
        assertEquals(List.of("a", "b"), store.getBuildset(accepted.buildsetId()).orElseThrow().builderNames());
        client.close();
    }

    @Test
    void malformedJobsAreRejected() throws Exception {
        TryRpcClient client = loggedIn();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.submitJob("{\"version\":1}").get(5, TimeUnit.SECONDS));

        assertInstanceOf(MalformedJobException.class, e.getCause());
        assertTrue(store.getBuildsets().isEmpty());
        client.close();
    }

    @Test
    void subscribersOnlySeeTheirOwnBuildset() throws Exception {
        String foreign = store.createBuildset(BuildsetRequest.forJob("other",
                Job.builder().sourceStamp(SourceStamp.of(null, "r", null)).build(), List.of("a"), null));
        TryRpcClient client = loggedIn();
        List<BuildCompletion> received = new CopyOnWriteArrayList<>();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.subscribe(foreign, received::add).get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());

        RpcMessage.JobAccepted accepted = client.submitJob(encoded("j1", "a", "b")).get(5, TimeUnit.SECONDS);
        RpcMessage.Subscribed subscribed = client.subscribe(accepted.buildsetId(), received::add).get(5, TimeUnit.SECONDS);
        store.recordCompletion(foreign, new BuildCompletion("a", 1, BuildResult.FAILURE, null));
        store.recordCompletion(accepted.buildsetId(), new BuildCompletion("b", 3, BuildResult.SUCCESS, "finished"));

        assertEquals(List.of("a", "b"), subscribed.builderNames());
        assertTrue(waitUntil(() -> received.size() == 1));
        assertEquals(new BuildCompletion("b", 3, BuildResult.SUCCESS, "finished"), received.get(0));
        client.close();
    }

    @Test
    void subscribeIsUnsupportedWithoutAFeed() throws Exception {
        UserpassScheduler noFeed = new UserpassScheduler("nofeed", List.of("a"), "127.0.0.1", 0,
                Map.of("u", "p"), store, null, group, objectMapper);
        noFeed.start();
        try {
            TryRpcClient client = TryRpcClient.connect(group, "127.0.0.1",
                    noFeed.registrations().get(0).getPort(), objectMapper).get(5, TimeUnit.SECONDS);
            client.login("u", "p").get(5, TimeUnit.SECONDS);
            RpcMessage.JobAccepted accepted = client.submitJob(encoded("j1", "a")).get(5, TimeUnit.SECONDS);

            CompletableFuture<RpcMessage.Subscribed> f = client.subscribe(accepted.buildsetId(), c -> { });

            ExecutionException e = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
            assertInstanceOf(TransportException.class, e.getCause());
            client.close();
        } finally {
            noFeed.stop();
        }
    }

    @Test
    void stopShouldCloseOpenSessions() throws Exception {
        TryRpcClient client = loggedIn();

        scheduler.stop();

        client.closeFuture().get(5, TimeUnit.SECONDS);
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.listBuilders().get(5, TimeUnit.SECONDS));
        assertInstanceOf(TransportException.class, e.getCause());
    }

    @Test
    void stopShouldAlsoCloseConnectionsThatNeverLoggedIn() throws Exception {
        TryRpcClient anonymous = connect();
        TryRpcClient client = loggedIn();
        assertTrue(waitUntil(() -> scheduler.connections().size() == 2));
        assertEquals(1, scheduler.sessions().size());

        scheduler.stop();

        anonymous.closeFuture().get(5, TimeUnit.SECONDS);
        client.closeFuture().get(5, TimeUnit.SECONDS);
        assertFalse(anonymous.isOpen());
        assertTrue(scheduler.connections().isEmpty());
    }

    private UserpassScheduler newScheduler(InMemoryBuildsetStore s) {
        return new UserpassScheduler("try", List.of("a", "b"), "127.0.0.1", 0,
                Map.of("alice", "secret"), s, s, group, objectMapper);
    }

    private TryRpcClient connect() throws Exception {
        return TryRpcClient.connect(group, "127.0.0.1", port(), objectMapper).get(5, TimeUnit.SECONDS);
    }

    private TryRpcClient loggedIn() throws Exception {
        TryRpcClient client = connect();
        RpcMessage.LoginAccepted ok = client.login("alice", "secret").get(5, TimeUnit.SECONDS);
        assertEquals("alice", ok.username());
        return client;
    }

    private String encoded(String jobId, String... builders) {
        return codec.encodeToString(Job.builder()
                .jobId(jobId)
                .sourceStamp(SourceStamp.of("trunk", "r1", null))
                .builderNames(List.of(builders))
                .build());
    }

    private int port() {
        return scheduler.registrations().get(0).getPort();
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }
}
