package io.tryjob4j.internal.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.GlobalEventExecutor;
import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.BuildsetStore;
import io.tryjob4j.TryScheduler;
import io.tryjob4j.core.BuilderWhitelist;
import io.tryjob4j.core.BuildsetRequest;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler that accepts jobs over authenticated network connections.
 *
 * <p>Each connection logs in with a username/password from the configured credentials, then
 * submits at most one job or lists the available builders. A connection that submitted a job
 * may subscribe to the completion of its buildset; results are pushed until the client leaves.
 *
 * <p>Typical usage:
 * <pre>{@code
 * UserpassScheduler sch = new UserpassScheduler("try", List.of("a"), "127.0.0.1", 0,
 *         Map.of("u", "p"), store, feed, eventLoopGroup, objectMapper);
 * sch.start();
 * int port = sch.registrations().get(0).getPort();
 * }</pre>
 */
public class UserpassScheduler implements TryScheduler {
    private static final Logger log = LoggerFactory.getLogger(UserpassScheduler.class);

    private final String name;
    private final BuilderWhitelist whitelist;
    private final String bindHost;
    private final int port;
    private final Map<String, String> credentials;
    private final BuildsetStore store;
    private final BuildStatusFeed feed;
    private final EventLoopGroup group;
    private final JobCodec jobCodec;
    private final RpcMessageCodec rpcCodec;

    private final AtomicBoolean active = new AtomicBoolean(false);
    private final ChannelGroup connections;
    private final ChannelGroup sessions;
    private volatile Channel serverChannel;
    private volatile SchedulerRegistration registration;

    /**
     * @param bindHost    interface to bind; null binds every interface
     * @param port        TCP port; 0 picks an ephemeral port
     * @param credentials username to password
     * @param feed        source of build results for waiting clients; null disables waiting
     */
    public UserpassScheduler(String name,
                             List<String> builderNames,
                             String bindHost,
                             int port,
                             Map<String, String> credentials,
                             BuildsetStore store,
                             BuildStatusFeed feed,
                             EventLoopGroup group,
                             ObjectMapper objectMapper) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.whitelist = new BuilderWhitelist(builderNames);
        this.bindHost = bindHost;
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        this.port = port;
        Objects.requireNonNull(credentials, "credentials must not be null");
        if (credentials.isEmpty()) {
            throw new IllegalArgumentException("credentials must not be empty");
        }
        this.credentials = Map.copyOf(credentials);
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.feed = feed;
        this.group = Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.jobCodec = new JobCodec(objectMapper);
        this.rpcCodec = new RpcMessageCodec(objectMapper);
        this.connections = new DefaultChannelGroup("try-connections-" + name, GlobalEventExecutor.INSTANCE);
        this.sessions = new DefaultChannelGroup("try-sessions-" + name, GlobalEventExecutor.INSTANCE);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> builderNames() {
        return whitelist.names();
    }

    /**
     * Binds the listening socket. Must not be called from an event loop thread.
     *
     * @throws TransportException when the address cannot be bound
     */
    @Override
    public void start() {
        if (!active.compareAndSet(false, true)) {
            return;
        }

        ServerBootstrap b = new ServerBootstrap();
        b.group(group)
                .channel(NioServerSocketChannel.class)
                .childHandler(new RpcChannelInitializer(rpcCodec, () -> new UserpassSessionHandler(this)))
                .option(ChannelOption.SO_BACKLOG, 128)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        ChannelFuture f = bindHost == null ? b.bind(port) : b.bind(bindHost, port);
        f.awaitUninterruptibly();
        if (!f.isSuccess()) {
            active.set(false);
            throw new TransportException("userpass scheduler '" + name + "' failed to bind port " + port, f.cause());
        }

        serverChannel = f.channel();
        registration = new SchedulerRegistration(name, (InetSocketAddress) serverChannel.localAddress());
        log.info("Userpass scheduler listening name={} address={} builders={}",
                name, registration.address(), whitelist.names());
    }

    /**
     * Closes the listener and every open session. Buildsets already created are unaffected.
     */
    @Override
    public void stop() {
        if (!active.compareAndSet(true, false)) {
            return;
        }
        registration = null;
        // every accepted connection, logged in or not
        connections.close().awaitUninterruptibly();
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().awaitUninterruptibly();
            serverChannel = null;
        }
        log.info("Userpass scheduler stopped name={}", name);
    }

    @Override
    public boolean isActive() {
        return active.get();
    }

    public List<SchedulerRegistration> registrations() {
        SchedulerRegistration r = registration;
        return r == null ? List.of() : List.of(r);
    }

    /**
     * Every accepted connection that is still open, including those that have not logged in yet.
     */
    public ChannelGroup connections() {
        return connections;
    }

    /**
     * Connections that completed login and are still open.
     */
    public ChannelGroup sessions() {
        return sessions;
    }

    @Override
    public String ingest(Job job, String submitter) {
        Objects.requireNonNull(job, "job must not be null");

        List<String> builders = whitelist.resolve(job.builderNames());
        String who = job.who() != null ? job.who() : submitter;
        return store.createBuildset(BuildsetRequest.forJob(name, job, builders, who));
    }

    boolean authenticate(String username, String password) {
        if (username == null || password == null) {
            return false;
        }
        String expected = credentials.get(username);
        if (expected == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                password.getBytes(StandardCharsets.UTF_8)
        );
    }

    JobCodec jobCodec() {
        return jobCodec;
    }

    BuildsetStore store() {
        return store;
    }

    BuildStatusFeed feed() {
        return feed;
    }
}
