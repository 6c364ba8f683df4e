package io.tryjob4j.internal.netty;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Client end of a userpass scheduler connection. Every call returns immediately; results arrive
 * on the event loop.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TryRpcClient.connect(group, "localhost", 8031, objectMapper)
 *         .thenCompose(c -> c.login("alice", "secret").thenCompose(ok -> c.submitJob(encoded)));
 * }</pre>
 */
public class TryRpcClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TryRpcClient.class);

    private static final int CONNECT_TIMEOUT_MILLIS = 30_000;

    private final Channel channel;
    private final TryRpcClientHandler handler;
    private final AtomicLong requestIds = new AtomicLong();
    private final CompletableFuture<Void> closeFuture = new CompletableFuture<>();

    private TryRpcClient(Channel channel, TryRpcClientHandler handler) {
        this.channel = channel;
        this.handler = handler;
        channel.closeFuture().addListener(f -> closeFuture.complete(null));
    }

    /**
     * Opens a connection. The future fails with {@link TransportException} when the master cannot
     * be reached.
     */
    public static CompletableFuture<TryRpcClient> connect(EventLoopGroup group,
                                                          String host,
                                                          int port,
                                                          ObjectMapper objectMapper) {
        Objects.requireNonNull(group, "group must not be null");
        Objects.requireNonNull(host, "host must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");

        TryRpcClientHandler handler = new TryRpcClientHandler();
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, CONNECT_TIMEOUT_MILLIS)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .handler(new RpcChannelInitializer(new RpcMessageCodec(objectMapper), () -> handler));

        CompletableFuture<TryRpcClient> result = new CompletableFuture<>();
        ChannelFuture f = b.connect(host, port);
        f.addListener(done -> {
            if (done.isSuccess()) {
                log.debug("Connected to try scheduler host={} port={}", host, port);
                result.complete(new TryRpcClient(f.channel(), handler));
            } else {
                result.completeExceptionally(new TransportException(
                        "failed to connect to " + host + ":" + port + ": " + done.cause().getMessage(), done.cause()));
            }
        });
        return result;
    }

    public CompletableFuture<RpcMessage.LoginAccepted> login(String username, String password) {
        return call(id -> new RpcMessage.Login(id, username, password), RpcMessage.LoginAccepted.class);
    }

    public CompletableFuture<RpcMessage.JobAccepted> submitJob(String encodedJob) {
        Objects.requireNonNull(encodedJob, "encodedJob must not be null");
        return call(id -> new RpcMessage.SubmitJob(id, encodedJob), RpcMessage.JobAccepted.class);
    }

    public CompletableFuture<List<String>> listBuilders() {
        return call(RpcMessage.ListBuilders::new, RpcMessage.BuilderList.class)
                .thenApply(RpcMessage.BuilderList::builderNames);
    }

    /**
     * Asks the scheduler to push results of the buildset submitted on this connection. The listener
     * is installed before the request goes out, so no result is missed; it runs on the event loop.
     */
    public CompletableFuture<RpcMessage.Subscribed> subscribe(String buildsetId, Consumer<BuildCompletion> listener) {
        Objects.requireNonNull(buildsetId, "buildsetId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");
        handler.onCompletion(listener);
        return call(id -> new RpcMessage.Subscribe(id, buildsetId), RpcMessage.Subscribed.class);
    }

    /**
     * Completes when the connection is closed by either side.
     */
    public CompletableFuture<Void> closeFuture() {
        return closeFuture;
    }

    public boolean isOpen() {
        return channel.isActive();
    }

    @Override
    public void close() {
        channel.close();
    }

    private <T extends RpcMessage> CompletableFuture<T> call(LongFunction<RpcMessage> request,
                                                            Class<T> replyType) {
        long id = requestIds.incrementAndGet();
        CompletableFuture<RpcMessage> reply = new CompletableFuture<>();
        handler.register(id, reply);

        if (!channel.isActive()) {
            handler.fail(id, new TransportException("connection is closed"));
        } else {
            channel.writeAndFlush(request.apply(id)).addListener(w -> {
                if (!w.isSuccess()) {
                    handler.fail(id, new TransportException("failed to send request: " + w.cause().getMessage(), w.cause()));
                }
            });
        }

        return reply.thenApply(msg -> {
            if (!replyType.isInstance(msg)) {
                throw new TransportException("unexpected reply " + msg.getClass().getSimpleName()
                        + ", expected " + replyType.getSimpleName());
            }
            return replyType.cast(msg);
        });
    }
}
