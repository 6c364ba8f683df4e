package io.tryjob4j.internal.netty;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.tryjob4j.core.AuthenticationException;
import io.tryjob4j.core.BuildCompletion;
import io.tryjob4j.core.MalformedJobException;
import io.tryjob4j.core.TransportException;
import io.tryjob4j.core.TryJobException;
import io.tryjob4j.core.UnknownBuilderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Client side of the connection: correlates replies with pending requests and forwards pushed
 * build results.
 */
class TryRpcClientHandler extends SimpleChannelInboundHandler<RpcMessage> {
    private static final Logger log = LoggerFactory.getLogger(TryRpcClientHandler.class);

    private final Map<Long, CompletableFuture<RpcMessage>> pending = new ConcurrentHashMap<>();
    private volatile Consumer<BuildCompletion> completionListener;

    void register(long id, CompletableFuture<RpcMessage> reply) {
        pending.put(id, reply);
    }

    void fail(long id, Throwable cause) {
        CompletableFuture<RpcMessage> reply = pending.remove(id);
        if (reply != null) {
            reply.completeExceptionally(cause);
        }
    }

    void onCompletion(Consumer<BuildCompletion> listener) {
        this.completionListener = listener;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RpcMessage msg) {
        if (msg instanceof RpcMessage.BuildFinished finished) {
            Consumer<BuildCompletion> l = completionListener;
            if (l == null) {
                log.debug("Dropping build result without listener buildsetId={} builder={}",
                        finished.buildsetId(), finished.builderName());
                return;
            }
            l.accept(new BuildCompletion(
                    finished.builderName(), finished.buildNumber(), finished.result(), finished.detail()));
            return;
        }

        CompletableFuture<RpcMessage> reply = pending.remove(msg.id());
        if (reply == null) {
            log.warn("Reply without pending request id={} type={}", msg.id(), msg.getClass().getSimpleName());
            return;
        }
        if (msg instanceof RpcMessage.Failure failure) {
            reply.completeExceptionally(toException(failure));
        } else {
            reply.complete(msg);
        }
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        failAll(new TransportException("connection to " + ctx.channel().remoteAddress() + " closed"));
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Try connection error remote={} msg={}", ctx.channel().remoteAddress(), cause.getMessage(), cause);
        failAll(new TransportException("connection error: " + cause.getMessage(), cause));
        ctx.close();
    }

    private void failAll(TryJobException cause) {
        for (Long id : List.copyOf(pending.keySet())) {
            fail(id, cause);
        }
    }

    static TryJobException toException(RpcMessage.Failure failure) {
        String message = failure.message();
        RpcMessage.FailureKind kind = failure.kind() == null ? RpcMessage.FailureKind.INTERNAL : failure.kind();
        switch (kind) {
            case AUTHENTICATION:
                return new AuthenticationException(message);
            case UNKNOWN_BUILDER:
                return new UnknownBuilderException(message, List.of());
            case MALFORMED_JOB:
                return new MalformedJobException(message);
            default:
                return new TransportException(kind.name().toLowerCase(Locale.ROOT) + ": " + message);
        }
    }
}
