package io.tryjob4j.internal.netty;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.tryjob4j.BuildStatusFeed;
import io.tryjob4j.core.Buildset;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.MalformedJobException;
import io.tryjob4j.core.UnknownBuilderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Server side of one client connection. Not shared: a new instance is created per channel.
 */
class UserpassSessionHandler extends SimpleChannelInboundHandler<RpcMessage> {
    private static final Logger log = LoggerFactory.getLogger(UserpassSessionHandler.class);

    private final UserpassScheduler scheduler;

    private String username;
    private String buildsetId;
    private BuildStatusFeed.Subscription subscription;

    UserpassSessionHandler(UserpassScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, RpcMessage msg) {
        if (msg instanceof RpcMessage.Login login) {
            handleLogin(ctx, login);
            return;
        }
        if (username == null) {
            log.warn("Userpass request before login scheduler={} remote={} type={}",
                    scheduler.name(), ctx.channel().remoteAddress(), msg.getClass().getSimpleName());
            rejectAndClose(ctx, msg.id(), "login required");
            return;
        }

        if (msg instanceof RpcMessage.SubmitJob submit) {
            handleSubmit(ctx, submit);
        } else if (msg instanceof RpcMessage.ListBuilders list) {
            ctx.writeAndFlush(new RpcMessage.BuilderList(list.id(), scheduler.builderNames()));
        } else if (msg instanceof RpcMessage.Subscribe subscribe) {
            handleSubscribe(ctx, subscribe);
        } else {
            fail(ctx, msg.id(), RpcMessage.FailureKind.PROTOCOL,
                    "unexpected message: " + msg.getClass().getSimpleName());
        }
    }

    private void handleLogin(ChannelHandlerContext ctx, RpcMessage.Login login) {
        if (username != null) {
            fail(ctx, login.id(), RpcMessage.FailureKind.PROTOCOL, "already logged in");
            return;
        }
        if (!scheduler.authenticate(login.username(), login.password())) {
            log.warn("Userpass login rejected scheduler={} remote={} username={}",
                    scheduler.name(), ctx.channel().remoteAddress(), login.username());
            rejectAndClose(ctx, login.id(), "invalid username or password");
            return;
        }
        username = login.username();
        scheduler.sessions().add(ctx.channel());
        log.debug("Userpass login scheduler={} remote={} username={}",
                scheduler.name(), ctx.channel().remoteAddress(), username);
        ctx.writeAndFlush(new RpcMessage.LoginAccepted(login.id(), username));
    }

    private void handleSubmit(ChannelHandlerContext ctx, RpcMessage.SubmitJob submit) {
        if (buildsetId != null) {
            fail(ctx, submit.id(), RpcMessage.FailureKind.PROTOCOL, "a job was already submitted on this connection");
            return;
        }
        if (submit.encodedJob() == null) {
            fail(ctx, submit.id(), RpcMessage.FailureKind.MALFORMED_JOB, "encodedJob is required");
            return;
        }

        Job job;
        try {
            job = scheduler.jobCodec().decode(submit.encodedJob());
        } catch (MalformedJobException e) {
            log.warn("Userpass malformed job scheduler={} username={} msg={}", scheduler.name(), username, e.getMessage());
            fail(ctx, submit.id(), RpcMessage.FailureKind.MALFORMED_JOB, e.getMessage());
            return;
        }

        String created;
        try {
            created = scheduler.ingest(job, username);
        } catch (UnknownBuilderException e) {
            log.warn("Userpass job rejected scheduler={} username={} jobId={} unknownBuilders={}",
                    scheduler.name(), username, job.jobId(), e.getUnknownBuilders());
            fail(ctx, submit.id(), RpcMessage.FailureKind.UNKNOWN_BUILDER, e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Userpass job failed scheduler={} username={} jobId={} msg={}",
                    scheduler.name(), username, job.jobId(), e.getMessage(), e);
            fail(ctx, submit.id(), RpcMessage.FailureKind.INTERNAL, "failed to create buildset");
            return;
        }

        buildsetId = created;
        List<String> builders = scheduler.store().getBuildset(created)
                .map(Buildset::builderNames)
                .orElse(job.builderNames());
        log.info("Userpass job accepted scheduler={} username={} jobId={} buildsetId={}",
                scheduler.name(), username, job.jobId(), created);
        ctx.writeAndFlush(new RpcMessage.JobAccepted(submit.id(), created, builders));
    }

    private void handleSubscribe(ChannelHandlerContext ctx, RpcMessage.Subscribe subscribe) {
        BuildStatusFeed feed = scheduler.feed();
        if (feed == null) {
            fail(ctx, subscribe.id(), RpcMessage.FailureKind.UNSUPPORTED, "this scheduler does not report build results");
            return;
        }
        if (buildsetId == null || !buildsetId.equals(subscribe.buildsetId())) {
            fail(ctx, subscribe.id(), RpcMessage.FailureKind.PROTOCOL,
                    "can only subscribe to the buildset submitted on this connection");
            return;
        }
        if (subscription != null) {
            fail(ctx, subscribe.id(), RpcMessage.FailureKind.PROTOCOL, "already subscribed");
            return;
        }

        List<String> builders = scheduler.store().getBuildset(buildsetId)
                .map(Buildset::builderNames)
                .orElse(List.of());
        ctx.writeAndFlush(new RpcMessage.Subscribed(subscribe.id(), buildsetId, builders));

        String bs = buildsetId;
        subscription = feed.subscribe(bs, c -> {
            if (ctx.channel().isActive()) {
                ctx.writeAndFlush(new RpcMessage.BuildFinished(
                        0, bs, c.builderName(), c.buildNumber(), c.result(), c.detail()));
            }
        });
        log.debug("Userpass subscribed scheduler={} username={} buildsetId={}", scheduler.name(), username, bs);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        scheduler.connections().add(ctx.channel());
        super.channelActive(ctx);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        BuildStatusFeed.Subscription s = subscription;
        if (s != null) {
            subscription = null;
            s.cancel();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.warn("Userpass session error scheduler={} remote={} username={} msg={}",
                scheduler.name(), ctx.channel().remoteAddress(), username, cause.getMessage(), cause);
        ctx.close();
    }

    private void rejectAndClose(ChannelHandlerContext ctx, long id, String message) {
        ctx.writeAndFlush(new RpcMessage.Failure(id, RpcMessage.FailureKind.AUTHENTICATION, message))
                .addListener(ChannelFutureListener.CLOSE);
    }

    private static void fail(ChannelHandlerContext ctx, long id, RpcMessage.FailureKind kind, String message) {
        ctx.writeAndFlush(new RpcMessage.Failure(id, kind, message));
    }
}
