package io.tryjob4j.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.channel.EventLoopGroup;
import io.tryjob4j.core.Job;
import io.tryjob4j.core.JobCodec;
import io.tryjob4j.core.TransportException;
import io.tryjob4j.internal.mailbox.MailboxTransport;
import io.tryjob4j.internal.netty.RpcMessage;
import io.tryjob4j.internal.netty.TryRpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;

/**
 * One try run: build a job from the local change, deliver it, optionally wait for the builds.
 *
 * <p>Progress is reported line by line to the output consumer, in a fixed order:
 * <pre>
 * using 'pb' connect method
 * job created
 * Delivering job; comment= None
 * job has been delivered
 * not waiting for builds to finish
 * </pre>
 * The returned future fails on connectivity, authentication or validation errors; nothing is
 * retried.
 */
public class TryClient {
    private static final Logger log = LoggerFactory.getLogger(TryClient.class);

    static final String BUILDERS_HEADER = "The following builders are available for the try scheduler: ";

    private final DeliveryConfig config;
    private final SourceStampProvider sourceStampProvider;
    private final EventLoopGroup group;
    private final ObjectMapper objectMapper;
    private final JobCodec jobCodec;
    private final Consumer<String> output;

    public TryClient(DeliveryConfig config,
                     SourceStampProvider sourceStampProvider,
                     EventLoopGroup group,
                     ObjectMapper objectMapper,
                     Consumer<String> output) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.sourceStampProvider = Objects.requireNonNull(sourceStampProvider, "sourceStampProvider must not be null");
        this.group = Objects.requireNonNull(group, "group must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.jobCodec = new JobCodec(objectMapper);
        this.output = Objects.requireNonNull(output, "output must not be null");
    }

    public CompletableFuture<Void> run() {
        ConnectMethod method = config.connectMethod();
        output.accept("using '" + method.label() + "' connect method");

        if (config.isGetBuilderNames()) {
            if (method != ConnectMethod.PB) {
                return CompletableFuture.failedFuture(
                        new TryClientException("listing builders requires the pb connect method"));
            }
            return listBuilders();
        }

        Job job;
        try {
            job = createJob();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        output.accept("job created");
        log.debug("Try job created jobId={} builders={} method={}", job.jobId(), job.builderNames(), method.label());

        return method == ConnectMethod.PB ? deliverOverNetwork(job) : deliverToMailbox(job);
    }

    Job createJob() {
        return Job.builder()
                .sourceStamp(sourceStampProvider.getSourceStamp())
                .builderNames(config.builders())
                .who(config.who())
                .comment(config.comment())
                .properties(config.properties())
                .build();
    }

    private CompletableFuture<Void> listBuilders() {
        return connectAndLogin().thenCompose(client -> client.listBuilders()
                .thenAccept(names -> {
                    output.accept(BUILDERS_HEADER);
                    names.forEach(output);
                })
                .whenComplete((v, e) -> client.close()));
    }

    private CompletableFuture<Void> deliverToMailbox(Job job) {
        MailboxTransport mailbox = new MailboxTransport(config.jobdir(), jobCodec);
        return CompletableFuture.runAsync(() -> {
            mailbox.ensureLayout();
            mailbox.deliver(job);
        }, group).thenRun(() -> {
            output.accept("job has been delivered");
            if (config.isWait()) {
                output.accept("waiting for builds with " + ConnectMethod.SSH.label() + " is not supported");
            } else {
                output.accept("not waiting for builds to finish");
            }
        });
    }

    private CompletableFuture<Void> deliverOverNetwork(Job job) {
        String encoded = jobCodec.encodeToString(job);
        return connectAndLogin().thenCompose(client -> {
            output.accept("Delivering job; comment= " + (job.comment() == null ? "None" : job.comment()));
            return client.submitJob(encoded)
                    .thenCompose(accepted -> {
                        output.accept("job has been delivered");
                        log.info("Try job delivered jobId={} buildsetId={} builders={}",
                                job.jobId(), accepted.buildsetId(), accepted.builderNames());
                        if (!config.isWait()) {
                            output.accept("not waiting for builds to finish");
                            return CompletableFuture.<Void>completedFuture(null);
                        }
                        return waitForBuilds(client, accepted);
                    })
                    .whenComplete((v, e) -> client.close());
        });
    }

    private CompletableFuture<Void> waitForBuilds(TryRpcClient client, RpcMessage.JobAccepted accepted) {
        CompletionWaiter waiter = new CompletionWaiter(group, config.waitCheckInterval(), config.waitTimeout());
        // reconnecting is not attempted; a dropped session ends the wait
        client.closeFuture().thenRun(() -> waiter.abort(
                new TransportException("connection closed while waiting for buildset " + accepted.buildsetId())));

        return client.subscribe(accepted.buildsetId(), waiter)
                .thenCompose(subscribed -> {
                    List<String> builders = subscribed.builderNames().isEmpty()
                            ? accepted.builderNames()
                            : subscribed.builderNames();
                    return waiter.await(builders);
                })
                .thenAccept(lines -> lines.forEach(output));
    }

    private CompletableFuture<TryRpcClient> connectAndLogin() {
        return TryRpcClient.connect(group, config.masterHost(), config.masterPort(), objectMapper)
                .thenCompose(client -> client.login(config.username(), config.password())
                        .handle((ok, e) -> {
                            if (e != null) {
                                client.close();
                                throw unwrap(e);
                            }
                            return client;
                        }));
    }

    private static RuntimeException unwrap(Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new TransportException(cause.getMessage(), cause);
    }
}
