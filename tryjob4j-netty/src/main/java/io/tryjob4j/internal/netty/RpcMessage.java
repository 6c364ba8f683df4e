package io.tryjob4j.internal.netty;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.tryjob4j.core.BuildResult;

import java.util.List;

/**
 * Frames exchanged between a try client and a userpass scheduler, one JSON object per line.
 *
 * <p>Requests carry an {@code id} echoed by the matching reply. {@link BuildFinished} is pushed by
 * the server and has no request id.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RpcMessage.Login.class, name = "login"),
        @JsonSubTypes.Type(value = RpcMessage.SubmitJob.class, name = "submit-job"),
        @JsonSubTypes.Type(value = RpcMessage.ListBuilders.class, name = "list-builders"),
        @JsonSubTypes.Type(value = RpcMessage.Subscribe.class, name = "subscribe"),
        @JsonSubTypes.Type(value = RpcMessage.LoginAccepted.class, name = "login-accepted"),
        @JsonSubTypes.Type(value = RpcMessage.JobAccepted.class, name = "job-accepted"),
        @JsonSubTypes.Type(value = RpcMessage.BuilderList.class, name = "builder-list"),
        @JsonSubTypes.Type(value = RpcMessage.Subscribed.class, name = "subscribed"),
        @JsonSubTypes.Type(value = RpcMessage.Failure.class, name = "failure"),
        @JsonSubTypes.Type(value = RpcMessage.BuildFinished.class, name = "build-finished")
})
public interface RpcMessage {

    /**
     * Request/reply correlation id; 0 for pushed notifications.
     */
    long id();

    record Login(long id, String username, String password) implements RpcMessage {
        @Override
        public String toString() {
            return "Login[id=" + id + ", username=" + username + "]";
        }
    }

    record SubmitJob(long id, String encodedJob) implements RpcMessage {
    }

    record ListBuilders(long id) implements RpcMessage {
    }

    record Subscribe(long id, String buildsetId) implements RpcMessage {
    }

    record LoginAccepted(long id, String username) implements RpcMessage {
    }

    record JobAccepted(long id, String buildsetId, List<String> builderNames) implements RpcMessage {
    }

    record BuilderList(long id, List<String> builderNames) implements RpcMessage {
    }

    record Subscribed(long id, String buildsetId, List<String> builderNames) implements RpcMessage {
    }

    record Failure(long id, FailureKind kind, String message) implements RpcMessage {
    }

    record BuildFinished(long id,
                         String buildsetId,
                         String builderName,
                         int buildNumber,
                         BuildResult result,
                         String detail) implements RpcMessage {
    }

    enum FailureKind {
        AUTHENTICATION,
        UNKNOWN_BUILDER,
        MALFORMED_JOB,
        PROTOCOL,
        UNSUPPORTED,
        INTERNAL
    }
}
