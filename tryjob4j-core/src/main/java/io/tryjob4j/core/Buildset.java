package io.tryjob4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Server-side record grouping the per-builder build requests of a single job submission.
 */
public record Buildset(
        String id,
        String schedulerName,
        SourceStamp sourceStamp,
        List<String> builderNames,
        String reason,
        String comment,
        String who,
        String externalJobId,
        Map<String, String> properties,
        Instant submittedAt
) {

    public static Buildset from(String id, BuildsetRequest request, Instant submittedAt) {
        return new Buildset(
                id,
                request.schedulerName(),
                request.sourceStamp(),
                request.builderNames(),
                request.reason(),
                request.comment(),
                request.who(),
                request.externalJobId(),
                request.properties(),
                submittedAt
        );
    }
}
