package io.tryjob4j.core;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a scheduler hands to the {@link io.tryjob4j.BuildsetStore} to create one buildset.
 */
public record BuildsetRequest(
        String schedulerName,
        SourceStamp sourceStamp,
        List<String> builderNames,
        String reason,
        String comment,
        String who,
        String externalJobId,
        Map<String, String> properties
) {

    public BuildsetRequest {
        Objects.requireNonNull(schedulerName, "schedulerName must not be null");
        Objects.requireNonNull(sourceStamp, "sourceStamp must not be null");
        Objects.requireNonNull(builderNames, "builderNames must not be null");
        if (builderNames.isEmpty()) {
            throw new IllegalArgumentException("builderNames must not be empty");
        }
        builderNames = List.copyOf(builderNames);
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    /**
     * Request for a try job. The reason reads {@code 'try' job by user <who>}, or {@code 'try' job}
     * when nobody is known.
     */
    public static BuildsetRequest forJob(String schedulerName, Job job, List<String> builderNames, String who) {
        String reason = who == null ? "'try' job" : "'try' job by user " + who;
        return new BuildsetRequest(
                schedulerName,
                job.sourceStamp(),
                builderNames,
                reason,
                job.comment(),
                who,
                job.jobId(),
                job.properties()
        );
    }
}
