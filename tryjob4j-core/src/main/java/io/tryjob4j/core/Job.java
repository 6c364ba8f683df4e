package io.tryjob4j.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Immutable unit of work submitted by a try client.
 *
 * <p>A job always carries a {@link SourceStamp}. An empty {@code builderNames} list means
 * "every builder the receiving scheduler knows about"; the scheduler resolves it.
 */
public record Job(
        String jobId,
        SourceStamp sourceStamp,
        List<String> builderNames,
        String who,
        String comment,
        Map<String, String> properties
) {

    public Job {
        Objects.requireNonNull(jobId, "jobId must not be null");
        if (jobId.isBlank()) {
            throw new IllegalArgumentException("jobId must not be blank");
        }
        Objects.requireNonNull(sourceStamp, "sourceStamp must not be null");

        List<String> names = builderNames == null ? List.of() : List.copyOf(builderNames);
        if (new LinkedHashSet<>(names).size() != names.size()) {
            throw new IllegalArgumentException("builderNames must not contain duplicates: " + names);
        }
        for (String name : names) {
            if (name.isBlank()) {
                throw new IllegalArgumentException("builderNames must not contain blank values");
            }
        }
        builderNames = names;

        properties = (properties == null || properties.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(properties));
    }

    public String branch() {
        return sourceStamp.branch();
    }

    public String revision() {
        return sourceStamp.revision();
    }

    public Patch patch() {
        return sourceStamp.patch();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static String newJobId() {
        return System.currentTimeMillis() + "-" + UUID.randomUUID();
    }

    public static final class Builder {
        private String jobId;
        private SourceStamp sourceStamp;
        private final List<String> builderNames = new ArrayList<>();
        private String who;
        private String comment;
        private final Map<String, String> properties = new TreeMap<>();

        private Builder() {
        }

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder sourceStamp(SourceStamp sourceStamp) {
            this.sourceStamp = sourceStamp;
            return this;
        }

        public Builder builderNames(List<String> builderNames) {
            this.builderNames.clear();
            if (builderNames != null) {
                this.builderNames.addAll(builderNames);
            }
            return this;
        }

        public Builder builderName(String builderName) {
            this.builderNames.add(Objects.requireNonNull(builderName, "builderName must not be null"));
            return this;
        }

        public Builder who(String who) {
            this.who = who;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder properties(Map<String, String> properties) {
            this.properties.clear();
            if (properties != null) {
                this.properties.putAll(properties);
            }
            return this;
        }

        public Builder property(String key, String value) {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(value, "value must not be null");
            this.properties.put(key, value);
            return this;
        }

        public Job build() {
            String id = (jobId == null || jobId.isBlank()) ? newJobId() : jobId;
            return new Job(id, sourceStamp, builderNames, who, comment, properties);
        }
    }
}
