package io.tryjob4j.core;

import java.util.Objects;

/**
 * Source identity of a try job: base revision on a branch, plus an optional patch on top of it.
 */
public record SourceStamp(
        String branch,
        String revision,
        Patch patch,
        String repository,
        String project
) {

    public SourceStamp {
        Objects.requireNonNull(revision, "revision must not be null");
    }

    public static SourceStamp of(String branch, String revision, Patch patch) {
        return new SourceStamp(branch, revision, patch, null, null);
    }

    public boolean hasPatch() {
        return patch != null;
    }
}
