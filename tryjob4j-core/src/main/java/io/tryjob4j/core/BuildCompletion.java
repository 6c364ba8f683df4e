package io.tryjob4j.core;

import java.util.Objects;

/**
 * Status of one build spawned from a buildset, as reported by the build engine.
 */
public record BuildCompletion(
        String builderName,
        int buildNumber,
        BuildResult result,
        String detail
) {

    public BuildCompletion {
        Objects.requireNonNull(builderName, "builderName must not be null");
        Objects.requireNonNull(result, "result must not be null");
    }

    public boolean isTerminal() {
        return result.isTerminal();
    }

    /**
     * Renders {@code <builder>: <result> (<detail>)}.
     */
    public String summaryLine() {
        String text = (detail == null || detail.isBlank()) ? result.label() : detail;
        return builderName + ": " + result.label() + " (" + text + ")";
    }
}
