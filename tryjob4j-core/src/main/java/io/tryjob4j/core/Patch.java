package io.tryjob4j.core;

import java.util.Objects;

/**
 * A unified diff together with the strip level ({@code patch -p<level>}) needed to apply it.
 */
public record Patch(int level, String body) {

    public Patch {
        if (level < 0) {
            throw new IllegalArgumentException("patch level must not be negative: " + level);
        }
        Objects.requireNonNull(body, "patch body must not be null");
    }
}
