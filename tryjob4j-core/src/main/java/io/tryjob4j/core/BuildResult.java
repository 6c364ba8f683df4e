package io.tryjob4j.core;

import java.util.Locale;

public enum BuildResult {

    PENDING(false),
    RUNNING(false),
    SUCCESS(true),
    FAILURE(true),
    EXCEPTION(true);

    private final boolean terminal;

    BuildResult(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Lower-case form used in client summaries, e.g. {@code success}.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
