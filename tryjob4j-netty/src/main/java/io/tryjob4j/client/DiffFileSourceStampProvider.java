package io.tryjob4j.client;

import io.tryjob4j.core.Patch;
import io.tryjob4j.core.SourceStamp;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Source stamp read from a prepared unified diff, applied on top of a known base revision.
 * An empty diff file builds the revision as-is.
 */
public class DiffFileSourceStampProvider implements SourceStampProvider {

    private final String branch;
    private final String baseRevision;
    private final Path diffFile;
    private final int patchLevel;

    public DiffFileSourceStampProvider(String branch, String baseRevision, Path diffFile, int patchLevel) {
        this.branch = branch;
        this.baseRevision = Objects.requireNonNull(baseRevision, "baseRevision must not be null");
        this.diffFile = Objects.requireNonNull(diffFile, "diffFile must not be null");
        if (patchLevel < 0) {
            throw new IllegalArgumentException("patchLevel must not be negative");
        }
        this.patchLevel = patchLevel;
    }

    @Override
    public SourceStamp getSourceStamp() {
        String diff;
        try {
            diff = Files.readString(diffFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read diff " + diffFile, e);
        }
        Patch patch = diff.isEmpty() ? null : new Patch(patchLevel, diff);
        return SourceStamp.of(branch, baseRevision, patch);
    }
}
