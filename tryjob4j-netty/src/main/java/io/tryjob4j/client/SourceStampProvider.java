package io.tryjob4j.client;

import io.tryjob4j.core.SourceStamp;

/**
 * Describes the local change a try job should build: base revision, branch and patch.
 */
@FunctionalInterface
public interface SourceStampProvider {

    SourceStamp getSourceStamp();
}
