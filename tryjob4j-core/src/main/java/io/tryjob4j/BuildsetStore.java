package io.tryjob4j;

import io.tryjob4j.core.Buildset;
import io.tryjob4j.core.BuildsetRequest;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for buildsets. Implementations serialize concurrent creation themselves.
 */
public interface BuildsetStore {

    String createBuildset(BuildsetRequest request);

    Optional<Buildset> getBuildset(String buildsetId);

    List<Buildset> getBuildsets();
}
