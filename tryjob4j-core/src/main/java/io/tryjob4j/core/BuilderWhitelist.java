package io.tryjob4j.core;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The set of builders a scheduler is allowed to start.
 */
public final class BuilderWhitelist {

    private final List<String> builderNames;
    private final Set<String> lookup;

    public BuilderWhitelist(List<String> builderNames) {
        Objects.requireNonNull(builderNames, "builderNames must not be null");
        this.lookup = new LinkedHashSet<>(builderNames);
        if (lookup.size() != builderNames.size()) {
            throw new IllegalArgumentException("builderNames must not contain duplicates: " + builderNames);
        }
        this.builderNames = List.copyOf(builderNames);
    }

    public List<String> names() {
        return builderNames;
    }

    /**
     * Resolves the builders a job will run on.
     *
     * <p>An empty request selects every whitelisted builder. Any name outside the whitelist
     * rejects the whole request.
     *
     * @throws UnknownBuilderException when a requested name is not whitelisted, or when
     *                                 the resolved list would be empty
     */
    public List<String> resolve(List<String> requested) {
        if (requested == null || requested.isEmpty()) {
            if (builderNames.isEmpty()) {
                throw new UnknownBuilderException("no builders are configured for this scheduler", List.of());
            }
            return builderNames;
        }

        List<String> unknown = new ArrayList<>();
        for (String name : requested) {
            if (!lookup.contains(name)) {
                unknown.add(name);
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownBuilderException("unknown builders requested: " + unknown, unknown);
        }
        return List.copyOf(requested);
    }
}
