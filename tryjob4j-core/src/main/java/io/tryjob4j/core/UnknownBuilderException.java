package io.tryjob4j.core;

import java.util.List;

/**
 * A job asked for builders the scheduler does not offer.
 */
public class UnknownBuilderException extends TryJobException {

    private final List<String> unknownBuilders;

    public UnknownBuilderException(String message, List<String> unknownBuilders) {
        super(message);
        this.unknownBuilders = unknownBuilders == null ? List.of() : List.copyOf(unknownBuilders);
    }

    public List<String> getUnknownBuilders() {
        return unknownBuilders;
    }
}
