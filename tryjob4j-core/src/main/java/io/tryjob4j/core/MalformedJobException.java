package io.tryjob4j.core;

/**
 * An encoded job could not be decoded into a {@link Job}.
 */
public class MalformedJobException extends TryJobException {

    public MalformedJobException(String message) {
        super(message);
    }

    public MalformedJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
