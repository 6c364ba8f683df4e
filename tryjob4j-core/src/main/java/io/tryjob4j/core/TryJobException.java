package io.tryjob4j.core;

/**
 * Base type of every failure raised by the try job pipeline.
 */
public class TryJobException extends RuntimeException {

    public TryJobException(String message) {
        super(message);
    }

    public TryJobException(String message, Throwable cause) {
        super(message, cause);
    }
}
