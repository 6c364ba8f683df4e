package io.tryjob4j.core;

/**
 * Connectivity failure between a try client and a scheduler. Not retried.
 */
public class TransportException extends TryJobException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
