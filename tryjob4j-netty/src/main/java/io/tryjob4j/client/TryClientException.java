package io.tryjob4j.client;

import io.tryjob4j.core.TryJobException;

/**
 * The client configuration does not allow the requested run.
 */
public class TryClientException extends TryJobException {

    public TryClientException(String message) {
        super(message);
    }
}
