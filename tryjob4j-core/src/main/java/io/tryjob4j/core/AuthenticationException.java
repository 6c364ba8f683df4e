package io.tryjob4j.core;

public class AuthenticationException extends TryJobException {

    public AuthenticationException(String message) {
        super(message);
    }
}
