package com.arqsz.skillsense.validation;

/**
 * Failure of the external validation boundary. Never retried; the enclosing
 * analysis decides whether it aborts.
 */
public class ValidationException extends Exception {

    public enum Kind {
        /** Connection failure, missing credentials, interrupted call */
        TRANSPORT,
        /** No response within the configured timeout */
        TIMEOUT,
        /** Non-2xx response */
        HTTP_STATUS,
        /** Envelope or payload is not parseable JSON */
        PARSE,
        /** Payload parsed but violates the response schema */
        SCHEMA
    }

    private final Kind kind;

    public ValidationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
