package com.lbg.markets.surveillance.discovery.protocol;

/**
 * Failure of a remote listing call, classified by how the orchestrator must react.
 */
public class ProtocolException extends Exception {

    public enum Kind {
        /** Credentials rejected. Not retried. */
        AUTHENTICATION_FAILED,
        /** Path does not exist yet. Treated as an empty listing. */
        NOT_FOUND,
        /** Transient; retried with backoff. */
        NETWORK_ERROR,
        /** Unexpected or malformed response. Not retried. */
        PROTOCOL_ERROR
    }

    private final Kind kind;

    public ProtocolException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProtocolException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isRetryable() {
        return kind == Kind.NETWORK_ERROR;
    }

    public static ProtocolException authentication(String message) {
        return new ProtocolException(Kind.AUTHENTICATION_FAILED, message);
    }

    public static ProtocolException notFound(String message) {
        return new ProtocolException(Kind.NOT_FOUND, message);
    }

    public static ProtocolException network(String message, Throwable cause) {
        return new ProtocolException(Kind.NETWORK_ERROR, message, cause);
    }

    public static ProtocolException protocol(String message, Throwable cause) {
        return new ProtocolException(Kind.PROTOCOL_ERROR, message, cause);
    }
}
