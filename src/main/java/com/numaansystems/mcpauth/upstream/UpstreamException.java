package com.numaansystems.mcpauth.upstream;

/**
 * A call to the upstream identity provider or REST API failed or returned an unusable response.
 */
public class UpstreamException extends Exception {

    private final int status;

    public UpstreamException(String message) {
        this(message, 0, null);
    }

    public UpstreamException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public UpstreamException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /** HTTP status returned upstream, or 0 when no response was received. */
    public int getStatus() {
        return status;
    }

    public boolean isUnauthorized() {
        return status == 401;
    }
}
