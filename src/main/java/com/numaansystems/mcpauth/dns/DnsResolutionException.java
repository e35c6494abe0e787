package com.numaansystems.mcpauth.dns;

/**
 * A host could not be resolved, or resolved to an address this server refuses to trust.
 */
public class DnsResolutionException extends Exception {

    private final String host;

    public DnsResolutionException(String host, String message) {
        super(message);
        this.host = host;
    }

    public DnsResolutionException(String host, String message, Throwable cause) {
        super(message, cause);
        this.host = host;
    }

    public String getHost() {
        return host;
    }
}
