package com.numaansystems.mcpauth.dns;

import java.net.InetAddress;
import java.util.List;

/**
 * Resolves hostnames for redirect and upstream validation.
 *
 * <p>Implementations must not consult the host machine's resolver configuration.</p>
 */
public interface DnsResolver {

    /**
     * @return every address the host resolves to, never empty
     * @throws DnsResolutionException if the host does not resolve within the configured timeout
     */
    List<InetAddress> resolve(String host) throws DnsResolutionException;
}
