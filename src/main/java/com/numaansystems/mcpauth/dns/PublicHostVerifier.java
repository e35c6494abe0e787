package com.numaansystems.mcpauth.dns;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.util.List;

/**
 * Accepts a host only when every address it resolves to is publicly routable.
 *
 * <p>Rejects loopback, wildcard, link-local, site-local (RFC 1918), carrier-grade NAT
 * ({@code 100.64.0.0/10}), IPv6 unique-local ({@code fc00::/7}) and multicast
 * addresses. A single non-public address fails the whole host.</p>
 */
public class PublicHostVerifier {

    private static final Logger logger = LoggerFactory.getLogger(PublicHostVerifier.class);

    private final DnsResolver resolver;

    public PublicHostVerifier(DnsResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * @throws DnsResolutionException if the host does not resolve or any address is not public
     */
    public void verify(String host) throws DnsResolutionException {
        resolvePublic(host);
    }

    /**
     * Resolves the host and returns its addresses only when every one of them is public.
     *
     * @throws DnsResolutionException if the host does not resolve or any address is not public
     */
    public List<InetAddress> resolvePublic(String host) throws DnsResolutionException {
        List<InetAddress> addresses = resolver.resolve(host);
        for (InetAddress address : addresses) {
            if (!isPublic(address)) {
                logger.warn("Host {} resolves to non-public address {}", host, address.getHostAddress());
                throw new DnsResolutionException(host, "Host " + host + " resolves to a non-public address");
            }
        }
        logger.debug("Host {} verified against {} public address(es)", host, addresses.size());
        return addresses;
    }

    public static boolean isPublic(InetAddress address) {
        if (address.isLoopbackAddress()
                || address.isAnyLocalAddress()
                || address.isLinkLocalAddress()
                || address.isSiteLocalAddress()
                || address.isMulticastAddress()) {
            return false;
        }
        byte[] bytes = address.getAddress();
        if (address instanceof Inet4Address) {
            int first = bytes[0] & 0xff;
            int second = bytes[1] & 0xff;
            // 0.0.0.0/8 and 100.64.0.0/10
            return first != 0 && !(first == 100 && second >= 64 && second <= 127);
        }
        if (address instanceof Inet6Address) {
            return (bytes[0] & 0xfe) != 0xfc;
        }
        return true;
    }
}
