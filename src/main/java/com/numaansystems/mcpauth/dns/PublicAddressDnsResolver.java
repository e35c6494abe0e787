package com.numaansystems.mcpauth.dns;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * HttpClient connection resolver backed by {@link PublicHostVerifier}.
 *
 * <p>Upstream connections use the same pinned lookup the authorize and callback checks
 * use, and only ever receive addresses that passed the public-address check. A host
 * that rebinds to a private address between the check and the connect fails here.</p>
 */
public class PublicAddressDnsResolver implements org.apache.hc.client5.http.DnsResolver {

    private final PublicHostVerifier verifier;

    public PublicAddressDnsResolver(PublicHostVerifier verifier) {
        this.verifier = verifier;
    }

    @Override
    public InetAddress[] resolve(String host) throws UnknownHostException {
        try {
            return verifier.resolvePublic(host).toArray(new InetAddress[0]);
        } catch (DnsResolutionException e) {
            UnknownHostException unknown = new UnknownHostException(e.getMessage());
            unknown.initCause(e);
            throw unknown;
        }
    }

    /**
     * The upstream is addressed by name only; no reverse lookup is made.
     */
    @Override
    public String resolveCanonicalHostname(String host) throws UnknownHostException {
        resolve(host);
        return host;
    }
}
