package com.numaansystems.mcpauth.dns;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioDatagramChannel;
import io.netty.resolver.HostsFileEntriesResolver;
import io.netty.resolver.ResolvedAddressTypes;
import io.netty.resolver.dns.DnsNameResolver;
import io.netty.resolver.dns.DnsNameResolverBuilder;
import io.netty.resolver.dns.SequentialDnsServerAddressStreamProvider;
import io.netty.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link DnsResolver} that queries a fixed list of public DNS servers over UDP.
 *
 * <p>The hosts file, {@code resolv.conf} name servers and search domains of the machine
 * are all bypassed, so a local resolver cannot steer validation toward internal
 * addresses.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class PinnedDnsResolver implements DnsResolver, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PinnedDnsResolver.class);

    private static final int DNS_PORT = 53;

    private final EventLoopGroup eventLoopGroup;
    private final DnsNameResolver resolver;
    private final Duration timeout;

    public PinnedDnsResolver(List<String> servers, Duration timeout) {
        if (servers == null || servers.isEmpty()) {
            throw new IllegalArgumentException("At least one DNS server is required");
        }
        List<InetSocketAddress> nameServers = new ArrayList<>();
        for (String server : servers) {
            nameServers.add(new InetSocketAddress(server.trim(), DNS_PORT));
        }

        this.timeout = timeout;
        this.eventLoopGroup = new NioEventLoopGroup(1);
        this.resolver = new DnsNameResolverBuilder(eventLoopGroup.next())
                .channelType(NioDatagramChannel.class)
                .nameServerProvider(new SequentialDnsServerAddressStreamProvider(nameServers))
                .hostsFileEntriesResolver(new IgnoringHostsFileEntriesResolver())
                .searchDomains(Collections.emptyList())
                .ndots(1)
                .queryTimeoutMillis(timeout.toMillis())
                .resolvedAddressTypes(ResolvedAddressTypes.IPV4_PREFERRED)
                .build();

        logger.info("Pinned DNS resolver using {} (timeout {} ms)", servers, timeout.toMillis());
    }

    @Override
    public List<InetAddress> resolve(String host) throws DnsResolutionException {
        if (host == null || host.isBlank()) {
            throw new DnsResolutionException(host, "Host is empty");
        }

        Future<List<InetAddress>> lookup = resolver.resolveAll(host);
        try {
            List<InetAddress> addresses = lookup.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (addresses == null || addresses.isEmpty()) {
                throw new DnsResolutionException(host, "No addresses found for " + host);
            }
            return addresses;
        } catch (TimeoutException e) {
            lookup.cancel(true);
            throw new DnsResolutionException(host, "DNS lookup timed out for " + host, e);
        } catch (ExecutionException e) {
            throw new DnsResolutionException(host, "DNS lookup failed for " + host, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DnsResolutionException(host, "DNS lookup interrupted for " + host, e);
        }
    }

    @Override
    public void close() {
        resolver.close();
        eventLoopGroup.shutdownGracefully(0, 1, TimeUnit.SECONDS);
        logger.info("Pinned DNS resolver closed");
    }

    private static final class IgnoringHostsFileEntriesResolver implements HostsFileEntriesResolver {
        @Override
        public InetAddress address(String inetHost, ResolvedAddressTypes resolvedAddressTypes) {
            return null;
        }
    }
}
