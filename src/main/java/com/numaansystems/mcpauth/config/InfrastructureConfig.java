package com.numaansystems.mcpauth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.numaansystems.mcpauth.dns.DnsResolver;
import com.numaansystems.mcpauth.dns.PinnedDnsResolver;
import com.numaansystems.mcpauth.dns.PublicAddressDnsResolver;
import com.numaansystems.mcpauth.dns.PublicHostVerifier;
import com.numaansystems.mcpauth.upstream.TableauOAuthClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Clock, pinned DNS and upstream HTTP beans. Each is a seam tests replace with
 * {@code @MockBean} or a fixed clock.
 */
@Configuration
public class InfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PinnedDnsResolver dnsResolver(OAuthSettings settings) {
        return new PinnedDnsResolver(settings.getDnsServers(), settings.getDnsTimeout());
    }

    @Bean
    public PublicHostVerifier publicHostVerifier(DnsResolver dnsResolver) {
        return new PublicHostVerifier(dnsResolver);
    }

    /**
     * Shared pooled client for upstream calls; connect and response are both bounded by
     * {@code mcp.oauth.upstream-timeout-ms}. Redirects are not followed. Connections
     * resolve through pinned DNS and only to public addresses.
     */
    @Bean
    public CloseableHttpClient upstreamHttpClient(OAuthSettings settings, PublicHostVerifier publicHostVerifier) {
        Timeout timeout = Timeout.ofMilliseconds(settings.getUpstreamTimeout().toMillis());
        return HttpClients.custom()
                .setConnectionManager(PoolingHttpClientConnectionManagerBuilder.create()
                        .setDnsResolver(new PublicAddressDnsResolver(publicHostVerifier))
                        .setDefaultConnectionConfig(ConnectionConfig.custom()
                                .setConnectTimeout(timeout)
                                .setSocketTimeout(timeout)
                                .build())
                        .build())
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(timeout)
                        .setResponseTimeout(timeout)
                        .setRedirectsEnabled(false)
                        .build())
                .disableRedirectHandling()
                .build();
    }

    @Bean
    public TableauOAuthClient tableauOAuthClient(CloseableHttpClient upstreamHttpClient, ObjectMapper objectMapper) {
        return new TableauOAuthClient(upstreamHttpClient, objectMapper);
    }
}
