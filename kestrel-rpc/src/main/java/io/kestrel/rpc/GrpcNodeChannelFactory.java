// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.ManagedChannel;
import io.grpc.netty.GrpcSslContexts;
import io.grpc.netty.NegotiationType;
import io.grpc.netty.NettyChannelBuilder;
import io.kestrel.core.error.TlsBootstrapException;
import io.kestrel.rpc.internal.CertificateRetriever;
import io.kestrel.rpc.internal.Endpoints;
import io.kestrel.rpc.internal.PinnedCertificateTrustManager;
import io.kestrel.rpc.internal.StaticAddressNameResolver;
import io.netty.channel.ChannelOption;
import io.netty.handler.ssl.SslContext;
import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.concurrent.TimeUnit;
import javax.net.ssl.SSLException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates Netty-backed gRPC channels to consensus and mirror nodes.
 *
 * <p>
 * <strong>Plaintext:</strong> one channel per node, resolving to all of the node's
 * addresses and balancing over them round-robin.
 *
 * <p>
 * <strong>TLS:</strong> the certificate of every TLS endpoint of the node is
 * retrieved without verification, all of them are pinned in one trust store, and
 * one channel is opened per reachable endpoint. Host names are not checked, see
 * {@link PinnedCertificateTrustManager}. This is trust-on-first-use: an attacker
 * in the path during the first contact would be trusted.
 *
 * @since 0.1.0
 */
public final class GrpcNodeChannelFactory implements NodeChannelFactory {

    private static final Logger log = LoggerFactory.getLogger(GrpcNodeChannelFactory.class);

    /** Interval between keepalive pings on idle connections. */
    static final Duration KEEPALIVE_TIME = Duration.ofSeconds(10);

    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofMillis(Integer.MAX_VALUE);

    private static final String ROUND_ROBIN = "round_robin";

    private final CertificateRetriever certificateRetriever;

    public GrpcNodeChannelFactory() {
        this(new CertificateRetriever());
    }

    public GrpcNodeChannelFactory(final CertificateRetriever certificateRetriever) {
        this.certificateRetriever = Objects.requireNonNull(certificateRetriever, "certificateRetriever");
    }

    @Override
    @SuppressWarnings("deprecation") // nameResolverFactory is the only per-channel resolver hook
    public ManagedChannel createPlaintextChannel(final SortedSet<String> addresses, final Duration connectTimeout) {
        return configure(NettyChannelBuilder.forTarget(StaticAddressNameResolver.target(addresses)), connectTimeout)
                .nameResolverFactory(new StaticAddressNameResolver.Factory(addresses))
                .defaultLoadBalancingPolicy(ROUND_ROBIN)
                .usePlaintext()
                .build();
    }

    @Override
    public List<ManagedChannel> createTlsChannels(final SortedSet<String> addresses, final Duration connectTimeout) {
        final Map<String, X509Certificate> certificates = certificateRetriever.retrieveAll(addresses);
        if (certificates.isEmpty()) {
            throw new TlsBootstrapException(addresses);
        }

        final SslContext sslContext;
        try {
            sslContext = GrpcSslContexts.forClient()
                    .trustManager(PinnedCertificateTrustManager.forCertificates(certificates.values()))
                    .build();
        } catch (GeneralSecurityException | SSLException e) {
            throw new TlsBootstrapException("Cannot build the TLS context for " + addresses, e);
        }

        final List<ManagedChannel> channels = new ArrayList<>(certificates.size());
        for (String address : certificates.keySet()) {
            channels.add(configure(NettyChannelBuilder.forAddress(Endpoints.host(address), Endpoints.port(address)),
                    connectTimeout)
                    .negotiationType(NegotiationType.TLS)
                    .sslContext(sslContext)
                    .build());
        }
        log.debug("Pinned {} of {} TLS endpoints: {}", certificates.size(), addresses.size(), certificates.keySet());
        return channels;
    }

    @Override
    @SuppressWarnings("deprecation")
    public ManagedChannel createMirrorChannel(final SortedSet<String> addresses, final boolean plaintext) {
        final NettyChannelBuilder builder = NettyChannelBuilder.forTarget(StaticAddressNameResolver.target(addresses))
                .nameResolverFactory(new StaticAddressNameResolver.Factory(addresses))
                .defaultLoadBalancingPolicy(ROUND_ROBIN)
                .overrideAuthority(Endpoints.host(addresses.first()))
                .keepAliveTime(KEEPALIVE_TIME.toMillis(), TimeUnit.MILLISECONDS);
        if (plaintext) {
            builder.usePlaintext();
        } else {
            builder.useTransportSecurity();
        }
        return builder.build();
    }

    private static NettyChannelBuilder configure(final NettyChannelBuilder builder, final Duration connectTimeout) {
        return builder
                .keepAliveTime(KEEPALIVE_TIME.toMillis(), TimeUnit.MILLISECONDS)
                .withOption(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis(connectTimeout));
    }

    /** Netty takes the connect timeout as an int; longer timeouts are capped. */
    static int connectTimeoutMillis(final Duration connectTimeout) {
        if (connectTimeout.compareTo(MAX_CONNECT_TIMEOUT) >= 0) {
            return Integer.MAX_VALUE;
        }
        return (int) connectTimeout.toMillis();
    }
}
