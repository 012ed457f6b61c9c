// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc.internal;

import io.kestrel.core.InternalApi;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.security.GeneralSecurityException;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retrieves the certificate a TLS endpoint presents, without verifying it.
 *
 * <p>
 * The handshake trusts any certificate, so the result only tells what the
 * endpoint claims to be. It is used to pin a node's certificates the first time
 * the node is contacted.
 */
@InternalApi
public final class CertificateRetriever {

    private static final Logger log = LoggerFactory.getLogger(CertificateRetriever.class);

    /** Default bound on connecting to and reading from an endpoint. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final Duration timeout;

    public CertificateRetriever() {
        this(DEFAULT_TIMEOUT);
    }

    public CertificateRetriever(final Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Retrieves the leaf certificate of one endpoint.
     *
     * @param endpoint the {@code host:port} of the TLS endpoint
     * @return the certificate
     * @throws IOException if the endpoint cannot be reached or the handshake fails
     */
    public X509Certificate retrieve(final String endpoint) throws IOException {
        final SSLContext context;
        try {
            context = SSLContext.getInstance("TLS");
            context.init(null, InsecureTrustManagerFactory.INSTANCE.getTrustManagers(), null);
        } catch (GeneralSecurityException e) {
            throw new IOException("Cannot create an SSL context", e);
        }
        final int timeoutMillis = Math.toIntExact(timeout.toMillis());
        try (SSLSocket socket = (SSLSocket) context.getSocketFactory().createSocket()) {
            socket.connect(new InetSocketAddress(Endpoints.host(endpoint), Endpoints.port(endpoint)), timeoutMillis);
            socket.setSoTimeout(timeoutMillis);
            socket.startHandshake();
            final Certificate[] chain = socket.getSession().getPeerCertificates();
            if (chain.length == 0 || !(chain[0] instanceof X509Certificate certificate)) {
                throw new IOException("Endpoint " + endpoint + " presented no X.509 certificate");
            }
            return certificate;
        }
    }

    /**
     * Retrieves the certificates of several endpoints, skipping unreachable ones.
     *
     * @param endpoints the {@code host:port} of each TLS endpoint
     * @return the certificate of every reachable endpoint, keyed by endpoint in input order
     */
    public Map<String, X509Certificate> retrieveAll(final Collection<String> endpoints) {
        final Map<String, X509Certificate> certificates = new LinkedHashMap<>();
        for (String endpoint : endpoints) {
            try {
                certificates.put(endpoint, retrieve(endpoint));
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to retrieve TLS certificate from {}: {}", endpoint, e.toString());
            }
        }
        return certificates;
    }
}
