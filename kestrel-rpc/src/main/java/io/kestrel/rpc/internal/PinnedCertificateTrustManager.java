// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc.internal;

import io.kestrel.core.InternalApi;
import java.io.IOException;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Collection;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509ExtendedTrustManager;
import javax.net.ssl.X509TrustManager;

/**
 * Trusts exactly a given set of certificates, without checking the peer's host name.
 *
 * <p>
 * Consensus node certificates are not issued for the addresses nodes are reached
 * at, so the chain is verified against the pinned certificates and the host name
 * is ignored. The extended trust manager methods are overridden because the JDK
 * performs endpoint identification only inside its own trust manager.
 */
@InternalApi
public final class PinnedCertificateTrustManager extends X509ExtendedTrustManager {

    private final X509TrustManager delegate;

    private PinnedCertificateTrustManager(final X509TrustManager delegate) {
        this.delegate = delegate;
    }

    /**
     * Creates a trust manager whose trust store holds the given certificates.
     *
     * @param certificates the certificates to trust, at least one
     * @return the trust manager
     * @throws GeneralSecurityException if the trust store cannot be built
     */
    public static PinnedCertificateTrustManager forCertificates(final Collection<X509Certificate> certificates)
            throws GeneralSecurityException {
        if (certificates.isEmpty()) {
            throw new IllegalArgumentException("At least one certificate is required");
        }
        final KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        try {
            store.load(null, null);
        } catch (IOException e) {
            throw new GeneralSecurityException("Cannot initialize an empty trust store", e);
        }
        int alias = 0;
        for (X509Certificate certificate : certificates) {
            store.setCertificateEntry("node-" + alias++, certificate);
        }
        final TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(store);
        for (TrustManager manager : factory.getTrustManagers()) {
            if (manager instanceof X509TrustManager x509) {
                return new PinnedCertificateTrustManager(x509);
            }
        }
        throw new GeneralSecurityException("No X509TrustManager available");
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain, final String authType) throws CertificateException {
        delegate.checkServerTrusted(chain, authType);
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain, final String authType, final Socket socket)
            throws CertificateException {
        delegate.checkServerTrusted(chain, authType);
    }

    @Override
    public void checkServerTrusted(final X509Certificate[] chain, final String authType, final SSLEngine engine)
            throws CertificateException {
        delegate.checkServerTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(final X509Certificate[] chain, final String authType) throws CertificateException {
        throw new CertificateException("Client certificates are not accepted");
    }

    @Override
    public void checkClientTrusted(final X509Certificate[] chain, final String authType, final Socket socket)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public void checkClientTrusted(final X509Certificate[] chain, final String authType, final SSLEngine engine)
            throws CertificateException {
        checkClientTrusted(chain, authType);
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
        return delegate.getAcceptedIssuers();
    }
}
