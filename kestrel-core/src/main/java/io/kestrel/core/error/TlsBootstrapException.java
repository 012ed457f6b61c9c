// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

import java.util.Collection;
import java.util.List;

/**
 * Thrown when none of a node's TLS endpoints could be reached while building its channel pool.
 *
 * <p>
 * Bootstrap happens once per node, on first use with transport security enabled,
 * so this is reported as a configuration error rather than retried.
 */
public final class TlsBootstrapException extends ConfigurationException {

    private final List<String> addresses;

    public TlsBootstrapException(final Collection<String> addresses) {
        super("No TLS endpoint reachable, certificate retrieval failed for " + addresses);
        this.addresses = List.copyOf(addresses);
    }

    public TlsBootstrapException(final String message, final Throwable cause) {
        super(message, cause);
        this.addresses = List.of();
    }

    /**
     * Returns the TLS addresses that were tried.
     *
     * @return the addresses, empty when the failure happened before any connection attempt
     */
    public List<String> addresses() {
        return addresses;
    }
}
