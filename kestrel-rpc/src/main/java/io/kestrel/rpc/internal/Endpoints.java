// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc.internal;

import io.kestrel.core.InternalApi;
import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Helpers for {@code host:port} endpoint strings.
 */
@InternalApi
public final class Endpoints {

    private Endpoints() {
    }

    /**
     * Returns the host part of an endpoint.
     *
     * @param endpoint the {@code host:port} text
     * @return the host
     * @throws IllegalArgumentException if the endpoint has no port
     */
    public static String host(final String endpoint) {
        return endpoint.substring(0, separator(endpoint));
    }

    /**
     * Returns the port of an endpoint.
     *
     * @param endpoint the {@code host:port} text
     * @return the port
     * @throws IllegalArgumentException if the port is missing or not a valid number
     */
    public static int port(final String endpoint) {
        final String text = endpoint.substring(separator(endpoint) + 1);
        try {
            final int port = Integer.parseInt(text);
            if (port < 0 || port > 65_535) {
                throw new IllegalArgumentException("Port out of range in endpoint: " + endpoint);
            }
            return port;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in endpoint: " + endpoint, e);
        }
    }

    public static String withPort(final String endpoint, final int port) {
        return host(endpoint) + ":" + port;
    }

    public static InetSocketAddress toSocketAddress(final String endpoint) {
        return new InetSocketAddress(host(endpoint), port(endpoint));
    }

    private static int separator(final String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        final int index = endpoint.lastIndexOf(':');
        if (index <= 0 || index == endpoint.length() - 1) {
            throw new IllegalArgumentException("Endpoint must be host:port, got: " + endpoint);
        }
        return index;
    }
}
