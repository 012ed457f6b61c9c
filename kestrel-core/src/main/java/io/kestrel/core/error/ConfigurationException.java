// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Base class for failures caused by how the client or the request is configured.
 *
 * <p>
 * These are never retried: resubmitting the same request against the same
 * client produces the same failure.
 */
public non-sealed class ConfigurationException extends KestrelException {

    public ConfigurationException(final String message) {
        super(message);
    }

    public ConfigurationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
