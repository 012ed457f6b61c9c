// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Base class for responses that arrived intact but cannot be interpreted.
 */
public non-sealed class ProtocolException extends KestrelException {

    public ProtocolException(final String message) {
        super(message);
    }

    public ProtocolException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
