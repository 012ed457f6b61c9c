// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Thrown when a node returns a pre-check status code this SDK does not know.
 *
 * @since 0.1.0
 */
public final class UnrecognizedStatusException extends ProtocolException {

    private final int code;

    public UnrecognizedStatusException(final int code) {
        super("Response status code " + code + " is not recognized");
        this.code = code;
    }

    public int code() {
        return code;
    }
}
