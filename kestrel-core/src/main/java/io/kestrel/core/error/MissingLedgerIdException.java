// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Thrown when a task needs the client's ledger id and none is configured.
 *
 * <p>
 * Checksum validation is the main such task: entity id checksums are computed
 * against a ledger id, so they cannot be checked without one.
 */
public final class MissingLedgerIdException extends ConfigurationException {

    private final String task;

    public MissingLedgerIdException(final String task) {
        super("Cannot " + task + " without a ledger id configured on the client");
        this.task = task;
    }

    public String task() {
        return task;
    }
}
