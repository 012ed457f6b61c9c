// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.error;

/**
 * Thrown by checksum validation when an entity id's checksum does not belong to the client's ledger.
 *
 * @since 0.1.0
 */
public final class BadEntityIdException extends ConfigurationException {

    private final String entityId;
    private final String presentChecksum;
    private final String expectedChecksum;

    public BadEntityIdException(
            final String entityId, final String presentChecksum, final String expectedChecksum) {
        super("Entity id " + entityId + " has checksum " + presentChecksum
                + " but the configured ledger expects " + expectedChecksum);
        this.entityId = entityId;
        this.presentChecksum = presentChecksum;
        this.expectedChecksum = expectedChecksum;
    }

    public String entityId() {
        return entityId;
    }

    public String presentChecksum() {
        return presentChecksum;
    }

    public String expectedChecksum() {
        return expectedChecksum;
    }
}
