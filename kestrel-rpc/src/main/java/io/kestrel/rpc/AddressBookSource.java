// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

/**
 * Supplies the current address book of a network, typically by querying a mirror node.
 *
 * <p>
 * Used by {@link Client#setNetworkUpdatePeriod} to keep the client's node list current.
 * Implementations may block; they are called from the client's refresh thread.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface AddressBookSource {

    /**
     * Fetches the address book.
     *
     * @return the current address book
     * @throws RuntimeException if the book could not be fetched; the refresh is retried next period
     */
    NodeAddressBook fetchAddressBook();
}
