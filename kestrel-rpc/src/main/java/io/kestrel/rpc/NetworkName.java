// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * The public networks a client can be created for by name.
 *
 * @since 0.1.0
 */
public enum NetworkName {

    MAINNET(LedgerId.MAINNET, NetworkSeeds.MAINNET, "mainnet-public.mirrornode.hedera.com:443"),
    TESTNET(LedgerId.TESTNET, NetworkSeeds.TESTNET, "testnet.mirrornode.hedera.com:443"),
    PREVIEWNET(LedgerId.PREVIEWNET, NetworkSeeds.PREVIEWNET, "previewnet.mirrornode.hedera.com:443");

    private final LedgerId ledgerId;
    private final Map<Long, List<String>> seeds;
    private final String mirrorAddress;

    NetworkName(final LedgerId ledgerId, final Map<Long, List<String>> seeds, final String mirrorAddress) {
        this.ledgerId = ledgerId;
        this.seeds = seeds;
        this.mirrorAddress = mirrorAddress;
    }

    /**
     * Parses a network name, ignoring case.
     *
     * @param name {@code mainnet}, {@code testnet} or {@code previewnet}
     * @return the network
     * @throws ConfigurationException if the name is unknown
     */
    public static NetworkName fromString(final String name) {
        Objects.requireNonNull(name, "name");
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown network name: " + name, e);
        }
    }

    public LedgerId ledgerId() {
        return ledgerId;
    }

    /**
     * Returns the seed addresses of the network's consensus nodes.
     *
     * @return {@code host:50211} to node account id
     */
    public Map<String, AccountId> addresses() {
        return NetworkSeeds.addresses(seeds);
    }

    public String mirrorAddress() {
        return mirrorAddress;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
