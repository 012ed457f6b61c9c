// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import org.junit.jupiter.api.Test;

class NetworkNameTest {

    @Test
    void parsesNamesIgnoringCase() {
        assertEquals(NetworkName.MAINNET, NetworkName.fromString("mainnet"));
        assertEquals(NetworkName.TESTNET, NetworkName.fromString(" TestNet "));
        assertEquals("previewnet", NetworkName.PREVIEWNET.toString());
    }

    @Test
    void unknownNameIsAConfigurationError() {
        assertThrows(ConfigurationException.class, () -> NetworkName.fromString("devnet"));
    }

    @Test
    void carriesLedgerAndSeeds() {
        assertEquals(LedgerId.TESTNET, NetworkName.TESTNET.ledgerId());
        assertFalse(NetworkName.MAINNET.addresses().isEmpty());
        assertEquals(AccountId.of(3), NetworkName.MAINNET.addresses().get("35.237.200.180:50211"));
    }
}
