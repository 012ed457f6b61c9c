// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StatusTest {

    @Test
    void looksUpByWireCode() {
        assertEquals(Optional.of(Status.OK), Status.fromCode(0));
        assertEquals(Optional.of(Status.TRANSACTION_EXPIRED), Status.fromCode(4));
        assertEquals(Optional.of(Status.BUSY), Status.fromCode(12));
        assertEquals(Optional.of(Status.PLATFORM_NOT_ACTIVE), Status.fromCode(67));
    }

    @Test
    void unknownCodesAreEmpty() {
        assertTrue(Status.fromCode(-1).isEmpty());
        assertTrue(Status.fromCode(100_000).isEmpty());
    }

    @Test
    void everyStatusRoundTrips() {
        for (Status status : Status.values()) {
            assertEquals(Optional.of(status), Status.fromCode(status.code()));
        }
    }
}
