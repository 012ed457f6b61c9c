// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.error.KestrelException;
import java.util.Objects;

/**
 * Result of sending a request to one node.
 *
 * <p>
 * Permanent failures are not outcomes: they are thrown and end the execution.
 *
 * @param <O> the caller's result type
 */
sealed interface AttemptOutcome<O> {

    /** The node failed transiently; try the next node of the round. */
    record Retry<O>(KestrelException error) implements AttemptOutcome<O> {
        public Retry {
            Objects.requireNonNull(error, "error");
        }
    }

    /** The node asked to be retried later; end the round and back off. */
    record RetryAfterBackoff<O>(KestrelException error) implements AttemptOutcome<O> {
        public RetryAfterBackoff {
            Objects.requireNonNull(error, "error");
        }
    }

    /** The node answered successfully. */
    record Done<O>(O response) implements AttemptOutcome<O> {
    }
}
