// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import io.kestrel.core.types.TransactionId;
import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * Immutable client settings read by one execution.
 *
 * <p>
 * {@link Client} keeps the current settings in an atomic reference and hands each
 * execution a snapshot, so changing a setting never affects a request that is
 * already running.
 *
 * @param operatorAccountId      the account paying for transactions, used to generate transaction ids
 * @param ledgerId               the ledger checksums are validated against
 * @param autoValidateChecksums  whether to validate entity id checksums before sending
 * @param requestTimeout         the default overall timeout of an execution, {@code null} for the hard ceiling
 * @param grpcDeadline           the deadline of a single gRPC call and of channel connection
 * @param retryBackoff           the delay between retry rounds
 * @param regenerateTransactionId whether an expired generated transaction id is replaced and retried
 * @since 0.1.0
 */
public record ClientConfig(
        @Nullable AccountId operatorAccountId,
        @Nullable LedgerId ledgerId,
        boolean autoValidateChecksums,
        @Nullable Duration requestTimeout,
        Duration grpcDeadline,
        RetryBackoffConfig retryBackoff,
        boolean regenerateTransactionId) {

    /** Default deadline of a single gRPC call: 10 seconds. */
    public static final Duration DEFAULT_GRPC_DEADLINE = Duration.ofSeconds(10);

    public ClientConfig {
        Objects.requireNonNull(grpcDeadline, "grpcDeadline");
        Objects.requireNonNull(retryBackoff, "retryBackoff");
        requirePositive(grpcDeadline, "grpcDeadline");
        if (requestTimeout != null) {
            requirePositive(requestTimeout, "requestTimeout");
        }
    }

    public static ClientConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .operatorAccountId(operatorAccountId)
                .ledgerId(ledgerId)
                .autoValidateChecksums(autoValidateChecksums)
                .requestTimeout(requestTimeout)
                .grpcDeadline(grpcDeadline)
                .retryBackoff(retryBackoff)
                .regenerateTransactionId(regenerateTransactionId);
    }

    /**
     * Generates a new transaction id paid for by the operator.
     *
     * @return a fresh transaction id
     * @throws ConfigurationException if no operator account is configured
     */
    public TransactionId generateTransactionId() {
        if (operatorAccountId == null) {
            throw new ConfigurationException("Cannot generate a transaction id without an operator account");
        }
        return TransactionId.generate(operatorAccountId);
    }

    private static void requirePositive(final Duration duration, final String name) {
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be > 0, got: " + duration);
        }
    }

    /**
     * Builder for {@link ClientConfig}.
     */
    public static final class Builder {
        private @Nullable AccountId operatorAccountId;
        private @Nullable LedgerId ledgerId;
        private boolean autoValidateChecksums;
        private @Nullable Duration requestTimeout;
        private Duration grpcDeadline = DEFAULT_GRPC_DEADLINE;
        private RetryBackoffConfig retryBackoff = RetryBackoffConfig.defaults();
        private boolean regenerateTransactionId = true;

        private Builder() {}

        public Builder operatorAccountId(final @Nullable AccountId operatorAccountId) {
            this.operatorAccountId = operatorAccountId;
            return this;
        }

        public Builder ledgerId(final @Nullable LedgerId ledgerId) {
            this.ledgerId = ledgerId;
            return this;
        }

        public Builder autoValidateChecksums(final boolean autoValidateChecksums) {
            this.autoValidateChecksums = autoValidateChecksums;
            return this;
        }

        public Builder requestTimeout(final @Nullable Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder grpcDeadline(final Duration grpcDeadline) {
            this.grpcDeadline = grpcDeadline;
            return this;
        }

        public Builder retryBackoff(final RetryBackoffConfig retryBackoff) {
            this.retryBackoff = retryBackoff;
            return this;
        }

        public Builder regenerateTransactionId(final boolean regenerateTransactionId) {
            this.regenerateTransactionId = regenerateTransactionId;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new immutable {@link ClientConfig}
         * @throws IllegalArgumentException if a duration is not positive
         */
        public ClientConfig build() {
            return new ClientConfig(
                    operatorAccountId,
                    ledgerId,
                    autoValidateChecksums,
                    requestTimeout,
                    grpcDeadline,
                    retryBackoff,
                    regenerateTransactionId);
        }
    }
}
