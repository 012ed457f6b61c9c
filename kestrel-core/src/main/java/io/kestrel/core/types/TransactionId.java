// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.types;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifier of a transaction: the paying account plus the instant the transaction becomes valid.
 * <p>
 * Ids produced by {@link #generate(AccountId)} have strictly increasing valid-start
 * instants within one JVM, so two ids generated back to back never collide even
 * when the clock has not moved. The valid start is also back-dated by a few
 * seconds so that a node whose clock lags ours does not reject the transaction as
 * starting in the future.
 *
 * @param accountId  the account paying for the transaction
 * @param validStart the instant from which the transaction may be executed
 * @since 0.1.0
 */
public record TransactionId(AccountId accountId, Instant validStart) {

    private static final long MIN_BACKDATE_NANOS = 5_000_000_000L;
    private static final long MAX_BACKDATE_NANOS = 8_000_000_000L;

    private static final AtomicLong LAST_VALID_START_NANOS = new AtomicLong();

    public TransactionId {
        Objects.requireNonNull(accountId, "accountId");
        Objects.requireNonNull(validStart, "validStart");
    }

    /**
     * Generates a fresh transaction id paid for by the given account.
     *
     * @param accountId the paying account
     * @return a new transaction id, distinct from every id previously generated in this JVM
     */
    public static TransactionId generate(final AccountId accountId) {
        return generate(accountId, Instant.now());
    }

    static TransactionId generate(final AccountId accountId, final Instant now) {
        final long backdate = ThreadLocalRandom.current().nextLong(MIN_BACKDATE_NANOS, MAX_BACKDATE_NANOS);
        final long candidate = toEpochNanos(now) - backdate;
        final long nanos = LAST_VALID_START_NANOS.updateAndGet(last -> Math.max(last + 1, candidate));
        return new TransactionId(accountId, Instant.ofEpochSecond(0, nanos));
    }

    private static long toEpochNanos(final Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), 1_000_000_000L), instant.getNano());
    }

    @Override
    public String toString() {
        return accountId + "@" + validStart.getEpochSecond() + "." + String.format("%09d", validStart.getNano());
    }
}
