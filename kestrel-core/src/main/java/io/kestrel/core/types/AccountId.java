// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.types;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifier of an account on the ledger, written {@code shard.realm.num}.
 * <p>
 * Consensus nodes are addressed by the account they are paid through (the
 * "node account id"), so this type is also the identity of a node in the
 * client's network.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>All three components must be non-negative</li>
 * <li>The text form is exactly three dot-separated decimal numbers</li>
 * </ul>
 *
 * @param shard the shard number
 * @param realm the realm number
 * @param num   the account number
 * @since 0.1.0
 */
public record AccountId(long shard, long realm, long num) implements Comparable<AccountId> {

    private static final Pattern TEXT = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)$");

    private static final Comparator<AccountId> ORDER = Comparator.comparingLong(AccountId::shard)
            .thenComparingLong(AccountId::realm)
            .thenComparingLong(AccountId::num);

    public AccountId {
        if (shard < 0 || realm < 0 || num < 0) {
            throw new IllegalArgumentException(
                    "Account id components must be non-negative: " + shard + "." + realm + "." + num);
        }
    }

    /**
     * Creates an account id in shard 0, realm 0.
     *
     * @param num the account number
     * @return the account id {@code 0.0.num}
     */
    public static AccountId of(final long num) {
        return new AccountId(0, 0, num);
    }

    /**
     * Parses an account id from its {@code shard.realm.num} text form.
     *
     * @param text the text to parse
     * @return the parsed account id
     * @throws IllegalArgumentException if the text is not a valid account id
     */
    public static AccountId parse(final String text) {
        Objects.requireNonNull(text, "text");
        final Matcher matcher = TEXT.matcher(text.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Invalid account id: " + text);
        }
        try {
            return new AccountId(
                    Long.parseLong(matcher.group(1)),
                    Long.parseLong(matcher.group(2)),
                    Long.parseLong(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid account id: " + text, e);
        }
    }

    @Override
    public int compareTo(final AccountId other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return shard + "." + realm + "." + num;
    }
}
