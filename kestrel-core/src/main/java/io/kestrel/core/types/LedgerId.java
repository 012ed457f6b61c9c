// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core.types;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Objects;

/**
 * Identifier of a ledger (network), used to compute and validate entity id checksums.
 * <p>
 * The three public networks have one-byte ids; any other ledger is identified
 * by an arbitrary byte string, written in hex.
 *
 * @since 0.1.0
 */
public final class LedgerId {

    public static final LedgerId MAINNET = new LedgerId(new byte[] {0x00});
    public static final LedgerId TESTNET = new LedgerId(new byte[] {0x01});
    public static final LedgerId PREVIEWNET = new LedgerId(new byte[] {0x02});

    private final byte[] bytes;

    private LedgerId(final byte[] bytes) {
        this.bytes = bytes;
    }

    /**
     * Creates a ledger id from raw bytes.
     *
     * @param bytes the id bytes (copied)
     * @return the ledger id
     * @throws IllegalArgumentException if {@code bytes} is empty
     */
    public static LedgerId fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Ledger id must not be empty");
        }
        return new LedgerId(bytes.clone());
    }

    /**
     * Parses a ledger id from a network name ({@code mainnet}, {@code testnet},
     * {@code previewnet}) or a hex string.
     *
     * @param text the name or hex text
     * @return the ledger id
     * @throws IllegalArgumentException if the text is neither
     */
    public static LedgerId fromString(final String text) {
        Objects.requireNonNull(text, "text");
        switch (text.toLowerCase(Locale.ROOT)) {
            case "mainnet":
                return MAINNET;
            case "testnet":
                return TESTNET;
            case "previewnet":
                return PREVIEWNET;
            default:
                try {
                    return fromBytes(HexFormat.of().parseHex(text));
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid ledger id: " + text, e);
                }
        }
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public boolean isMainnet() {
        return equals(MAINNET);
    }

    public boolean isTestnet() {
        return equals(TESTNET);
    }

    public boolean isPreviewnet() {
        return equals(PREVIEWNET);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LedgerId)) {
            return false;
        }
        return Arrays.equals(bytes, ((LedgerId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        if (isMainnet()) {
            return "mainnet";
        }
        if (isTestnet()) {
            return "testnet";
        }
        if (isPreviewnet()) {
            return "previewnet";
        }
        return HexFormat.of().formatHex(bytes);
    }
}
