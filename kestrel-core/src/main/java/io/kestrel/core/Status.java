// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core;

import java.util.Optional;

/**
 * Response codes returned by consensus nodes, both at pre-check and in receipts.
 *
 * <p>
 * The numeric codes are part of the wire protocol. A node may return a code
 * newer than this table; {@link #fromCode(int)} reports such codes as empty so the
 * caller can treat them as a protocol error instead of guessing.
 *
 * @since 0.1.0
 */
public enum Status {
    OK(0),
    INVALID_TRANSACTION(1),
    PAYER_ACCOUNT_NOT_FOUND(2),
    INVALID_NODE_ACCOUNT(3),
    TRANSACTION_EXPIRED(4),
    INVALID_TRANSACTION_START(5),
    INVALID_TRANSACTION_DURATION(6),
    INVALID_SIGNATURE(7),
    MEMO_TOO_LONG(8),
    INSUFFICIENT_TX_FEE(9),
    INSUFFICIENT_PAYER_BALANCE(10),
    DUPLICATE_TRANSACTION(11),
    BUSY(12),
    NOT_SUPPORTED(13),
    INVALID_FILE_ID(14),
    INVALID_ACCOUNT_ID(15),
    INVALID_CONTRACT_ID(16),
    INVALID_TRANSACTION_ID(17),
    RECEIPT_NOT_FOUND(18),
    RECORD_NOT_FOUND(19),
    INVALID_SOLIDITY_ID(20),
    UNKNOWN(21),
    SUCCESS(22),
    FAIL_INVALID(23),
    FAIL_FEE(24),
    FAIL_BALANCE(25),
    KEY_REQUIRED(26),
    BAD_ENCODING(27),
    INSUFFICIENT_ACCOUNT_BALANCE(28),
    INVALID_SOLIDITY_ADDRESS(29),
    INSUFFICIENT_GAS(30),
    CONTRACT_SIZE_LIMIT_EXCEEDED(31),
    LOCAL_CALL_MODIFICATION_EXCEPTION(32),
    CONTRACT_REVERT_EXECUTED(33),
    CONTRACT_EXECUTION_EXCEPTION(34),
    INVALID_RECEIVING_NODE_ACCOUNT(35),
    MISSING_QUERY_HEADER(36),
    ACCOUNT_UPDATE_FAILED(37),
    INVALID_KEY_ENCODING(38),
    NULL_SOLIDITY_ADDRESS(39),
    CONTRACT_UPDATE_FAILED(40),
    INVALID_QUERY_HEADER(41),
    INVALID_FEE_SUBMITTED(42),
    INVALID_PAYER_SIGNATURE(43),
    KEY_NOT_PROVIDED(44),
    INVALID_EXPIRATION_TIME(45),
    NO_WACL_KEY(46),
    FILE_CONTENT_EMPTY(47),
    INVALID_ACCOUNT_AMOUNTS(48),
    EMPTY_TRANSACTION_BODY(49),
    INVALID_TRANSACTION_BODY(50),
    INVALID_SIGNATURE_TYPE_MISMATCHING_KEY(51),
    INVALID_SIGNATURE_COUNT_MISMATCHING_KEY(52),
    EMPTY_LIVE_HASH_BODY(53),
    EMPTY_LIVE_HASH(54),
    EMPTY_LIVE_HASH_KEYS(55),
    INVALID_LIVE_HASH_SIZE(56),
    EMPTY_QUERY_BODY(57),
    EMPTY_LIVE_HASH_QUERY(58),
    LIVE_HASH_NOT_FOUND(59),
    ACCOUNT_ID_DOES_NOT_EXIST(60),
    LIVE_HASH_ALREADY_EXISTS(61),
    INVALID_FILE_WACL(62),
    SERIALIZATION_FAILED(63),
    TRANSACTION_OVERSIZE(64),
    TRANSACTION_TOO_MANY_LAYERS(65),
    CONTRACT_DELETED(66),
    PLATFORM_NOT_ACTIVE(67),
    KEY_PREFIX_MISMATCH(68),
    PLATFORM_TRANSACTION_NOT_CREATED(69);

    private static final Status[] BY_CODE = new Status[70];

    static {
        for (Status status : values()) {
            BY_CODE[status.code] = status;
        }
    }

    private final int code;

    Status(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Looks up a status by its wire code.
     *
     * @param code the numeric code
     * @return the status, or empty if the code is unknown
     */
    public static Optional<Status> fromCode(final int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_CODE[code]);
    }
}
