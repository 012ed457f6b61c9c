// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.Channel;
import io.grpc.StatusRuntimeException;
import io.kestrel.core.Status;
import io.kestrel.core.error.KestrelException;
import io.kestrel.core.error.PreCheckStatusException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import io.kestrel.core.types.TransactionId;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One logical call that {@link RequestExecutor} can drive to completion against the network.
 *
 * <p>
 * Implementations describe how to build the wire request for a given node and
 * transaction id, how to submit it and how to read the response. They hold no
 * per-attempt state: the executor may call {@link #makeRequest} many times, for
 * different nodes and transaction ids, within one execution.
 *
 * <p>
 * <strong>Example:</strong>
 * <pre>{@code
 * final class BalanceQuery implements ExecutableRequest<Query, Response, Void, Long> {
 *     public PreparedRequest<Query, Void> makeRequest(TransactionId txId, AccountId node) {
 *         return new PreparedRequest<>(Query.forAccount(account), null);
 *     }
 *
 *     public Response submit(Channel channel, Query request, Duration deadline) {
 *         return CryptoServiceGrpc.newBlockingStub(channel)
 *                 .withDeadlineAfter(deadline.toMillis(), TimeUnit.MILLISECONDS)
 *                 .getBalance(request);
 *     }
 *     // ...
 * }
 * }</pre>
 *
 * @param <Q> the wire request type
 * @param <S> the wire response type
 * @param <C> context carried from request construction to response parsing
 * @param <O> the type returned to the caller
 * @since 0.1.0
 */
public interface ExecutableRequest<Q, S, C, O> {

    /**
     * Returns the nodes this request must be sent to.
     *
     * @return the node account ids, or {@code null} to let the executor pick nodes
     */
    @Nullable List<AccountId> nodeAccountIds();

    /**
     * Returns the transaction id chosen by the caller.
     *
     * @return the explicit transaction id, or {@code null} to have one generated when required
     */
    @Nullable TransactionId transactionId();

    boolean requiresTransactionId();

    /**
     * Returns whether a pre-check status should be retried after a backoff delay.
     *
     * @param status the pre-check status
     * @return {@code true} to retry in a later round
     */
    default boolean shouldRetryPreCheck(final Status status) {
        return false;
    }

    /**
     * Returns whether a successful response still asks to be retried, for example a
     * receipt that is not available yet.
     *
     * @param response the wire response
     * @return {@code true} to try the next node
     */
    default boolean shouldRetry(final S response) {
        return false;
    }

    /**
     * Builds the wire request for one node.
     *
     * @param transactionId the transaction id in use, or {@code null} if the request has none
     * @param nodeAccountId the node the request will be sent to
     * @return the request and its context
     * @throws KestrelException to abort the execution
     */
    PreparedRequest<Q, C> makeRequest(@Nullable TransactionId transactionId, AccountId nodeAccountId);

    /**
     * Sends the request over a channel and waits for the response.
     *
     * @param channel  the node's channel
     * @param request  the wire request
     * @param deadline the per-call gRPC deadline
     * @return the wire response
     * @throws StatusRuntimeException if the call fails at the transport level
     */
    S submit(Channel channel, Q request, Duration deadline);

    /**
     * Converts a successful wire response into the caller's result.
     *
     * @param response      the wire response
     * @param context       the context from {@link #makeRequest}
     * @param nodeAccountId the node that answered
     * @param transactionId the transaction id the request was sent with
     * @return the result
     * @throws KestrelException if the response cannot be converted
     */
    O makeResponse(S response, @Nullable C context, AccountId nodeAccountId, @Nullable TransactionId transactionId);

    /**
     * Creates the error reported for a pre-check status.
     *
     * @param status        the pre-check status
     * @param transactionId the transaction id the request was sent with
     * @return the error
     */
    default KestrelException makeErrorPreCheck(final Status status, final @Nullable TransactionId transactionId) {
        return new PreCheckStatusException(status, transactionId);
    }

    /**
     * Reads the numeric pre-check status code from a wire response.
     *
     * @param response the wire response
     * @return the status code
     */
    int responsePreCheckStatus(S response);

    /**
     * Validates the checksums of every entity id in the request.
     *
     * @param ledgerId the ledger the checksums must belong to
     * @throws io.kestrel.core.error.BadEntityIdException if a checksum does not match
     */
    default void validateChecksums(final LedgerId ledgerId) {
    }
}
