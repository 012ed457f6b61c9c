// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

import io.grpc.Channel;
import io.grpc.ManagedChannel;
import io.grpc.StatusRuntimeException;
import io.kestrel.core.Status;
import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.error.ExecutionTimeoutException;
import io.kestrel.core.error.MissingLedgerIdException;
import io.kestrel.core.error.NodeAccountUnknownException;
import io.kestrel.core.error.PreCheckStatusException;
import io.kestrel.core.error.TransportException;
import io.kestrel.core.error.UnrecognizedStatusException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import io.kestrel.core.types.TransactionId;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RequestExecutorTest {

    private static final AccountId OPERATOR = AccountId.of(1001);
    private static final AccountId NODE_3 = AccountId.of(3);
    private static final AccountId NODE_4 = AccountId.of(4);
    private static final AccountId NODE_5 = AccountId.of(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    private final List<Duration> sleeps = new ArrayList<>();
    private final Sleeper sleeper = duration -> {
        sleeps.add(duration);
        clock.advance(duration);
    };
    private final List<AccountId> probed = new ArrayList<>();
    private final Set<AccountId> unreachable = new HashSet<>();
    private final NodeProbe probe = (node, deadline) -> {
        probed.add(node.nodeAccountId());
        return !unreachable.contains(node.nodeAccountId());
    };

    private final ClientConfig config = ClientConfig.builder().operatorAccountId(OPERATOR).build();

    private Network network;

    @AfterEach
    void tearDown() {
        Thread.interrupted();
        if (network != null) {
            network.close();
        }
    }

    private RequestExecutor executor(final int nodes) {
        final Map<String, AccountId> addresses = new LinkedHashMap<>();
        for (int i = 0; i < nodes; i++) {
            addresses.put("10.0.0." + (i + 3) + ":50211", AccountId.of(i + 3));
        }
        network = new Network(NetworkTopology.fromAddresses(addresses, new FakeChannelFactory(), Runnable::run), clock);
        return new RequestExecutor(network, probe, sleeper, new Random(42), clock);
    }

    private NodeHealth.State state(final AccountId node) {
        final NetworkTopology topology = network.topology();
        return topology.health(topology.nodeIndexesForIds(List.of(node))[0]).state();
    }

    @Test
    void returnsFirstSuccessfulResponse() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);

        final String result = executor.execute(config, request, null);

        assertEquals("ok from " + request.attempted.get(0), result);
        assertEquals(1, request.attempted.size());
        assertInstanceOf(NodeHealth.Healthy.class, state(request.attempted.get(0)));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void unrestrictedRoundTriesAThirdOfHealthyNodes() {
        final RequestExecutor executor = executor(9);
        final FakeRequest request = new FakeRequest();
        request.fallback = Status.BUSY.code();

        final ExecutionTimeoutException e = assertThrows(ExecutionTimeoutException.class,
                () -> executor.execute(config, request, Duration.ofMillis(100)));

        assertEquals(1, e.roundCount());
        assertEquals(3, request.attempted.size());
        assertEquals(3, new HashSet<>(request.attempted).size());
        final PreCheckStatusException last = assertInstanceOf(PreCheckStatusException.class, e.lastError());
        assertEquals(Status.BUSY, last.status());
    }

    @Test
    void unavailableNodeIsPutToRestAndNextNodeTried() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(io.grpc.Status.UNAVAILABLE.asRuntimeException(), Status.OK);
        request.nodes = List.of(NODE_3, NODE_4);

        final String result = executor.execute(config, request, null);

        assertEquals(2, request.attempted.size());
        assertEquals("ok from " + request.attempted.get(1), result);
        assertInstanceOf(NodeHealth.Unhealthy.class, state(request.attempted.get(0)));
        assertInstanceOf(NodeHealth.Healthy.class, state(request.attempted.get(1)));
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void busyNodesAreRetriedAfterGrowingBackoff() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.BUSY, Status.BUSY, Status.OK);

        executor.execute(config, request, null);

        assertEquals(3, request.attempted.size());
        assertEquals(2, sleeps.size());
        assertBetween(275, 312, sleeps.get(0).toMillis());
        assertBetween(550, 625, sleeps.get(1).toMillis());
    }

    @Test
    void busyNodeIsFollowedByNextNodeInTheSameRound() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.BUSY, Status.OK);
        request.nodes = List.of(NODE_3, NODE_4);

        final String result = executor.execute(config, request, null);

        assertEquals(2, request.attempted.size());
        assertEquals(Set.of(NODE_3, NODE_4), Set.copyOf(request.attempted));
        assertEquals("ok from " + request.attempted.get(1), result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void explicitNodesAreTriedEvenWhenAllAreResting() {
        final RequestExecutor executor = executor(3);
        for (int i = 0; i < 3; i++) {
            network.markNodeUnhealthy(i);
        }
        final FakeRequest request = new FakeRequest(Status.BUSY, Status.BUSY, Status.OK);
        request.nodes = List.of(NODE_3, NODE_4, NODE_5);

        final String result = executor.execute(config, request, null);

        assertEquals(Set.of(NODE_3, NODE_4, NODE_5), Set.copyOf(request.attempted));
        assertEquals(3, request.attempted.size());
        assertEquals("ok from " + request.attempted.get(2), result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void addressChangeDuringCallMovesToNewConnection() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(io.grpc.Status.UNAVAILABLE.asRuntimeException(), Status.OK);
        request.nodes = List.of(NODE_4);
        request.onFirstRequest = () -> network.updateFromAddresses(Map.of(
                "10.0.0.3:50211", NODE_3,
                "10.0.0.40:50211", NODE_4,
                "10.0.0.5:50211", NODE_5));

        final String result = executor.execute(config, request, null);

        assertEquals("ok from " + NODE_4, result);
        assertEquals(2, request.channels.size());
        assertNotSame(request.channels.get(0), request.channels.get(1));
        verify((ManagedChannel) request.channels.get(0)).shutdown();
        assertInstanceOf(NodeHealth.Healthy.class, state(NODE_4));
        assertEquals(1, sleeps.size());
    }

    @Test
    void explicitNodeRemovedDuringCallIsReported() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.BUSY);
        request.nodes = List.of(NODE_4);
        request.onFirstRequest = () -> network.updateFromAddresses(Map.of("10.0.0.3:50211", NODE_3));

        final NodeAccountUnknownException e =
                assertThrows(NodeAccountUnknownException.class, () -> executor.execute(config, request, null));

        assertEquals(NODE_4, e.nodeAccountId());
        assertEquals(1, request.attempted.size());
    }

    @Test
    void timeoutReportsRoundsAndLastError() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest();
        request.nodes = List.of(NODE_3);
        request.fallback = Status.BUSY.code();

        final ExecutionTimeoutException e = assertThrows(ExecutionTimeoutException.class,
                () -> executor.execute(config, request, Duration.ofSeconds(1)));

        assertEquals(3, e.roundCount());
        assertBetween(825, 937, e.elapsedMillis());
        final PreCheckStatusException last = assertInstanceOf(PreCheckStatusException.class, e.lastError());
        assertEquals(Status.BUSY, last.status());
        assertEquals(2, sleeps.size());
    }

    @Test
    void configuredRequestTimeoutAppliesWhenCallerGivesNone() {
        final RequestExecutor executor = executor(1);
        final FakeRequest request = new FakeRequest();
        request.fallback = Status.BUSY.code();
        final ClientConfig impatient = config.toBuilder().requestTimeout(Duration.ofMillis(200)).build();

        final ExecutionTimeoutException e = assertThrows(ExecutionTimeoutException.class,
                () -> executor.execute(impatient, request, null));

        assertEquals(1, e.roundCount());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void permanentPreCheckFailureIsThrownImmediately() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.INVALID_SIGNATURE);

        final PreCheckStatusException e =
                assertThrows(PreCheckStatusException.class, () -> executor.execute(config, request, null));

        assertEquals(Status.INVALID_SIGNATURE, e.status());
        assertEquals(request.sentTransactionIds.get(0), e.transactionId());
        assertEquals(1, request.attempted.size());
    }

    @Test
    void permanentTransportFailureIsThrownWithoutPenalty() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(io.grpc.Status.INVALID_ARGUMENT.asRuntimeException());

        final TransportException e =
                assertThrows(TransportException.class, () -> executor.execute(config, request, null));

        assertEquals(io.grpc.Status.Code.INVALID_ARGUMENT, e.code());
        assertEquals(1, request.attempted.size());
        assertInstanceOf(NodeHealth.Healthy.class, state(request.attempted.get(0)));
    }

    @Test
    void malformedResponseIsThrownAndNodePutToRest() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(io.grpc.Status.INTERNAL
                .withDescription(RequestExecutor.MALFORMED_RESPONSE_DESCRIPTION)
                .asRuntimeException());

        final TransportException e =
                assertThrows(TransportException.class, () -> executor.execute(config, request, null));

        assertEquals(io.grpc.Status.Code.INTERNAL, e.code());
        assertEquals(1, request.attempted.size());
        assertInstanceOf(NodeHealth.Unhealthy.class, state(request.attempted.get(0)));
    }

    @Test
    void unknownStatusCodeIsRejected() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(9999);

        final UnrecognizedStatusException e =
                assertThrows(UnrecognizedStatusException.class, () -> executor.execute(config, request, null));

        assertEquals(9999, e.code());
    }

    @Test
    void expiredGeneratedTransactionIdIsRegenerated() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.TRANSACTION_EXPIRED, Status.OK);
        request.nodes = List.of(NODE_3, NODE_4, NODE_5);

        executor.execute(config, request, null);

        assertEquals(2, request.sentTransactionIds.size());
        assertNotEquals(request.sentTransactionIds.get(0), request.sentTransactionIds.get(1));
        assertEquals(request.sentTransactionIds.get(1), request.answeredTransactionId);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void expiredExplicitTransactionIdIsFatal() {
        final RequestExecutor executor = executor(3);
        final TransactionId explicit = TransactionId.generate(OPERATOR);
        final FakeRequest request = new FakeRequest(Status.TRANSACTION_EXPIRED, Status.OK);
        request.transactionId = explicit;

        final PreCheckStatusException e =
                assertThrows(PreCheckStatusException.class, () -> executor.execute(config, request, null));

        assertEquals(Status.TRANSACTION_EXPIRED, e.status());
        assertSame(explicit, e.transactionId());
        assertEquals(1, request.attempted.size());
    }

    @Test
    void expiredTransactionIdIsFatalWhenRegenerationIsOff() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.TRANSACTION_EXPIRED, Status.OK);
        final ClientConfig strict = config.toBuilder().regenerateTransactionId(false).build();

        assertThrows(PreCheckStatusException.class, () -> executor.execute(strict, request, null));
        assertEquals(1, request.attempted.size());
    }

    @Test
    void retryablePreCheckEndsTheRoundAndBacksOff() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.RECEIPT_NOT_FOUND, Status.OK);
        request.nodes = List.of(NODE_3, NODE_4, NODE_5);
        request.retryPreCheck = EnumSet.of(Status.RECEIPT_NOT_FOUND);

        final String result = executor.execute(config, request, null);

        assertEquals("ok from " + request.attempted.get(1), result);
        assertEquals(2, request.attempted.size());
        assertEquals(1, sleeps.size());
    }

    @Test
    void successfulResponseAskingForRetryMovesToNextNode() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK, Status.OK);
        request.nodes = List.of(NODE_3, NODE_4, NODE_5);
        request.retryOkResponses = 1;

        final String result = executor.execute(config, request, null);

        assertEquals(2, request.attempted.size());
        assertEquals("ok from " + request.attempted.get(1), result);
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void unknownExplicitNodeFailsBeforeAnyAttempt() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);
        request.nodes = List.of(NODE_3, AccountId.of(42));

        final NodeAccountUnknownException e =
                assertThrows(NodeAccountUnknownException.class, () -> executor.execute(config, request, null));

        assertEquals(AccountId.of(42), e.nodeAccountId());
        assertTrue(request.attempted.isEmpty());
    }

    @Test
    void emptyExplicitNodeListIsRejected() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);
        request.nodes = List.of();

        assertThrows(ConfigurationException.class, () -> executor.execute(config, request, null));
    }

    @Test
    void checksumValidationNeedsALedgerId() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);
        final ClientConfig validating = config.toBuilder().autoValidateChecksums(true).build();

        final MissingLedgerIdException e =
                assertThrows(MissingLedgerIdException.class, () -> executor.execute(validating, request, null));

        assertEquals("validate entity id checksums", e.task());
        assertTrue(request.attempted.isEmpty());
    }

    @Test
    void checksumsAreValidatedAgainstConfiguredLedger() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);
        final ClientConfig validating = config.toBuilder()
                .autoValidateChecksums(true)
                .ledgerId(LedgerId.TESTNET)
                .build();

        executor.execute(validating, request, null);

        assertEquals(LedgerId.TESTNET, request.validatedAgainst);
    }

    @Test
    void generatedTransactionIdNeedsAnOperator() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);

        assertThrows(ConfigurationException.class, () -> executor.execute(ClientConfig.defaults(), request, null));
    }

    @Test
    void requestWithoutTransactionIdGetsNone() {
        final RequestExecutor executor = executor(3);
        final FakeRequest request = new FakeRequest(Status.OK);
        request.requiresTransactionId = false;

        executor.execute(ClientConfig.defaults(), request, null);

        assertEquals(1, request.sentTransactionIds.size());
        assertNull(request.sentTransactionIds.get(0));
    }

    @Test
    void waitsForEarliestRecoveryWhenNoNodeIsHealthy() {
        final RequestExecutor executor = executor(1);
        network.markNodeUnhealthy(0);
        final FakeRequest request = new FakeRequest(Status.OK);

        executor.execute(config, request, null);

        assertEquals(List.of(Duration.ofMillis(250)), sleeps);
        assertEquals(List.of(NODE_3), request.attempted);
    }

    @Test
    void timesOutWhenNoNodeRecoversBeforeDeadline() {
        final RequestExecutor executor = executor(1);
        network.setMinBackoff(Duration.ofSeconds(10));
        network.markNodeUnhealthy(0);
        final FakeRequest request = new FakeRequest(Status.OK);

        final ExecutionTimeoutException e = assertThrows(ExecutionTimeoutException.class,
                () -> executor.execute(config, request, Duration.ofSeconds(1)));

        assertEquals(0, e.roundCount());
        assertNull(e.lastError());
        assertTrue(request.attempted.isEmpty());
    }

    @Test
    void unreachableNodesAreSkippedAndPutToRest() {
        final RequestExecutor executor = executor(3);
        unreachable.add(NODE_3);
        unreachable.add(NODE_4);
        final FakeRequest request = new FakeRequest(Status.OK);

        final String result = executor.execute(config, request, null);

        assertEquals("ok from " + NODE_5, result);
        assertEquals(List.of(NODE_5), request.attempted);
        for (AccountId node : probed) {
            if (!node.equals(NODE_5)) {
                assertInstanceOf(NodeHealth.Unhealthy.class, state(node));
            }
        }
    }

    @Test
    void recentlyUsedNodesAreNotProbed() {
        final RequestExecutor executor = executor(3);
        for (int i = 0; i < 3; i++) {
            network.markNodeHealthy(i);
        }

        executor.execute(config, new FakeRequest(Status.OK), null);

        assertTrue(probed.isEmpty());
    }

    @Test
    void explicitNodesAreNotProbed() {
        final RequestExecutor executor = executor(3);
        unreachable.add(NODE_3);
        final FakeRequest request = new FakeRequest(Status.OK);
        request.nodes = List.of(NODE_3);

        executor.execute(config, request, null);

        assertTrue(probed.isEmpty());
        assertEquals(List.of(NODE_3), request.attempted);
    }

    @Test
    void interruptedBackoffEndsExecution() {
        final Map<String, AccountId> addresses = Map.of("10.0.0.3:50211", NODE_3);
        network = new Network(NetworkTopology.fromAddresses(addresses, new FakeChannelFactory(), Runnable::run), clock);
        final RequestExecutor executor = new RequestExecutor(network, probe, duration -> {
            throw new InterruptedException("stop");
        }, new Random(42), clock);
        final FakeRequest request = new FakeRequest(Status.BUSY);

        final ExecutionTimeoutException e =
                assertThrows(ExecutionTimeoutException.class, () -> executor.execute(config, request, null));

        assertEquals(1, e.roundCount());
        assertInstanceOf(InterruptedException.class, e.getSuppressed()[0]);
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void executeAsyncCompletesWithResult() {
        final RequestExecutor executor = executor(3);

        final CompletableFuture<String> future =
                executor.executeAsync(config, new FakeRequest(Status.OK), null, Runnable::run);

        assertTrue(future.join().startsWith("ok from "));
    }

    @Test
    void executeAsyncCompletesExceptionallyWithFailure() {
        final RequestExecutor executor = executor(3);

        final CompletableFuture<String> future =
                executor.executeAsync(config, new FakeRequest(Status.INVALID_SIGNATURE), null, Runnable::run);

        final CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(PreCheckStatusException.class, e.getCause());
        assertFalse(future.isCancelled());
    }

    private static void assertBetween(final long min, final long max, final long actual) {
        assertTrue(actual >= min && actual <= max, actual + " not within [" + min + ", " + max + "]");
    }

    /**
     * Request answering from a script: status codes or transport failures, in attempt order.
     */
    private static final class FakeRequest implements ExecutableRequest<String, Integer, AccountId, String> {

        private final Deque<Object> script = new ArrayDeque<>();
        final List<AccountId> attempted = new ArrayList<>();
        final List<@Nullable TransactionId> sentTransactionIds = new ArrayList<>();
        final List<Channel> channels = new ArrayList<>();

        @Nullable List<AccountId> nodes;
        @Nullable TransactionId transactionId;
        boolean requiresTransactionId = true;
        Set<Status> retryPreCheck = EnumSet.noneOf(Status.class);
        int retryOkResponses;
        @Nullable Integer fallback;
        @Nullable Runnable onFirstRequest;

        @Nullable TransactionId answeredTransactionId;
        @Nullable LedgerId validatedAgainst;

        FakeRequest(final Object... answers) {
            for (Object answer : answers) {
                script.add(answer instanceof Status status ? status.code() : answer);
            }
        }

        @Override
        public @Nullable List<AccountId> nodeAccountIds() {
            return nodes;
        }

        @Override
        public @Nullable TransactionId transactionId() {
            return transactionId;
        }

        @Override
        public boolean requiresTransactionId() {
            return requiresTransactionId;
        }

        @Override
        public boolean shouldRetryPreCheck(final Status status) {
            return retryPreCheck.contains(status);
        }

        @Override
        public boolean shouldRetry(final Integer response) {
            if (response == Status.OK.code() && retryOkResponses > 0) {
                retryOkResponses--;
                return true;
            }
            return false;
        }

        @Override
        public PreparedRequest<String, AccountId> makeRequest(
                final @Nullable TransactionId transactionId, final AccountId nodeAccountId) {
            attempted.add(nodeAccountId);
            sentTransactionIds.add(transactionId);
            if (onFirstRequest != null) {
                final Runnable action = onFirstRequest;
                onFirstRequest = null;
                action.run();
            }
            return new PreparedRequest<>("request", nodeAccountId);
        }

        @Override
        public Integer submit(final Channel channel, final String request, final Duration deadline) {
            channels.add(channel);
            Object answer = script.poll();
            if (answer == null) {
                answer = fallback;
            }
            if (answer instanceof StatusRuntimeException failure) {
                throw failure;
            }
            return (Integer) answer;
        }

        @Override
        public String makeResponse(
                final Integer response,
                final @Nullable AccountId context,
                final AccountId nodeAccountId,
                final @Nullable TransactionId transactionId) {
            answeredTransactionId = transactionId;
            return "ok from " + context;
        }

        @Override
        public int responsePreCheckStatus(final Integer response) {
            return response;
        }

        @Override
        public void validateChecksums(final LedgerId ledgerId) {
            validatedAgainst = ledgerId;
        }
    }
}
