// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.grpc.StatusRuntimeException;
import io.kestrel.core.Status;
import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.error.ExecutionTimeoutException;
import io.kestrel.core.error.KestrelException;
import io.kestrel.core.error.MissingLedgerIdException;
import io.kestrel.core.error.TransportException;
import io.kestrel.core.error.UnrecognizedStatusException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import io.kestrel.core.types.TransactionId;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives an {@link ExecutableRequest} to completion against a {@link Network}.
 *
 * <p>
 * An execution works in rounds. Each round picks a shuffled list of nodes and tries
 * them in order until one answers. Failures are sorted into three groups:
 * <ul>
 * <li><strong>Next node:</strong> unavailable or exhausted channels (the node is
 * put to rest), {@code BUSY}, {@code PLATFORM_NOT_ACTIVE}, successful responses the
 * request asks to retry, and {@code TRANSACTION_EXPIRED} for a generated transaction id
 * (a new id is generated)</li>
 * <li><strong>Next round:</strong> statuses the request asks to retry; the round ends
 * and the executor backs off</li>
 * <li><strong>Permanent:</strong> everything else, thrown on first occurrence</li>
 * </ul>
 *
 * <p>
 * Rounds continue, separated by the delays of {@link RetryBackoffConfig}, until a
 * node answers or the next round would start past the deadline. The deadline is the
 * caller's timeout, else the client's request timeout, else {@link #MAX_REQUEST_TIMEOUT}.
 * On timeout an {@link ExecutionTimeoutException} is thrown carrying the last
 * transient error.
 *
 * <p>
 * <strong>Thread Safety:</strong> an executor holds no per-execution state and can run
 * any number of executions concurrently. Each round works on the topology current
 * when the round starts, so a network update applies to the next round of calls
 * already running. A node whose connection was retired by such an update while an
 * attempt was running is tried again without being put to rest.
 *
 * @since 0.1.0
 */
public final class RequestExecutor {

    private static final Logger log = LoggerFactory.getLogger(RequestExecutor.class);

    /** Timeout of an execution when neither the call nor the client sets one. */
    public static final Duration MAX_REQUEST_TIMEOUT = Duration.ofMinutes(15);

    /**
     * Description of the {@code INTERNAL} status produced when a node's proxy answers
     * with an HTTP error page. Whether the request took effect is unknown.
     */
    static final String MALFORMED_RESPONSE_DESCRIPTION = "protocol error: "
            + "received message with invalid compression flag: "
            + "60 (valid flags are 0 and 1) "
            + "while receiving response with status: "
            + "503 Service Unavailable";

    private final Network network;
    private final NodeProbe probe;
    private final Sleeper sleeper;
    private final Random random;
    private final Clock clock;

    public RequestExecutor(final Network network, final NodeProbe probe) {
        this(network, probe, Sleeper.SYSTEM, new Random(), network.clock());
    }

    public RequestExecutor(
            final Network network,
            final NodeProbe probe,
            final Sleeper sleeper,
            final Random random,
            final Clock clock) {
        this.network = Objects.requireNonNull(network, "network");
        this.probe = Objects.requireNonNull(probe, "probe");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.random = Objects.requireNonNull(random, "random");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Executes a request, blocking until it succeeds, fails permanently or times out.
     *
     * @param <O>     the result type
     * @param config  the client settings to use
     * @param request the request
     * @param timeout overall timeout, or {@code null} to use the client's
     * @return the request's result
     * @throws ExecutionTimeoutException if only transient failures occurred before the deadline
     * @throws KestrelException          for any permanent failure
     */
    public <Q, S, C, O> O execute(
            final ClientConfig config,
            final ExecutableRequest<Q, S, C, O> request,
            final @Nullable Duration timeout) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(request, "request");
        return new Execution<>(config, request, timeout).run();
    }

    /**
     * Executes a request on an executor.
     *
     * @param <O>      the result type
     * @param config   the client settings to use
     * @param request  the request
     * @param timeout  overall timeout, or {@code null} to use the client's
     * @param executor runs the blocking execution
     * @return a future completing with the result, or exceptionally with the failure
     */
    public <Q, S, C, O> CompletableFuture<O> executeAsync(
            final ClientConfig config,
            final ExecutableRequest<Q, S, C, O> request,
            final @Nullable Duration timeout,
            final Executor executor) {
        Objects.requireNonNull(executor, "executor");
        return CompletableFuture.supplyAsync(() -> execute(config, request, timeout), executor);
    }

    /**
     * Probes one node and records the result in its health.
     *
     * @param topology the topology the index refers to
     * @param index    the node index
     * @param deadline how long the probe may take
     * @return {@code true} if the node is reachable
     */
    public boolean probe(final NetworkTopology topology, final int index, final Duration deadline) {
        final NodeChannel node = topology.channel(index, deadline);
        final boolean reachable = probe.probe(node, deadline);
        final Instant now = clock.instant();
        if (reachable) {
            topology.markNodeHealthy(index, now);
        } else {
            log.debug("Node {} failed its liveness probe", node.nodeAccountId());
            topology.markNodeUnhealthy(index, now);
        }
        return reachable;
    }

    /**
     * State of one execution.
     */
    private final class Execution<Q, S, C, O> {

        private final ClientConfig config;
        private final ExecutableRequest<Q, S, C, O> request;
        private final Instant startedAt;
        private final Instant deadline;

        private boolean explicitTransactionId;
        private @Nullable TransactionId transactionId;
        private @Nullable List<AccountId> explicitNodeIds;

        private NetworkTopology topology;
        private int @Nullable [] explicitNodes;

        private int rounds;
        private @Nullable KestrelException lastError;

        Execution(
                final ClientConfig config,
                final ExecutableRequest<Q, S, C, O> request,
                final @Nullable Duration timeout) {
            this.config = config;
            this.request = request;
            this.topology = network.topology();
            this.startedAt = clock.instant();
            this.deadline = startedAt.plus(resolveTimeout(timeout, config));
        }

        O run() {
            validateChecksums();
            resolveTransactionId();
            resolveExplicitNodes();

            while (true) {
                refreshTopology();
                final Instant now = clock.instant();
                final List<Integer> candidates = roundCandidates(now);
                if (candidates.isEmpty()) {
                    awaitHealthyNode(now);
                    continue;
                }

                rounds++;
                boolean attempted = false;
                for (int index : candidates) {
                    if (!isLive(index, now)) {
                        continue;
                    }
                    attempted = true;
                    final AttemptOutcome<O> outcome;
                    try {
                        outcome = attempt(index);
                    } finally {
                        topology.markNodeUsed(index, clock.instant());
                    }
                    if (outcome instanceof AttemptOutcome.Done<O> done) {
                        return done.response();
                    }
                    if (outcome instanceof AttemptOutcome.Retry<O> retry) {
                        lastError = retry.error();
                        log.debug("Node {} failed transiently, trying next node: {}",
                                topology.nodeIds().get(index), retry.error().getMessage());
                        continue;
                    }
                    lastError = ((AttemptOutcome.RetryAfterBackoff<O>) outcome).error();
                    break;
                }

                if (attempted) {
                    backOff();
                }
            }
        }

        private void validateChecksums() {
            if (!config.autoValidateChecksums()) {
                return;
            }
            final LedgerId ledgerId = config.ledgerId();
            if (ledgerId == null) {
                throw new MissingLedgerIdException("validate entity id checksums");
            }
            request.validateChecksums(ledgerId);
        }

        private void resolveTransactionId() {
            final TransactionId explicit = request.transactionId();
            explicitTransactionId = explicit != null;
            if (request.requiresTransactionId()) {
                transactionId = explicit != null ? explicit : config.generateTransactionId();
            }
        }

        private void resolveExplicitNodes() {
            final List<AccountId> ids = request.nodeAccountIds();
            if (ids == null) {
                return;
            }
            if (ids.isEmpty()) {
                throw new ConfigurationException("The list of explicit node account ids is empty");
            }
            explicitNodeIds = List.copyOf(ids);
            explicitNodes = topology.nodeIndexesForIds(explicitNodeIds);
        }

        private void refreshTopology() {
            final NetworkTopology current = network.topology();
            if (current == topology) {
                return;
            }
            topology = current;
            if (explicitNodeIds != null) {
                explicitNodes = topology.nodeIndexesForIds(explicitNodeIds);
            }
        }

        private List<Integer> roundCandidates(final Instant now) {
            if (explicitNodes != null) {
                final List<Integer> healthy = new ArrayList<>();
                final List<Integer> all = new ArrayList<>();
                for (int index : explicitNodes) {
                    all.add(index);
                    if (topology.isNodeHealthy(index, now)) {
                        healthy.add(index);
                    }
                }
                final List<Integer> chosen = healthy.isEmpty() ? all : healthy;
                Collections.shuffle(chosen, random);
                return chosen;
            }
            final List<Integer> healthy = topology.healthyNodeIndexes(now);
            Collections.shuffle(healthy, random);
            return new ArrayList<>(healthy.subList(0, (healthy.size() + 2) / 3));
        }

        private boolean isLive(final int index, final Instant now) {
            return explicitNodes != null
                    || topology.nodeRecentlyPinged(index, now)
                    || probe(topology, index, config.grpcDeadline());
        }

        private AttemptOutcome<O> attempt(final int index) {
            final NodeChannel node;
            try {
                node = topology.channel(index, config.grpcDeadline());
            } catch (StatusRuntimeException e) {
                return transportFailure(index, e);
            }
            final PreparedRequest<Q, C> prepared = request.makeRequest(transactionId, node.nodeAccountId());

            final S response;
            try {
                response = request.submit(node.channel(), prepared.request(), config.grpcDeadline());
            } catch (StatusRuntimeException e) {
                return transportFailure(index, e);
            }

            final int code = request.responsePreCheckStatus(response);
            final Status status = Status.fromCode(code).orElseThrow(() -> new UnrecognizedStatusException(code));

            if (status == Status.OK) {
                if (request.shouldRetry(response)) {
                    return new AttemptOutcome.Retry<>(request.makeErrorPreCheck(status, transactionId));
                }
                topology.markNodeHealthy(index, clock.instant());
                return new AttemptOutcome.Done<>(
                        request.makeResponse(response, prepared.context(), node.nodeAccountId(), transactionId));
            }
            if (status == Status.BUSY || status == Status.PLATFORM_NOT_ACTIVE) {
                return new AttemptOutcome.Retry<>(request.makeErrorPreCheck(status, transactionId));
            }
            if (status == Status.TRANSACTION_EXPIRED && canRegenerateTransactionId()) {
                transactionId = config.generateTransactionId();
                log.debug("Transaction id expired, regenerated as {}", transactionId);
                return new AttemptOutcome.Retry<>(request.makeErrorPreCheck(status, transactionId));
            }
            if (request.shouldRetryPreCheck(status)) {
                return new AttemptOutcome.RetryAfterBackoff<>(request.makeErrorPreCheck(status, transactionId));
            }
            throw request.makeErrorPreCheck(status, transactionId);
        }

        private boolean canRegenerateTransactionId() {
            return !explicitTransactionId && transactionId != null && config.regenerateTransactionId();
        }

        private AttemptOutcome<O> transportFailure(final int index, final StatusRuntimeException e) {
            final io.grpc.Status.Code code = e.getStatus().getCode();
            if (code == io.grpc.Status.Code.UNAVAILABLE || code == io.grpc.Status.Code.RESOURCE_EXHAUSTED) {
                if (topology.connection(index).isShutdown()) {
                    log.debug("Connection to node {} was retired during the attempt", topology.nodeIds().get(index));
                } else {
                    topology.markNodeUnhealthy(index, clock.instant());
                }
                return new AttemptOutcome.Retry<>(new TransportException(e));
            }
            if (code == io.grpc.Status.Code.INTERNAL
                    && MALFORMED_RESPONSE_DESCRIPTION.equals(e.getStatus().getDescription())) {
                // unknown whether the request took effect, so it is not retried
                topology.markNodeUnhealthy(index, clock.instant());
            }
            throw new TransportException(e);
        }

        private void backOff() {
            final long delayMillis = config.retryBackoff().delayMillis(rounds, random);
            final Instant now = clock.instant();
            if (now.plusMillis(delayMillis).isAfter(deadline)) {
                throw timeout(now);
            }
            log.debug("Round {} failed, retrying in {}ms: {}",
                    rounds, delayMillis, lastError == null ? "no node attempted" : lastError.getMessage());
            sleep(Duration.ofMillis(delayMillis), now);
        }

        /**
         * Waits for the first resting node to recover. Not a failed round, so no backoff step.
         */
        private void awaitHealthyNode(final Instant now) {
            final Instant healthyAt = topology.earliestHealthyAt();
            if (healthyAt == null) {
                throw new ConfigurationException("The network has no nodes");
            }
            if (healthyAt.isAfter(deadline)) {
                throw timeout(now);
            }
            log.debug("No healthy node, waiting until {}", healthyAt);
            final Duration wait = Duration.between(now, healthyAt);
            if (!wait.isNegative() && !wait.isZero()) {
                sleep(wait, now);
            }
        }

        private void sleep(final Duration duration, final Instant now) {
            try {
                sleeper.sleep(duration);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                final ExecutionTimeoutException interrupted = timeout(now);
                interrupted.addSuppressed(e);
                throw interrupted;
            }
        }

        private ExecutionTimeoutException timeout(final Instant now) {
            return new ExecutionTimeoutException(rounds, Duration.between(startedAt, now).toMillis(), lastError);
        }
    }

    private static Duration resolveTimeout(final @Nullable Duration timeout, final ClientConfig config) {
        if (timeout != null) {
            return timeout;
        }
        final Duration requestTimeout = config.requestTimeout();
        return requestTimeout != null ? requestTimeout : MAX_REQUEST_TIMEOUT;
    }
}
