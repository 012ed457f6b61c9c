// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import io.kestrel.core.error.ConfigurationException;
import io.kestrel.core.error.KestrelException;
import io.kestrel.core.types.AccountId;
import io.kestrel.core.types.LedgerId;
import io.kestrel.core.types.TransactionId;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for submitting requests to a network of consensus nodes.
 *
 * <p>
 * A client owns the {@link Network} of consensus nodes, the {@link MirrorNetwork},
 * the current {@link ClientConfig} and the executors that back asynchronous
 * execution, TLS bootstrap and periodic network refresh. Close it to release them.
 *
 * <p>
 * <strong>Usage:</strong>
 * <pre>{@code
 * try (Client client = Client.forTestnet()) {
 *     client.setOperatorAccountId(AccountId.parse("0.0.1001"));
 *     client.setRequestTimeout(Duration.ofMinutes(2));
 *
 *     Long balance = client.execute(new BalanceQuery(AccountId.parse("0.0.1001")));
 * }
 * }</pre>
 *
 * <p>
 * <strong>Thread Safety:</strong> all methods may be called from any thread.
 * Setting changes apply to executions started afterwards.
 *
 * @since 0.1.0
 */
public final class Client implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Client.class);

    private final Network network;
    private final AtomicReference<MirrorNetwork> mirrorNetwork;
    private final AtomicReference<ClientConfig> config;
    private final NodeChannelFactory channelFactory;
    private final RequestExecutor executor;
    private final ExecutorService ioExecutor;
    private final ExecutorService bootstrapExecutor;
    private final AtomicBoolean closed = new AtomicBoolean();

    private final Object refreshLock = new Object();
    private @Nullable ScheduledExecutorService refreshScheduler;
    private @Nullable ScheduledFuture<?> refreshTask;

    private Client(final Builder builder) {
        this.channelFactory = builder.channelFactory != null ? builder.channelFactory : new GrpcNodeChannelFactory();
        this.bootstrapExecutor = KestrelExecutors.newCpuBoundExecutor();
        this.ioExecutor = KestrelExecutors.newIoBoundExecutor();

        final NetworkTopology topology = builder.networkName != null
                ? NetworkTopology.fromStatic(builder.networkName, channelFactory, bootstrapExecutor)
                : NetworkTopology.fromAddresses(builder.network, channelFactory, bootstrapExecutor);
        this.network = new Network(topology, builder.clock);

        final List<String> mirrors;
        if (builder.mirrorNetwork != null) {
            mirrors = builder.mirrorNetwork;
        } else if (builder.networkName != null) {
            mirrors = List.of(builder.networkName.mirrorAddress());
        } else {
            mirrors = List.of();
        }
        this.mirrorNetwork = new AtomicReference<>(new MirrorNetwork(mirrors, channelFactory));

        ClientConfig initial = builder.config;
        if (initial.ledgerId() == null && builder.networkName != null) {
            initial = initial.toBuilder().ledgerId(builder.networkName.ledgerId()).build();
        }
        this.config = new AtomicReference<>(initial);

        final NodeProbe probe = builder.probe != null ? builder.probe : new ChannelStateProbe();
        this.executor = new RequestExecutor(network, probe, builder.sleeper, builder.random, builder.clock);
    }

    public static Client forMainnet() {
        return builder().network(NetworkName.MAINNET).build();
    }

    public static Client forTestnet() {
        return builder().network(NetworkName.TESTNET).build();
    }

    public static Client forPreviewnet() {
        return builder().network(NetworkName.PREVIEWNET).build();
    }

    /**
     * Creates a client for a public network by name.
     *
     * @param name {@code mainnet}, {@code testnet} or {@code previewnet}
     * @return the client
     * @throws ConfigurationException if the name is unknown
     */
    public static Client forName(final String name) {
        return builder().network(NetworkName.fromString(name)).build();
    }

    /**
     * Creates a client for an explicit set of consensus nodes, with no mirror network.
     *
     * @param addresses {@code host:port} to node account id
     * @return the client
     */
    public static Client forNetwork(final Map<String, AccountId> addresses) {
        return builder().network(addresses).build();
    }

    /**
     * Creates a client from a JSON configuration.
     *
     * @param json the configuration, see {@link ClientConfigFile}
     * @return the client
     * @throws ConfigurationException if the configuration is invalid
     */
    public static Client fromConfig(final String json) {
        return builder().configFile(ClientConfigFile.parse(json)).build();
    }

    /**
     * Creates a client from a JSON configuration file.
     *
     * @param path the file, see {@link ClientConfigFile}
     * @return the client
     * @throws ConfigurationException if the file cannot be read or is invalid
     */
    public static Client fromConfigFile(final Path path) {
        return builder().configFile(ClientConfigFile.read(path)).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Network network() {
        return network;
    }

    public MirrorNetwork mirrorNetwork() {
        return mirrorNetwork.get();
    }

    /**
     * Returns the current settings.
     *
     * @return an immutable snapshot
     */
    public ClientConfig config() {
        return config.get();
    }

    public void setOperatorAccountId(final @Nullable AccountId operatorAccountId) {
        updateConfig(c -> c.toBuilder().operatorAccountId(operatorAccountId).build());
    }

    public @Nullable AccountId operatorAccountId() {
        return config().operatorAccountId();
    }

    public void setLedgerId(final @Nullable LedgerId ledgerId) {
        updateConfig(c -> c.toBuilder().ledgerId(ledgerId).build());
    }

    public @Nullable LedgerId ledgerId() {
        return config().ledgerId();
    }

    public void setAutoValidateChecksums(final boolean autoValidateChecksums) {
        updateConfig(c -> c.toBuilder().autoValidateChecksums(autoValidateChecksums).build());
    }

    public boolean isAutoValidateChecksums() {
        return config().autoValidateChecksums();
    }

    public void setRequestTimeout(final @Nullable Duration requestTimeout) {
        updateConfig(c -> c.toBuilder().requestTimeout(requestTimeout).build());
    }

    public @Nullable Duration requestTimeout() {
        return config().requestTimeout();
    }

    public void setGrpcDeadline(final Duration grpcDeadline) {
        updateConfig(c -> c.toBuilder().grpcDeadline(grpcDeadline).build());
    }

    public Duration grpcDeadline() {
        return config().grpcDeadline();
    }

    public void setRetryBackoff(final RetryBackoffConfig retryBackoff) {
        updateConfig(c -> c.toBuilder().retryBackoff(retryBackoff).build());
    }

    public void setRegenerateTransactionId(final boolean regenerateTransactionId) {
        updateConfig(c -> c.toBuilder().regenerateTransactionId(regenerateTransactionId).build());
    }

    public void setTransportSecurity(final boolean transportSecurity) {
        network.setTransportSecurity(transportSecurity);
    }

    public boolean transportSecurity() {
        return network.transportSecurity();
    }

    public void setMinNodeBackoff(final Duration minBackoff) {
        network.setMinBackoff(minBackoff);
    }

    public void setMaxNodeBackoff(final Duration maxBackoff) {
        network.setMaxBackoff(maxBackoff);
    }

    public void setMaxNodeAttempts(final int maxAttempts) {
        network.setMaxNodeAttempts(maxAttempts);
    }

    /**
     * Replaces the consensus nodes, keeping the state of nodes that stay.
     *
     * @param addresses {@code host:port} to node account id
     */
    public void setNetwork(final Map<String, AccountId> addresses) {
        network.updateFromAddresses(addresses);
    }

    /**
     * Replaces the consensus nodes with those of an address book.
     *
     * @param book the address book
     */
    public void setNetworkFromAddressBook(final NodeAddressBook book) {
        network.updateFromAddressBook(book);
    }

    /**
     * Replaces the mirror network. The previous mirror channel is shut down.
     *
     * @param addresses the mirror {@code host:port} addresses
     */
    public void setMirrorNetwork(final List<String> addresses) {
        final MirrorNetwork previous = mirrorNetwork.getAndSet(new MirrorNetwork(addresses, channelFactory));
        previous.close();
    }

    /**
     * Generates a transaction id paid for by the operator.
     *
     * @return a fresh transaction id
     * @throws ConfigurationException if no operator is configured
     */
    public TransactionId generateTransactionId() {
        return config().generateTransactionId();
    }

    public <Q, S, C, O> O execute(final ExecutableRequest<Q, S, C, O> request) {
        return execute(request, null);
    }

    /**
     * Executes a request, blocking until it completes.
     *
     * @param <O>     the result type
     * @param request the request
     * @param timeout overall timeout, or {@code null} for the client's request timeout
     * @return the result
     * @throws KestrelException if the request fails or times out
     */
    public <Q, S, C, O> O execute(final ExecutableRequest<Q, S, C, O> request, final @Nullable Duration timeout) {
        ensureOpen();
        return executor.execute(config(), request, timeout);
    }

    public <Q, S, C, O> CompletableFuture<O> executeAsync(final ExecutableRequest<Q, S, C, O> request) {
        return executeAsync(request, null);
    }

    /**
     * Executes a request on the client's I/O executor.
     *
     * @param <O>     the result type
     * @param request the request
     * @param timeout overall timeout, or {@code null} for the client's request timeout
     * @return a future completing with the result, or exceptionally with a {@link KestrelException}
     */
    public <Q, S, C, O> CompletableFuture<O> executeAsync(
            final ExecutableRequest<Q, S, C, O> request,
            final @Nullable Duration timeout) {
        ensureOpen();
        return executor.executeAsync(config(), request, timeout, ioExecutor);
    }

    /**
     * Checks whether one node is reachable and records the result in its health.
     *
     * @param nodeAccountId the node
     * @return {@code true} if the node is reachable
     * @throws io.kestrel.core.error.NodeAccountUnknownException if the node is not part of the network
     */
    public boolean ping(final AccountId nodeAccountId) {
        ensureOpen();
        final NetworkTopology topology = network.topology();
        final int index = topology.nodeIndexesForIds(List.of(nodeAccountId))[0];
        return executor.probe(topology, index, config().grpcDeadline());
    }

    /**
     * Checks every node in parallel and records the results in their health.
     *
     * @return reachability per node, in network order
     */
    public Map<AccountId, Boolean> pingAll() {
        ensureOpen();
        final NetworkTopology topology = network.topology();
        final Duration deadline = config().grpcDeadline();
        final List<CompletableFuture<Boolean>> probes = new ArrayList<>(topology.size());
        for (int i = 0; i < topology.size(); i++) {
            final int index = i;
            probes.add(CompletableFuture.supplyAsync(() -> executor.probe(topology, index, deadline), ioExecutor));
        }
        final Map<AccountId, Boolean> results = new LinkedHashMap<>();
        for (int i = 0; i < probes.size(); i++) {
            try {
                results.put(topology.nodeIds().get(i), probes.get(i).join());
            } catch (CompletionException e) {
                if (e.getCause() instanceof KestrelException kestrel) {
                    throw kestrel;
                }
                throw e;
            }
        }
        return results;
    }

    /**
     * Fetches an address book once and applies it to the network.
     *
     * @param source where to fetch the book from
     */
    public void refreshNetwork(final AddressBookSource source) {
        Objects.requireNonNull(source, "source");
        final NodeAddressBook book = source.fetchAddressBook();
        network.updateFromAddressBook(book);
        log.debug("Applied address book with {} nodes", book.nodeAddresses().size());
    }

    /**
     * Refreshes the network from an address book source at a fixed period.
     *
     * <p>
     * The first refresh happens one period from now. A failed refresh is logged and
     * retried at the next period. Calling this again replaces the previous schedule.
     *
     * @param period the delay between the end of one refresh and the start of the next
     * @param source where to fetch the book from
     */
    public void setNetworkUpdatePeriod(final Duration period, final AddressBookSource source) {
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(source, "source");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be > 0, got: " + period);
        }
        ensureOpen();
        synchronized (refreshLock) {
            cancelRefresh();
            if (refreshScheduler == null) {
                refreshScheduler = KestrelExecutors.newScheduler();
            }
            final long millis = period.toMillis();
            refreshTask = refreshScheduler.scheduleWithFixedDelay(
                    () -> refreshQuietly(source, period), millis, millis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Stops periodic network refresh, if any.
     */
    public void cancelNetworkUpdates() {
        synchronized (refreshLock) {
            cancelRefresh();
        }
    }

    /**
     * Stops network refresh and shuts down every channel and executor of the client.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        synchronized (refreshLock) {
            cancelRefresh();
            if (refreshScheduler != null) {
                refreshScheduler.shutdownNow();
                refreshScheduler = null;
            }
        }
        network.close();
        mirrorNetwork.get().close();
        ioExecutor.shutdown();
        bootstrapExecutor.shutdown();
        log.debug("Client closed");
    }

    void refreshQuietly(final AddressBookSource source, final Duration period) {
        try {
            refreshNetwork(source);
        } catch (RuntimeException e) {
            log.warn("Network update failed, retrying in {}: {}", period, e.toString());
        }
    }

    private void cancelRefresh() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
    }

    private void updateConfig(final UnaryOperator<ClientConfig> change) {
        config.updateAndGet(change);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Client is closed");
        }
    }

    /**
     * Builder for {@link Client}.
     *
     * <p>
     * A network is required, either by name or as explicit addresses. Every other
     * collaborator has a production default.
     */
    public static final class Builder {
        private @Nullable NetworkName networkName;
        private @Nullable Map<String, AccountId> network;
        private @Nullable List<String> mirrorNetwork;
        private ClientConfig config = ClientConfig.defaults();
        private @Nullable NodeChannelFactory channelFactory;
        private @Nullable NodeProbe probe;
        private Sleeper sleeper = Sleeper.SYSTEM;
        private Random random = new Random();
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        /**
         * Uses the seed nodes, mirror address and ledger id of a public network.
         *
         * @param networkName the network
         * @return this builder
         */
        public Builder network(final NetworkName networkName) {
            this.networkName = Objects.requireNonNull(networkName, "networkName");
            this.network = null;
            return this;
        }

        /**
         * Uses an explicit set of consensus nodes.
         *
         * @param addresses {@code host:port} to node account id
         * @return this builder
         */
        public Builder network(final Map<String, AccountId> addresses) {
            this.network = Map.copyOf(Objects.requireNonNull(addresses, "addresses"));
            this.networkName = null;
            return this;
        }

        public Builder mirrorNetwork(final List<String> addresses) {
            this.mirrorNetwork = List.copyOf(addresses);
            return this;
        }

        public Builder config(final ClientConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        /**
         * Applies a parsed configuration file: network, mirror network and operator.
         *
         * @param file the configuration
         * @return this builder
         */
        public Builder configFile(final ClientConfigFile file) {
            if (file.networkName() != null) {
                network(file.networkName());
            } else if (file.network() != null) {
                network(file.network());
            }
            if (file.mirrorNetwork() != null) {
                mirrorNetwork(file.mirrorNetwork());
            } else if (file.mirrorName() != null) {
                mirrorNetwork(List.of(file.mirrorName().mirrorAddress()));
            }
            if (file.operator() != null) {
                config = config.toBuilder().operatorAccountId(file.operator()).build();
            }
            return this;
        }

        public Builder channelFactory(final NodeChannelFactory channelFactory) {
            this.channelFactory = Objects.requireNonNull(channelFactory, "channelFactory");
            return this;
        }

        public Builder probe(final NodeProbe probe) {
            this.probe = Objects.requireNonNull(probe, "probe");
            return this;
        }

        public Builder sleeper(final Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        public Builder random(final Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Builds the client.
         *
         * @return a new client
         * @throws ConfigurationException if no network was given
         */
        public Client build() {
            if (networkName == null && network == null) {
                throw new ConfigurationException("A client needs a network: a network name or node addresses");
            }
            return new Client(this);
        }
    }
}
