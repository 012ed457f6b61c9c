// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc.internal;

import io.grpc.Attributes;
import io.grpc.EquivalentAddressGroup;
import io.grpc.NameResolver;
import io.kestrel.core.InternalApi;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Name resolver that always resolves to a fixed list of endpoints.
 *
 * <p>
 * Lets one channel balance over all addresses of a node with the
 * {@code round_robin} load balancing policy.
 */
@InternalApi
public final class StaticAddressNameResolver extends NameResolver {

    /** URI scheme of targets handled by {@link Factory}. */
    public static final String SCHEME = "kestrel-static";

    private final String authority;
    private final List<EquivalentAddressGroup> addresses;

    StaticAddressNameResolver(final String authority, final List<EquivalentAddressGroup> addresses) {
        this.authority = authority;
        this.addresses = List.copyOf(addresses);
    }

    @Override
    public String getServiceAuthority() {
        return authority;
    }

    @Override
    public void start(final Listener2 listener) {
        listener.onResult(ResolutionResult.newBuilder()
                .setAddresses(addresses)
                .setAttributes(Attributes.EMPTY)
                .build());
    }

    @Override
    public void shutdown() {
        // nothing to release
    }

    /**
     * Returns the channel target to use with a {@link Factory}.
     *
     * @param endpoints the endpoints the factory resolves to
     * @return a target URI string
     */
    public static String target(final Collection<String> endpoints) {
        return SCHEME + ":///" + Endpoints.host(endpoints.iterator().next());
    }

    /**
     * Creates {@link StaticAddressNameResolver}s for one fixed set of endpoints.
     */
    public static final class Factory extends NameResolver.Factory {

        private final String authority;
        private final List<EquivalentAddressGroup> addresses;

        /**
         * Creates a factory.
         *
         * @param endpoints the {@code host:port} endpoints to resolve to, at least one
         */
        public Factory(final Collection<String> endpoints) {
            if (endpoints.isEmpty()) {
                throw new IllegalArgumentException("At least one endpoint is required");
            }
            final List<EquivalentAddressGroup> groups = new ArrayList<>(endpoints.size());
            for (String endpoint : endpoints) {
                groups.add(new EquivalentAddressGroup(Endpoints.toSocketAddress(endpoint)));
            }
            this.authority = endpoints.iterator().next();
            this.addresses = groups;
        }

        @Override
        public NameResolver newNameResolver(final URI targetUri, final NameResolver.Args args) {
            if (!SCHEME.equals(targetUri.getScheme())) {
                return null;
            }
            return new StaticAddressNameResolver(authority, addresses);
        }

        @Override
        public String getDefaultScheme() {
            return SCHEME;
        }
    }
}
