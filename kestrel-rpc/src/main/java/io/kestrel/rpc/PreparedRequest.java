// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.rpc;

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A wire request built for one node, with the context needed to interpret its response.
 *
 * @param <Q>     the wire request type
 * @param <C>     the context type
 * @param request the wire request
 * @param context data carried from request construction to response parsing, may be {@code null}
 */
public record PreparedRequest<Q, C>(Q request, @Nullable C context) {

    public PreparedRequest {
        Objects.requireNonNull(request, "request");
    }
}
