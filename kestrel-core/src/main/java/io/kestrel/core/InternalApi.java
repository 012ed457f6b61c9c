// SPDX-License-Identifier: MIT OR Apache-2.0
package io.kestrel.core;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a type or method that is public only so other Kestrel packages can reach it.
 *
 * <p>Annotated elements are implementation details of the SDK and may change or
 * disappear between releases without notice. Most of them live in an
 * {@code internal} package.
 *
 * @since 0.1.0
 */
@Documented
@Retention(RetentionPolicy.CLASS)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.CONSTRUCTOR, ElementType.FIELD})
public @interface InternalApi {
}
