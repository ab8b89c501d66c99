/**
 * Expected error set package.
 *
 * <p>{@link com.ryuqq.expected.core.errorset.ErrorSet} is a zero-data descriptor over
 * one to six distinct error variant types. It answers a single question:
 * is this value one of my declared variants?</p>
 *
 * <h2>Declaring a Set</h2>
 * <pre>
 * // explicit variants
 * ErrorSet&lt;TransportError&gt; transport = ErrorSet.of(Unauthorized.class, ValidationError.class);
 *
 * // derived from a sealed interface
 * ErrorSet&lt;LoginError&gt; login = ErrorSet.sealed(LoginError.class);
 * </pre>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.core.errorset;
