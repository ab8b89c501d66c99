/**
 * Result container package.
 *
 * <p>This package defines the sealed {@code Result} hierarchy carrying either a
 * success value or a non-empty list of expected errors constrained by an
 * {@link com.ryuqq.expected.core.errorset.ErrorSet}.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.expected.core.result.Result} - Sealed interface (permits Ok, Err)</li>
 * </ul>
 *
 * <h2>Result Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.expected.core.result.Ok} - Exactly one success value</li>
 *   <li>{@link com.ryuqq.expected.core.result.Err} - Ordered, non-empty list of declared errors</li>
 * </ul>
 *
 * <h2>Forwarding</h2>
 * <p>{@code forward} re-declares a Result over another error set, remapping each
 * error once and re-validating membership in the destination set.</p>
 * <pre>
 * Result&lt;AuthToken, LoginError&gt; login = response.forward(LOGIN_ERRORS,
 *     r -&gt; AuthToken.parse(r.body()),
 *     e -&gt; e instanceof Unauthorized ? new InvalidCredentials() : e);
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Exclusivity:</strong> a Result is Ok or Err, never both and never neither</li>
 *   <li><strong>Closed set:</strong> every error is checked against the declared ErrorSet at construction</li>
 *   <li><strong>Immutability:</strong> map and forward return new Result values</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.core.result;
