/**
 * Asynchronous Result helpers.
 *
 * <p>A pending Result is a {@code CompletionStage<Result<T, E>>}. This package
 * chains {@code map} and {@code forward} onto such stages and offers a bounded
 * {@code await}. It never schedules work itself.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.expected.async.AsyncResults} - map / forward / await over stages</li>
 *   <li>{@link com.ryuqq.expected.async.AsyncResultsConfig} - Await timeout</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.async;
