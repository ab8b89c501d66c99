/**
 * AssertJ assertions for Result values.
 *
 * <ul>
 *   <li>{@link com.ryuqq.expected.testkit.assertion.ResultAssertions} - Entry points</li>
 *   <li>{@link com.ryuqq.expected.testkit.assertion.ResultAssert} - Fluent Result checks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.testkit.assertion;
