/**
 * Contract violation package.
 *
 * <p>Two error tiers are kept strictly apart:</p>
 * <ul>
 *   <li><strong>Expected errors:</strong> domain values carried inside
 *       {@code Result} and validated against a declared {@code ErrorSet}</li>
 *   <li><strong>Contract violations:</strong> programmer defects reported through
 *       {@link com.ryuqq.expected.core.contract.InvariantViolationException}</li>
 * </ul>
 *
 * <p>A contract violation is raised at the point it happens and is never
 * converted into an expected error.</p>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.core.contract;
