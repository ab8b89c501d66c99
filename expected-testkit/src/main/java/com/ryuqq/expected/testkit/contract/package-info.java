/**
 * Result contract test support.
 *
 * <p>{@link com.ryuqq.expected.testkit.contract.AbstractResultContractTest} supplies
 * fixture error variants and error sets of every supported arity, so the same
 * contract can be verified for arity 1 through 6.</p>
 *
 * @since 1.0.0
 * @author Expected Team
 */
package com.ryuqq.expected.testkit.contract;
