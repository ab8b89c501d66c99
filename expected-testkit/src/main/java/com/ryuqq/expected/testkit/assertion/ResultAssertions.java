package com.ryuqq.expected.testkit.assertion;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.result.Result;
import org.assertj.core.api.AbstractThrowableAssert;
import org.assertj.core.api.Assertions;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;

/**
 * Entry point for Result assertions.
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class ResultAssertions {

    // Utility class - prevent instantiation
    private ResultAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static <T, E> ResultAssert<T, E> assertThatResult(Result<T, E> actual) {
        return new ResultAssert<>(actual);
    }

    /**
     * Verifies the call fails with a contract violation.
     *
     * @param call code expected to violate a Result contract
     * @return throwable assertion for further message checks
     */
    public static AbstractThrowableAssert<?, ? extends Throwable> assertContractViolation(ThrowingCallable call) {
        return Assertions.assertThatThrownBy(call).isInstanceOf(InvariantViolationException.class);
    }
}
