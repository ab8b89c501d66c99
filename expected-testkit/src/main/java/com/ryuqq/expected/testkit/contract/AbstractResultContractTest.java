package com.ryuqq.expected.testkit.contract;

import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;

import java.util.List;

/**
 * Abstract base class for Result contract tests.
 *
 * <p>Provides six distinct fixture error variants plus one variant that is never
 * declared, and builds an {@link ErrorSet} of any supported arity from them.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyContractTest extends AbstractResultContractTest {
 *     {@literal @}Test
 *     void undeclaredErrorIsRejected() {
 *         ErrorSet&lt;Object&gt; errors = errorSetOfArity(3);
 *         assertContractViolation(() -&gt; Result.failure(errors, new UnspecifiedFailure("boom")));
 *     }
 * }
 * </pre>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public abstract class AbstractResultContractTest {

    public record Failure1(String message) {
    }

    public record Failure2(String message) {
    }

    public record Failure3(String message) {
    }

    public record Failure4(String message) {
    }

    public record Failure5(String message) {
    }

    public record Failure6(String message) {
    }

    /**
     * Never declared by {@link #errorSetOfArity(int)}.
     */
    public record UnspecifiedFailure(String message) {
    }

    /**
     * Creates an error set declaring {@code Failure1} .. {@code Failure<arity>}.
     *
     * @param arity number of variants (1 ~ 6)
     * @return error set
     * @throws IllegalArgumentException arity is out of range
     */
    protected ErrorSet<Object> errorSetOfArity(int arity) {
        switch (arity) {
            case 1:
                return ErrorSet.of(Failure1.class);
            case 2:
                return ErrorSet.of(Failure1.class, Failure2.class);
            case 3:
                return ErrorSet.of(Failure1.class, Failure2.class, Failure3.class);
            case 4:
                return ErrorSet.of(Failure1.class, Failure2.class, Failure3.class, Failure4.class);
            case 5:
                return ErrorSet.of(Failure1.class, Failure2.class, Failure3.class, Failure4.class, Failure5.class);
            case 6:
                return ErrorSet.of(Failure1.class, Failure2.class, Failure3.class, Failure4.class, Failure5.class,
                    Failure6.class);
            default:
                throw new IllegalArgumentException("arity must be between 1 and " + ErrorSet.MAX_ARITY
                    + " (current: " + arity + ")");
        }
    }

    /**
     * Creates one error instance of the last declared variant for the given arity.
     *
     * @param arity declared arity (1 ~ 6)
     * @param message error message
     * @return fixture error of type {@code Failure<arity>}
     */
    protected Object lastVariantError(int arity, String message) {
        switch (arity) {
            case 1:
                return new Failure1(message);
            case 2:
                return new Failure2(message);
            case 3:
                return new Failure3(message);
            case 4:
                return new Failure4(message);
            case 5:
                return new Failure5(message);
            case 6:
                return new Failure6(message);
            default:
                throw new IllegalArgumentException("arity must be between 1 and " + ErrorSet.MAX_ARITY
                    + " (current: " + arity + ")");
        }
    }

    protected <T> Result<T, Object> failedWith(int arity, Object... errors) {
        return Result.failures(errorSetOfArity(arity), List.of(errors));
    }
}
