package com.ryuqq.expected.core.result;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * ErrorSet 간 Result 전달.
 *
 * <p>arity와 무관하게 하나의 구현으로 동작합니다.
 * arity는 target ErrorSet이 들고 있는 variant 개수일 뿐, 알고리즘 차이가 아닙니다.</p>
 *
 * @author Expected Team
 * @since 1.0.0
 */
final class ResultForwarding {

    // Utility class - prevent instantiation
    private ResultForwarding() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static <T, E, U, F> Result<U, F> forward(Result<T, E> source,
                                             ErrorSet<F> target,
                                             Function<? super T, ? extends U> success,
                                             Function<? super E, ?> failure) {
        if (target == null) {
            throw new IllegalArgumentException("target ErrorSet cannot be null");
        }
        if (success == null && failure == null) {
            throw new InvariantViolationException("Either success or failure callback should be provided");
        }

        if (source instanceof Ok<T, E> ok) {
            if (success == null) {
                throw new InvariantViolationException(
                    "Cannot forward a successful result without a success callback (value: " + ok.value() + ")"
                );
            }
            return new Ok<>(target, success.apply(ok.value()));
        }

        // sealed: Ok가 아니면 Err (생성자가 비어 있지 않음을 보장)
        Err<T, E> err = (Err<T, E>) source;
        if (failure == null) {
            throw new InvariantViolationException(
                "Cannot forward a failed result without a failure callback", err.errors()
            );
        }

        List<Object> mapped = new ArrayList<>(err.errors().size());
        for (E error : err.errors()) {
            mapped.add(failure.apply(error));
        }
        return new Err<>(target, target.requireMembers(mapped, "Cannot forward unexpected errors"));
    }
}
