package com.ryuqq.expected.core.result;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;

import java.util.List;

/**
 * 성공 결과.
 *
 * @param errorSet 선언된 오류 집합
 * @param value 성공 값 (null 불가)
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record Ok<T, E>(
    ErrorSet<E> errorSet,
    T value
) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorSet이 null인 경우
     * @throws InvariantViolationException value가 null인 경우 (값도 오류도 없는 Result)
     */
    public Ok {
        if (errorSet == null) {
            throw new IllegalArgumentException("errorSet cannot be null");
        }
        if (value == null) {
            throw new InvariantViolationException(
                "Result must have either a value or errors (value: null, errors: [])"
            );
        }
    }

    @Override
    public List<E> errors() {
        return List.of();
    }
}
