package com.ryuqq.expected.core.result;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;

import java.util.List;

/**
 * 실패 결과.
 *
 * <p>하나 이상의 기대 오류를 발생 순서대로 담습니다.
 * 모든 오류는 생성 시점에 {@code errorSet} 멤버십을 검증받습니다.</p>
 *
 * @param errorSet 선언된 오류 집합
 * @param errors 기대 오류 목록 (비어 있을 수 없음, 불변 복사본으로 보관)
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record Err<T, E>(
    ErrorSet<E> errorSet,
    List<E> errors
) implements Result<T, E> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorSet이 null인 경우
     * @throws InvariantViolationException errors가 비어 있거나 선언되지 않은 오류가 있는 경우
     */
    public Err {
        if (errorSet == null) {
            throw new IllegalArgumentException("errorSet cannot be null");
        }
        if (errors == null || errors.isEmpty()) {
            throw new InvariantViolationException(
                "Result must have either a value or errors (value: null, errors: " + errors + ")"
            );
        }
        errors = errorSet.requireMembers(errors, "Unexpected errors");
    }

    /**
     * 실패 상태에서는 값이 없습니다.
     *
     * @throws InvariantViolationException 항상 (메시지에 전체 오류 목록 포함)
     */
    @Override
    public T value() {
        throw new InvariantViolationException("Unhandled expected errors", errors);
    }
}
