package com.ryuqq.expected.core.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Result 계약 위반 (프로그래머 오류).
 *
 * <p>선언된 ErrorSet에 속하지 않는 오류, 값도 오류도 없는 Result,
 * 누락된 forward 콜백 등 호출 측 코드의 결함을 나타냅니다.</p>
 *
 * <p><strong>주의:</strong> 이 예외는 기대 오류(expected error)가 아닙니다.
 * 기대 오류는 {@code Result}의 {@code Err} 상태에 값으로 담기며,
 * 이 예외는 복구나 재시도 대상이 아닙니다.</p>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class InvariantViolationException extends IllegalStateException {

    private final List<Object> offendingErrors;

    /**
     * 위반 원인이 되는 오류 값 없이 생성.
     *
     * @param message 위반 설명
     */
    public InvariantViolationException(String message) {
        super(message);
        this.offendingErrors = List.of();
    }

    /**
     * 위반 원인이 되는 오류 값과 함께 생성.
     *
     * <p>메시지 끝에 오류 목록이 덧붙여집니다.</p>
     *
     * @param message 위반 설명
     * @param offendingErrors 문제가 된 오류 값 (null 요소 허용)
     */
    public InvariantViolationException(String message, List<?> offendingErrors) {
        super(message + ": " + offendingErrors);
        // null 요소 허용 (List.copyOf 불가)
        this.offendingErrors = Collections.unmodifiableList(new ArrayList<>(offendingErrors));
    }

    /**
     * 위반을 일으킨 오류 값 조회.
     *
     * @return 오류 값 목록 (없으면 빈 목록)
     */
    public List<Object> offendingErrors() {
        return offendingErrors;
    }
}
