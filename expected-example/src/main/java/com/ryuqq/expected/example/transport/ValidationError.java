package com.ryuqq.expected.example.transport;

import java.util.Map;

/**
 * 400 응답의 개별 검증 오류.
 *
 * @param code 오류 코드 (예: email-not-confirmed, incorrect-value)
 * @param field 문제가 된 필드 (null 가능)
 * @param message 오류 메시지 (null 가능)
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record ValidationError(
    String code,
    String field,
    String message
) implements TransportError {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code가 null이거나 빈 문자열인 경우
     */
    public ValidationError {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
    }

    /**
     * 응답 본문의 오류 항목으로부터 생성.
     *
     * @param entry {"code": ..., "field": ..., "message": ...}
     * @return ValidationError 인스턴스
     * @throws IllegalArgumentException code가 없는 경우
     */
    public static ValidationError fromMap(Map<?, ?> entry) {
        return new ValidationError(
            stringOrNull(entry.get("code")),
            stringOrNull(entry.get("field")),
            stringOrNull(entry.get("message"))
        );
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
