package com.ryuqq.expected.example.profile;

/**
 * 폼 필드 값 오류.
 *
 * @param fieldName 필드 이름
 * @param message 사용자에게 보여줄 메시지
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record InvalidFormField(String fieldName, String message) {
}
