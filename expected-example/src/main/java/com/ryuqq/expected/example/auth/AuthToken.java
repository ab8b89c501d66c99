package com.ryuqq.expected.example.auth;

import java.util.Map;

/**
 * 인증 토큰.
 *
 * @param token 토큰 문자열
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record AuthToken(String token) {

    public AuthToken {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("token cannot be null or blank");
        }
    }

    /**
     * 응답 본문에서 토큰 추출.
     *
     * @param body {"token": ...}
     * @return AuthToken 인스턴스
     * @throws IllegalArgumentException token이 없는 경우
     */
    public static AuthToken parse(Map<String, Object> body) {
        Object token = body.get("token");
        return new AuthToken(token == null ? null : token.toString());
    }
}
