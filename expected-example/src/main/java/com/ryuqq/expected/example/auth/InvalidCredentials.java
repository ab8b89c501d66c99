package com.ryuqq.expected.example.auth;

/**
 * 이메일 또는 비밀번호 불일치.
 */
public record InvalidCredentials() implements LoginError {
}
