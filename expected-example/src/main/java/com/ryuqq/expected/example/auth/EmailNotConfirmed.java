package com.ryuqq.expected.example.auth;

/**
 * 이메일 인증 미완료.
 */
public record EmailNotConfirmed() implements LoginError {
}
