package com.ryuqq.expected.example.auth;

/**
 * 로그인 기대 오류.
 *
 * @author Expected Team
 * @since 1.0.0
 */
public sealed interface LoginError permits InvalidCredentials, EmailNotConfirmed {
}
