package com.ryuqq.expected.example.transport;

/**
 * 전송 계층 기대 오류.
 *
 * @author Expected Team
 * @since 1.0.0
 */
public sealed interface TransportError permits Unauthorized, ValidationError {
}
