package com.ryuqq.expected.example.transport;

/**
 * 401 Unauthorized.
 */
public record Unauthorized() implements TransportError {
}
