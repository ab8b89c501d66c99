package com.ryuqq.expected.async;

/**
 * AsyncResults 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>awaitTimeoutMs: {@link AsyncResults#await} 최대 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author Expected Team
 * @since 1.0.0
 * @param awaitTimeoutMs 최대 대기 시간 (밀리초, 양수여야 함)
 */
public record AsyncResultsConfig(long awaitTimeoutMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: awaitTimeoutMs=30000ms (30초)</p>
     */
    public AsyncResultsConfig() {
        this(30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException awaitTimeoutMs가 양수가 아닌 경우
     */
    public AsyncResultsConfig {
        if (awaitTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "awaitTimeoutMs must be positive (current: " + awaitTimeoutMs + ")"
            );
        }
    }

    /**
     * awaitTimeoutMs만 변경한 새 인스턴스 생성.
     *
     * @param awaitTimeoutMs 새로운 최대 대기 시간 (밀리초)
     * @return 새 AsyncResultsConfig 인스턴스
     */
    public AsyncResultsConfig withAwaitTimeoutMs(long awaitTimeoutMs) {
        return new AsyncResultsConfig(awaitTimeoutMs);
    }
}
