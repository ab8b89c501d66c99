package com.ryuqq.expected.example.transport;

import java.util.Map;

/**
 * HTTP 전송 SPI.
 *
 * <p>실제 HTTP 클라이언트는 이 인터페이스를 구현하는 외부 어댑터입니다.</p>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public interface HttpTransport {

    /**
     * POST 요청.
     *
     * @param path 요청 경로 (예: /auth/login)
     * @param body 요청 본문
     * @return 응답 (상태 코드와 무관하게 반환)
     */
    HttpResponse post(String path, Map<String, Object> body);
}
