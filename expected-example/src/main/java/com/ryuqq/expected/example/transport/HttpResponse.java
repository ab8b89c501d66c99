package com.ryuqq.expected.example.transport;

import java.util.Map;

/**
 * HTTP 응답.
 *
 * @param statusCode 상태 코드
 * @param body 파싱된 응답 본문 (null이면 빈 Map)
 *
 * @author Expected Team
 * @since 1.0.0
 */
public record HttpResponse(
    int statusCode,
    Map<String, Object> body
) {

    public HttpResponse {
        body = body == null ? Map.of() : Map.copyOf(body);
    }

    public static HttpResponse of(int statusCode, Map<String, Object> body) {
        return new HttpResponse(statusCode, body);
    }
}
