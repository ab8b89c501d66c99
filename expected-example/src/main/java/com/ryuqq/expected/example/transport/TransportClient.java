package com.ryuqq.expected.example.transport;

import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * HTTP 응답을 Result로 변환하는 클라이언트.
 *
 * <p><strong>상태 코드 매핑:</strong></p>
 * <ul>
 *   <li>200 → 성공 (HttpResponse)</li>
 *   <li>401 → {@link Unauthorized}</li>
 *   <li>400 → 본문 "errors" 항목마다 {@link ValidationError}</li>
 *   <li>그 외 → {@link IllegalStateException} (기대 오류가 아님)</li>
 * </ul>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class TransportClient {

    /**
     * 전송 계층이 반환할 수 있는 기대 오류.
     */
    public static final ErrorSet<TransportError> TRANSPORT_ERRORS = ErrorSet.sealed(TransportError.class);

    private static final Logger log = LoggerFactory.getLogger(TransportClient.class);
    private final HttpTransport transport;

    /**
     * 생성자.
     *
     * @param transport HTTP 전송 구현
     * @throws IllegalArgumentException transport가 null인 경우
     */
    public TransportClient(HttpTransport transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        this.transport = transport;
    }

    /**
     * POST 요청 후 Result로 변환.
     *
     * @param path 요청 경로
     * @param body 요청 본문
     * @return 성공 응답 또는 전송 오류
     * @throws IllegalStateException 예상하지 못한 상태 코드인 경우
     */
    public Result<HttpResponse, TransportError> post(String path, Map<String, Object> body) {
        HttpResponse response = transport.post(path, body);
        log.debug("POST {} -> {}", path, response.statusCode());

        switch (response.statusCode()) {
            case 200:
                return TRANSPORT_ERRORS.success(response);
            case 401:
                return TRANSPORT_ERRORS.failure(new Unauthorized());
            case 400:
                return TRANSPORT_ERRORS.failures(parseValidationErrors(path, response));
            default:
                throw new IllegalStateException(
                    "Unexpected status code: " + response.statusCode() + " (path: " + path + ")"
                );
        }
    }

    private List<ValidationError> parseValidationErrors(String path, HttpResponse response) {
        Object errors = response.body().get("errors");
        if (!(errors instanceof List<?> entries) || entries.isEmpty()) {
            throw new IllegalStateException("400 response without validation errors (path: " + path + ")");
        }
        List<ValidationError> parsed = new ArrayList<>(entries.size());
        for (Object entry : entries) {
            if (!(entry instanceof Map<?, ?> map)) {
                throw new IllegalStateException("Malformed validation error entry: " + entry);
            }
            parsed.add(ValidationError.fromMap(map));
        }
        return parsed;
    }
}
