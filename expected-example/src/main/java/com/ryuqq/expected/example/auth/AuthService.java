package com.ryuqq.expected.example.auth;

import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import com.ryuqq.expected.example.transport.TransportClient;
import com.ryuqq.expected.example.transport.TransportError;
import com.ryuqq.expected.example.transport.Unauthorized;
import com.ryuqq.expected.example.transport.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 로그인 서비스.
 *
 * <p>전송 오류를 로그인 오류로 다시 선언합니다:</p>
 * <ul>
 *   <li>{@link Unauthorized} → {@link InvalidCredentials}</li>
 *   <li>code가 email-not-confirmed인 {@link ValidationError} → {@link EmailNotConfirmed}</li>
 *   <li>그 외 → 그대로 전달되어 계약 위반으로 실패</li>
 * </ul>
 *
 * <p><strong>호출 예시:</strong></p>
 * <pre>
 * Result&lt;AuthToken, LoginError&gt; result = authService.login("login", "password");
 * if (result.hasError(InvalidCredentials.class)) {
 *     form.setFailure("Password or email are incorrect");
 *     return;
 * }
 * if (result.hasError(EmailNotConfirmed.class)) {
 *     router.redirectToConfirmationPage();
 *     return;
 * }
 * tokenStorage.store(result.value());
 * </pre>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class AuthService {

    public static final ErrorSet<LoginError> LOGIN_ERRORS = ErrorSet.sealed(LoginError.class);

    static final String EMAIL_NOT_CONFIRMED_CODE = "email-not-confirmed";

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    private final TransportClient client;

    public AuthService(TransportClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * 로그인.
     *
     * @param login 로그인 ID
     * @param password 비밀번호
     * @return 토큰 또는 로그인 오류
     * @throws IllegalArgumentException login 또는 password가 null인 경우
     */
    public Result<AuthToken, LoginError> login(String login, String password) {
        if (login == null || password == null) {
            throw new IllegalArgumentException("login and password cannot be null");
        }
        return client.post("/auth/login", Map.of("login", login, "password", password))
            .forward(LOGIN_ERRORS, r -> AuthToken.parse(r.body()), this::toLoginError);
    }

    private Object toLoginError(TransportError error) {
        if (error instanceof Unauthorized) {
            log.debug("Login rejected: {} -> InvalidCredentials", error);
            return new InvalidCredentials();
        }
        if (error instanceof ValidationError validation && EMAIL_NOT_CONFIRMED_CODE.equals(validation.code())) {
            log.debug("Login rejected: {} -> EmailNotConfirmed", error);
            return new EmailNotConfirmed();
        }
        return error;
    }
}
