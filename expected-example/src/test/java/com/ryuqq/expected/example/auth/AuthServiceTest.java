package com.ryuqq.expected.example.auth;

import com.ryuqq.expected.core.result.Result;
import com.ryuqq.expected.example.transport.HttpResponse;
import com.ryuqq.expected.example.transport.HttpTransport;
import com.ryuqq.expected.example.transport.TransportClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static com.ryuqq.expected.testkit.assertion.ResultAssertions.assertContractViolation;
import static com.ryuqq.expected.testkit.assertion.ResultAssertions.assertThatResult;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * AuthService 유닛 테스트.
 *
 * <p>전송 오류가 로그인 오류로 다시 선언되는지 검증합니다:</p>
 * <ul>
 *   <li>200 → AuthToken</li>
 *   <li>401 → InvalidCredentials</li>
 *   <li>400 email-not-confirmed → EmailNotConfirmed</li>
 *   <li>400 기타 코드 → 계약 위반</li>
 * </ul>
 *
 * @author Expected Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AuthServiceTest {

    @Mock
    private HttpTransport transport;

    private AuthService authService;

    @BeforeEach
    void setUp() {
        authService = new AuthService(new TransportClient(transport));
    }

    @Test
    void login_Status200_ReturnsToken() {
        // given
        when(transport.post(eq("/auth/login"), any())).thenReturn(HttpResponse.of(200, Map.of("token", "abc")));

        // when
        Result<AuthToken, LoginError> result = authService.login("user", "secret");

        // then
        assertThatResult(result)
            .hasValue(new AuthToken("abc"))
            .hasErrorSet(AuthService.LOGIN_ERRORS);
        verify(transport).post("/auth/login", Map.of("login", "user", "password", "secret"));
    }

    @Test
    void login_Status401_ReturnsInvalidCredentials() {
        // given
        when(transport.post(any(), any())).thenReturn(HttpResponse.of(401, null));

        // when
        Result<AuthToken, LoginError> result = authService.login("user", "wrong");

        // then
        assertThatResult(result)
            .hasSingleError(InvalidCredentials.class)
            .doesNotHaveError(EmailNotConfirmed.class);
    }

    @Test
    void login_EmailNotConfirmed_ReturnsEmailNotConfirmed() {
        // given
        when(transport.post(any(), any())).thenReturn(HttpResponse.of(400, Map.of("errors", List.of(
            Map.of("code", AuthService.EMAIL_NOT_CONFIRMED_CODE)
        ))));

        // when
        Result<AuthToken, LoginError> result = authService.login("user", "secret");

        // then
        assertThatResult(result).hasErrorsExactly(new EmailNotConfirmed());
    }

    @Test
    void login_OtherValidationError_IsContractViolation() {
        // given
        when(transport.post(any(), any())).thenReturn(HttpResponse.of(400, Map.of("errors", List.of(
            Map.of("code", "required", "field", "login")
        ))));

        // when & then
        assertContractViolation(() -> authService.login("", "secret"))
            .hasMessageContaining("Cannot forward unexpected errors")
            .hasMessageContaining("code=required");
    }

    @Test
    void login_SuccessWithoutToken_PropagatesParseFailure() {
        // given
        when(transport.post(any(), any())).thenReturn(HttpResponse.of(200, Map.of()));

        // when & then
        assertThatThrownBy(() -> authService.login("user", "secret"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("token cannot be null");
    }

    @Test
    void login_NullPassword_ThrowsException() {
        // when & then
        assertThatThrownBy(() -> authService.login("user", null))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(transport);
    }
}
