package com.ryuqq.expected.example.profile;

import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import com.ryuqq.expected.example.transport.TransportClient;
import com.ryuqq.expected.example.transport.TransportError;
import com.ryuqq.expected.example.transport.Unauthorized;
import com.ryuqq.expected.example.transport.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 프로필 수정 서비스.
 *
 * <p>선언 오류: {@link Unauthorized}, {@link InvalidFormField}.
 * Unauthorized는 그대로 통과시키고, code가 incorrect-value인 검증 오류는
 * 필드 오류로 바꿉니다.</p>
 *
 * <p><strong>호출 예시:</strong></p>
 * <pre>
 * Result&lt;Profile, Object&gt; result = profileService.editProfile(profile);
 * if (result.hasError(Unauthorized.class)) {
 *     router.redirectToLoginPage();
 *     return;
 * }
 * for (InvalidFormField field : result.findErrors(InvalidFormField.class)) {
 *     form.setError(field.fieldName(), field.message());
 * }
 * </pre>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class ProfileService {

    public static final ErrorSet<Object> PROFILE_ERRORS = ErrorSet.of(Unauthorized.class, InvalidFormField.class);

    static final String INCORRECT_VALUE_CODE = "incorrect-value";

    private static final Logger log = LoggerFactory.getLogger(ProfileService.class);
    private final TransportClient client;

    public ProfileService(TransportClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        this.client = client;
    }

    /**
     * 프로필 수정.
     *
     * @param profile 수정할 프로필
     * @return 저장된 프로필 또는 오류
     * @throws IllegalArgumentException profile이 null인 경우
     */
    public Result<Profile, Object> editProfile(Profile profile) {
        if (profile == null) {
            throw new IllegalArgumentException("profile cannot be null");
        }
        return client.post("/profile/edit", profile.toMap())
            .forward(PROFILE_ERRORS, response -> Profile.fromMap(response.body()), this::toProfileError);
    }

    private Object toProfileError(TransportError error) {
        if (error instanceof ValidationError validation && INCORRECT_VALUE_CODE.equals(validation.code())) {
            log.debug("Profile field rejected: {}", validation.field());
            return new InvalidFormField(validation.field(), validation.message());
        }
        return error;
    }
}
