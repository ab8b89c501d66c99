package com.ryuqq.expected.core.result;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 기대 오류 집합이 선언된 연산 결과.
 *
 * <p>Result는 두 가지 상태 중 정확히 하나입니다:</p>
 * <ul>
 *   <li>{@link Ok}: 성공 값 하나</li>
 *   <li>{@link Err}: 비어 있지 않은, 순서가 있는 기대 오류 목록</li>
 * </ul>
 *
 * <p>Err에 담긴 모든 오류는 {@link #errorSet()}의 멤버여야 하며,
 * 이는 생성 시점과 {@link #forward forward} 경계마다 검증됩니다.
 * 위반은 {@link InvariantViolationException}으로 즉시 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
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
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가. map/forward는 항상 새 Result를 반환합니다.</p>
 *
 * @param <T> 성공 값 타입
 * @param <E> 오류 공통 상위 타입
 *
 * @author Expected Team
 * @since 1.0.0
 */
public sealed interface Result<T, E> permits Ok, Err {

    /**
     * 오류를 제약하는 ErrorSet 조회.
     *
     * @return ErrorSet (non-null)
     */
    ErrorSet<E> errorSet();

    /**
     * 전체 오류 목록 조회.
     *
     * @return 발생 순서대로의 불변 목록 (성공이면 빈 목록)
     */
    List<E> errors();

    /**
     * 성공 값 조회.
     *
     * @return 성공 값 (non-null)
     * @throws InvariantViolationException 실패 상태인 경우 (메시지에 전체 오류 목록 포함)
     */
    T value();

    /**
     * 성공 결과 생성.
     *
     * @param errorSet 선언된 오류 집합
     * @param value 성공 값
     * @return Ok 인스턴스
     * @throws IllegalArgumentException errorSet이 null인 경우
     * @throws InvariantViolationException value가 null인 경우
     */
    static <T, E> Result<T, E> success(ErrorSet<E> errorSet, T value) {
        return new Ok<>(errorSet, value);
    }

    /**
     * 단일 오류로 실패 결과 생성.
     *
     * @param errorSet 선언된 오류 집합
     * @param error 기대 오류
     * @return Err 인스턴스
     * @throws IllegalArgumentException errorSet이 null인 경우
     * @throws InvariantViolationException error가 선언된 집합의 멤버가 아닌 경우
     */
    static <T, E> Result<T, E> failure(ErrorSet<E> errorSet, E error) {
        return new Err<>(errorSet, Collections.singletonList(error));
    }

    /**
     * 여러 오류로 실패 결과 생성.
     *
     * @param errorSet 선언된 오류 집합
     * @param errors 기대 오류 목록 (순서 보존)
     * @return Err 인스턴스
     * @throws IllegalArgumentException errorSet이 null인 경우
     * @throws InvariantViolationException errors가 비어 있거나 멤버가 아닌 오류가 있는 경우
     */
    static <T, E> Result<T, E> failures(ErrorSet<E> errorSet, List<? extends E> errors) {
        if (errors == null) {
            throw new InvariantViolationException("Failed result must carry at least one error (errors: null)");
        }
        return new Err<>(errorSet, Collections.unmodifiableList(errors));
    }

    default boolean isSuccessful() {
        return this instanceof Ok;
    }

    default boolean isFailed() {
        return this instanceof Err;
    }

    /**
     * 지정한 variant의 첫 번째 오류 조회.
     *
     * @param variant 오류 타입
     * @return 첫 번째 일치 오류, 성공이거나 일치 오류가 없으면 empty
     * @throws IllegalArgumentException variant가 null인 경우
     */
    default <V> Optional<V> findError(Class<V> variant) {
        requireVariant(variant);
        for (E error : errors()) {
            if (variant.isInstance(error)) {
                return Optional.of(variant.cast(error));
            }
        }
        return Optional.empty();
    }

    /**
     * 지정한 variant의 모든 오류 조회.
     *
     * @param variant 오류 타입
     * @return 원래 순서를 유지한 불변 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException variant가 null인 경우
     */
    default <V> List<V> findErrors(Class<V> variant) {
        requireVariant(variant);
        return errors().stream()
            .filter(variant::isInstance)
            .map(variant::cast)
            .toList();
    }

    default boolean hasError(Class<?> variant) {
        return !findErrors(variant).isEmpty();
    }

    /**
     * 오류가 정확히 하나이고 그 오류가 지정한 variant인지 확인.
     *
     * <p>다른 오류가 함께 있으면 false입니다.</p>
     *
     * @param variant 오류 타입
     * @return 전체 오류 수가 1이고 해당 variant이면 true
     * @throws IllegalArgumentException variant가 null인 경우
     */
    default boolean hasSingleError(Class<?> variant) {
        requireVariant(variant);
        List<E> errors = errors();
        return errors.size() == 1 && variant.isInstance(errors.get(0));
    }

    /**
     * 성공 상태 보장.
     *
     * @throws InvariantViolationException 실패 상태인 경우 (메시지에 전체 오류 목록 포함)
     */
    default void ensureSuccess() {
        if (isFailed()) {
            throw new InvariantViolationException("Unhandled expected errors", errors());
        }
    }

    /**
     * 성공 값 변환.
     *
     * <p>실패 상태면 같은 ErrorSet과 오류 목록을 그대로 유지합니다.</p>
     *
     * @param mapper 성공 값 변환 함수
     * @return 새 Result
     * @throws IllegalArgumentException mapper가 null인 경우
     * @throws InvariantViolationException mapper가 null을 반환한 경우
     */
    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (isSuccessful()) {
            return new Ok<>(errorSet(), mapper.apply(value()));
        }
        return new Err<>(errorSet(), errors());
    }

    /**
     * 다른 ErrorSet을 선언한 Result로 전달.
     *
     * <p>하위 계층의 Result(예: transport 오류)를 호출 측이 선언한
     * 오류 집합의 Result로 다시 표현할 때 사용합니다.</p>
     *
     * <p><strong>처리 규칙:</strong></p>
     * <ul>
     *   <li>성공: success(value)를 target의 Ok로 감쌈 (failure는 호출되지 않음)</li>
     *   <li>실패: 각 오류에 failure를 순서대로 적용한 뒤, 결과 전체를 target 멤버십으로 검증</li>
     * </ul>
     *
     * <p><strong>계약 위반 ({@link InvariantViolationException}):</strong></p>
     * <ul>
     *   <li>success와 failure가 모두 null</li>
     *   <li>성공 상태인데 success가 null</li>
     *   <li>실패 상태인데 failure가 null</li>
     *   <li>변환된 오류 중 target의 멤버가 아닌 것이 존재</li>
     * </ul>
     *
     * <pre>
     * return response.forward(LOGIN_ERRORS,
     *     r -&gt; AuthToken.parse(r.body()),
     *     e -&gt; e instanceof Unauthorized ? new InvalidCredentials() : e);
     * </pre>
     *
     * @param target 새로 선언할 오류 집합
     * @param success 성공 값 변환 함수 (생략 시 null)
     * @param failure 오류 변환 함수 (생략 시 null)
     * @return target을 ErrorSet으로 갖는 새 Result
     * @throws IllegalArgumentException target이 null인 경우
     */
    default <U, F> Result<U, F> forward(ErrorSet<F> target,
                                        Function<? super T, ? extends U> success,
                                        Function<? super E, ?> failure) {
        return ResultForwarding.forward(this, target, success, failure);
    }

    /**
     * success 콜백만 지정한 {@link #forward}.
     *
     * <p>실패 상태에서 호출하면 계약 위반입니다.</p>
     */
    default <U, F> Result<U, F> forwardValue(ErrorSet<F> target, Function<? super T, ? extends U> success) {
        return ResultForwarding.forward(this, target, success, null);
    }

    /**
     * failure 콜백만 지정한 {@link #forward}.
     *
     * <p>성공 상태에서 호출하면 계약 위반입니다.</p>
     */
    default <U, F> Result<U, F> forwardErrors(ErrorSet<F> target, Function<? super E, ?> failure) {
        return ResultForwarding.forward(this, target, null, failure);
    }

    private static void requireVariant(Class<?> variant) {
        if (variant == null) {
            throw new IllegalArgumentException("variant cannot be null");
        }
    }
}
