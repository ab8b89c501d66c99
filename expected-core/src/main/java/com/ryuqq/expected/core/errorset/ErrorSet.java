package com.ryuqq.expected.core.errorset;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.result.Result;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 기대 오류 집합 디스크립터.
 *
 * <p>연산이 반환할 수 있는 기대 오류(expected error)의 타입을 1~6개까지 선언합니다.
 * 데이터는 갖지 않고 오직 variant 타입 목록만 보관하며,
 * "이 값이 선언된 variant 중 하나인가?"에 답합니다.</p>
 *
 * <p><strong>생성 방법:</strong></p>
 * <ul>
 *   <li>{@code of(c1)} ~ {@code of(c1, ..., c6)}: variant 클래스를 직접 나열</li>
 *   <li>{@link #sealed(Class)}: sealed interface의 permitted subclass로부터 도출</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>variant 개수: 1 ~ {@value #MAX_ARITY}</li>
 *   <li>동일 클래스 중복 선언 불가 (상하위 타입 겹침은 허용, 단지 중복일 뿐)</li>
 *   <li>생성 후 변경 불가</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ErrorSet&lt;LoginError&gt; loginErrors = ErrorSet.of(InvalidCredentials.class, EmailNotConfirmed.class);
 *
 * Result&lt;AuthToken, LoginError&gt; result = loginErrors.failure(new InvalidCredentials());
 * </pre>
 *
 * @param <E> 모든 variant의 공통 상위 타입
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class ErrorSet<E> {

    /**
     * 선언 가능한 최대 variant 개수.
     */
    public static final int MAX_ARITY = 6;

    private final List<Class<? extends E>> variants;

    private ErrorSet(List<Class<? extends E>> variants) {
        if (variants.isEmpty() || variants.size() > MAX_ARITY) {
            throw new IllegalArgumentException(
                "ErrorSet arity must be between 1 and " + MAX_ARITY + " (current: " + variants.size() + ")"
            );
        }
        Set<Class<?>> seen = new HashSet<>();
        for (Class<? extends E> variant : variants) {
            if (variant == null) {
                throw new IllegalArgumentException("ErrorSet variant cannot be null");
            }
            if (!seen.add(variant)) {
                throw new IllegalArgumentException("Duplicate ErrorSet variant: " + variant.getName());
            }
        }
        this.variants = Collections.unmodifiableList(new ArrayList<>(variants));
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1) {
        return create(v1);
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1, Class<? extends E> v2) {
        return create(v1, v2);
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1, Class<? extends E> v2, Class<? extends E> v3) {
        return create(v1, v2, v3);
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1, Class<? extends E> v2, Class<? extends E> v3,
                                     Class<? extends E> v4) {
        return create(v1, v2, v3, v4);
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1, Class<? extends E> v2, Class<? extends E> v3,
                                     Class<? extends E> v4, Class<? extends E> v5) {
        return create(v1, v2, v3, v4, v5);
    }

    public static <E> ErrorSet<E> of(Class<? extends E> v1, Class<? extends E> v2, Class<? extends E> v3,
                                     Class<? extends E> v4, Class<? extends E> v5, Class<? extends E> v6) {
        return create(v1, v2, v3, v4, v5, v6);
    }

    /**
     * sealed interface(또는 sealed class)의 permitted subclass를 variant로 사용하는 ErrorSet 생성.
     *
     * <p>호출 측이 정의한 sealed 타입이 곧 닫힌 오류 집합이 됩니다.
     * permitted subclass 개수 역시 1 ~ {@value #MAX_ARITY} 범위여야 합니다.</p>
     *
     * @param sealedType sealed 오류 타입
     * @param <E> sealed 오류 타입
     * @return ErrorSet 인스턴스
     * @throws IllegalArgumentException sealedType이 null이거나 sealed가 아닌 경우, 또는 arity 범위를 벗어난 경우
     */
    public static <E> ErrorSet<E> sealed(Class<E> sealedType) {
        if (sealedType == null) {
            throw new IllegalArgumentException("sealedType cannot be null");
        }
        if (!sealedType.isSealed()) {
            throw new IllegalArgumentException(sealedType.getName() + " is not a sealed type");
        }
        List<Class<? extends E>> permitted = new ArrayList<>();
        for (Class<?> subclass : sealedType.getPermittedSubclasses()) {
            permitted.add(subclass.asSubclass(sealedType));
        }
        return new ErrorSet<>(permitted);
    }

    @SafeVarargs
    private static <E> ErrorSet<E> create(Class<? extends E>... variants) {
        return new ErrorSet<>(Arrays.asList(variants));
    }

    /**
     * 값이 선언된 variant 중 하나인지 확인.
     *
     * @param error 검사할 값 (null 가능)
     * @return 어느 variant의 인스턴스이면 true, null이거나 해당 없으면 false
     */
    public boolean isMember(Object error) {
        if (error == null) {
            return false;
        }
        for (Class<? extends E> variant : variants) {
            if (variant.isInstance(error)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 값을 이 집합의 오류 타입으로 변환.
     *
     * @param error 변환할 값
     * @return 같은 값 (E 타입)
     * @throws InvariantViolationException 선언되지 않은 오류인 경우
     */
    public E cast(Object error) {
        return requireMembers(Collections.singletonList(error), "Unexpected error").get(0);
    }

    /**
     * 모든 값이 이 집합의 멤버인지 검증하고, 순서를 보존한 불변 목록으로 반환.
     *
     * <p>하나라도 멤버가 아니면 멤버가 아닌 값 전체를 담아 실패합니다.</p>
     *
     * @param errors 검증할 오류 목록 (null 요소 가능)
     * @param context 위반 시 메시지 접두어
     * @return 검증된 오류 목록 (불변)
     * @throws InvariantViolationException 멤버가 아닌 값이 있는 경우
     */
    @SuppressWarnings("unchecked")
    public List<E> requireMembers(List<?> errors, String context) {
        List<Object> unexpected = new ArrayList<>();
        for (Object error : errors) {
            if (!isMember(error)) {
                unexpected.add(error);
            }
        }
        if (!unexpected.isEmpty()) {
            throw new InvariantViolationException(context + " (declared " + this + ")", unexpected);
        }
        return Collections.unmodifiableList(new ArrayList<>((List<E>) errors));
    }

    /**
     * 선언된 variant 목록 조회.
     *
     * @return 선언 순서를 유지한 불변 목록
     */
    public List<Class<? extends E>> variants() {
        return variants;
    }

    /**
     * 선언된 variant 개수.
     *
     * @return 1 ~ {@value #MAX_ARITY}
     */
    public int arity() {
        return variants.size();
    }

    public <T> Result<T, E> success(T value) {
        return Result.success(this, value);
    }

    public <T> Result<T, E> failure(E error) {
        return Result.failure(this, error);
    }

    public <T> Result<T, E> failures(List<? extends E> errors) {
        return Result.failures(this, errors);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ErrorSet<?> other = (ErrorSet<?>) o;
        return variants.equals(other.variants);
    }

    @Override
    public int hashCode() {
        return variants.hashCode();
    }

    @Override
    public String toString() {
        return variants.stream()
            .map(Class::getSimpleName)
            .collect(Collectors.joining(", ", "ErrorSet[", "]"));
    }
}
