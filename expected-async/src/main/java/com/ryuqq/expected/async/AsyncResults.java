package com.ryuqq.expected.async;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * {@code CompletionStage<Result<T, E>>}용 헬퍼.
 *
 * <p>비동기 연산이 돌려주는 Result를 기다리지 않고 map/forward를 연결합니다.
 * 스케줄링은 하지 않으며, 콜백은 stage를 완료시킨 스레드에서 실행됩니다.</p>
 *
 * <p><strong>계약 위반 처리:</strong></p>
 * <ul>
 *   <li>forward 중 {@link InvariantViolationException} 발생 시 error 로그 후 stage를 예외 완료</li>
 *   <li>{@link #await}는 래핑 예외를 벗겨 원래 예외를 그대로 던짐</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * CompletionStage&lt;Result&lt;AuthToken, LoginError&gt;&gt; login = asyncResults.forward(
 *     transport.postAsync("/auth/login", body),
 *     LOGIN_ERRORS,
 *     response -&gt; AuthToken.parse(response.body()),
 *     error -&gt; error instanceof Unauthorized ? new InvalidCredentials() : error);
 *
 * Result&lt;AuthToken, LoginError&gt; result = asyncResults.await(login);
 * </pre>
 *
 * @author Expected Team
 * @since 1.0.0
 */
public final class AsyncResults {

    private static final Logger log = LoggerFactory.getLogger(AsyncResults.class);
    private final AsyncResultsConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public AsyncResults() {
        this(new AsyncResultsConfig());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public AsyncResults(AsyncResultsConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 이미 완료된 stage 생성.
     *
     * @param result 결과
     * @return 완료된 CompletableFuture
     * @throws IllegalArgumentException result가 null인 경우
     */
    public static <T, E> CompletableFuture<Result<T, E>> completed(Result<T, E> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        return CompletableFuture.completedFuture(result);
    }

    /**
     * stage 완료 후 {@link Result#map} 적용.
     *
     * @param stage 원본 stage
     * @param mapper 성공 값 변환 함수
     * @return 변환된 Result를 완료값으로 갖는 stage
     */
    public <T, E, U> CompletionStage<Result<U, E>> map(CompletionStage<Result<T, E>> stage,
                                                       Function<? super T, ? extends U> mapper) {
        requireStage(stage);
        return stage.thenApply(result -> requireResult(result).map(mapper));
    }

    /**
     * stage 완료 후 {@link Result#forward} 적용.
     *
     * @param stage 원본 stage
     * @param target 새로 선언할 오류 집합
     * @param success 성공 값 변환 함수 (생략 시 null)
     * @param failure 오류 변환 함수 (생략 시 null)
     * @return 전달된 Result를 완료값으로 갖는 stage
     */
    public <T, E, U, F> CompletionStage<Result<U, F>> forward(CompletionStage<Result<T, E>> stage,
                                                              ErrorSet<F> target,
                                                              Function<? super T, ? extends U> success,
                                                              Function<? super E, ?> failure) {
        requireStage(stage);
        return stage.thenApply(result -> {
            Result<T, E> source = requireResult(result);
            try {
                return source.forward(target, success, failure);
            } catch (InvariantViolationException e) {
                log.error("Contract violation while forwarding {} into {}", source, target, e);
                throw e;
            }
        });
    }

    /**
     * stage 완료를 설정된 시간까지 대기.
     *
     * <p>stage가 예외로 완료되면 래핑을 벗긴 원래 예외를 던집니다.</p>
     *
     * @param stage 대기할 stage
     * @return 완료된 Result
     * @throws IllegalStateException awaitTimeoutMs 내에 완료되지 않은 경우
     * @throws RuntimeException 대기 중 인터럽트된 경우
     */
    public <T, E> Result<T, E> await(CompletionStage<Result<T, E>> stage) {
        requireStage(stage);
        try {
            return requireResult(stage.toCompletableFuture().get(config.awaitTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Await interrupted", e);
        } catch (TimeoutException e) {
            log.warn("Result not available within {}ms", config.awaitTimeoutMs());
            throw new IllegalStateException(
                "Result not available within " + config.awaitTimeoutMs() + "ms", e
            );
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        Throwable unwrapped = cause;
        while (unwrapped instanceof CompletionException && unwrapped.getCause() != null) {
            unwrapped = unwrapped.getCause();
        }
        if (unwrapped instanceof RuntimeException runtime) {
            return runtime;
        }
        if (unwrapped instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Async result completed exceptionally", unwrapped);
    }

    private static void requireStage(CompletionStage<?> stage) {
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }

    private static <T, E> Result<T, E> requireResult(Result<T, E> result) {
        if (result == null) {
            throw new InvariantViolationException("Async stage completed without a Result");
        }
        return result;
    }
}
