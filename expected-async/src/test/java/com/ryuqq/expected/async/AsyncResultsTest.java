package com.ryuqq.expected.async;

import com.ryuqq.expected.core.contract.InvariantViolationException;
import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AsyncResults 테스트.
 *
 * @author Expected Team
 * @since 1.0.0
 */
class AsyncResultsTest {

    record Unauthorized() {
    }

    record ValidationError(String code) {
    }

    record InvalidCredentials() {
    }

    record EmailNotConfirmed() {
    }

    private static final ErrorSet<Object> TRANSPORT_ERRORS = ErrorSet.of(Unauthorized.class, ValidationError.class);
    private static final ErrorSet<Object> LOGIN_ERRORS = ErrorSet.of(InvalidCredentials.class, EmailNotConfirmed.class);

    private AsyncResults asyncResults;

    @BeforeEach
    void setUp() {
        asyncResults = new AsyncResults(new AsyncResultsConfig(1000));
    }

    @Test
    void completed_Result_IsAlreadyDone() {
        // Given
        Result<Integer, Object> result = Result.success(TRANSPORT_ERRORS, 10);

        // When
        CompletableFuture<Result<Integer, Object>> stage = AsyncResults.completed(result);

        // Then
        assertThat(stage).isCompletedWithValue(result);
    }

    @Test
    void completed_Null_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> AsyncResults.completed(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void map_CompletedSuccess_AppliesMapper() {
        // Given
        CompletionStage<Result<Integer, Object>> stage = AsyncResults.completed(Result.success(TRANSPORT_ERRORS, 10));

        // When
        Result<String, Object> mapped = asyncResults.await(asyncResults.map(stage, value -> "val: " + value));

        // Then
        assertThat(mapped.value()).isEqualTo("val: 10");
    }

    @Test
    void forward_PendingFailure_RemapsWhenCompleted() {
        // Given
        CompletableFuture<Result<String, Object>> pending = new CompletableFuture<>();
        CompletionStage<Result<String, Object>> login = asyncResults.forward(pending, LOGIN_ERRORS,
            value -> value,
            error -> error instanceof Unauthorized ? new InvalidCredentials() : error);

        // When
        pending.complete(Result.failure(TRANSPORT_ERRORS, new Unauthorized()));
        Result<String, Object> result = asyncResults.await(login);

        // Then
        assertThat(result.hasSingleError(InvalidCredentials.class)).isTrue();
        assertThat(result.errorSet()).isEqualTo(LOGIN_ERRORS);
    }

    @Test
    void forward_CompletedOnOtherThread_RemapsInOrder() throws Exception {
        // Given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            CompletableFuture<Result<String, Object>> response = CompletableFuture.supplyAsync(
                () -> Result.failures(TRANSPORT_ERRORS, List.of(
                    new ValidationError("email-not-confirmed"), new Unauthorized())),
                executor);

            // When
            Result<String, Object> result = asyncResults.await(asyncResults.forward(response, LOGIN_ERRORS,
                value -> value,
                error -> error instanceof Unauthorized ? new InvalidCredentials() : new EmailNotConfirmed()));

            // Then
            assertThat(result.errors()).containsExactly(new EmailNotConfirmed(), new InvalidCredentials());
        } finally {
            executor.shutdown();
            executor.awaitTermination(1, TimeUnit.SECONDS);
        }
    }

    @Test
    void forward_UnexpectedError_AwaitRethrowsInvariantViolation() {
        // Given
        CompletionStage<Result<String, Object>> response =
            AsyncResults.completed(Result.failure(TRANSPORT_ERRORS, new ValidationError("required")));

        // When
        CompletionStage<Result<String, Object>> login =
            asyncResults.forward(response, LOGIN_ERRORS, value -> value, error -> error);

        // Then
        assertThat(login.toCompletableFuture()).isCompletedExceptionally();
        assertThatThrownBy(() -> asyncResults.await(login))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("ValidationError[code=required]");
    }

    @Test
    void forward_MissingFailureCallback_AwaitRethrowsInvariantViolation() {
        // Given
        CompletionStage<Result<String, Object>> response =
            AsyncResults.completed(Result.failure(TRANSPORT_ERRORS, new Unauthorized()));

        // When & Then
        assertThatThrownBy(() -> asyncResults.await(asyncResults.forward(response, LOGIN_ERRORS, value -> value, null)))
            .isInstanceOf(InvariantViolationException.class)
            .hasMessageContaining("without a failure callback");
    }

    @Test
    void await_NotCompleted_ThrowsAfterTimeout() {
        // Given
        AsyncResults shortWait = new AsyncResults(new AsyncResultsConfig(50));
        CompletableFuture<Result<String, Object>> never = new CompletableFuture<>();

        // When & Then
        assertThatThrownBy(() -> shortWait.await(never))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not available within 50ms");
    }

    @Test
    void await_StageFailedWithCheckedException_WrapsCause() {
        // Given
        CompletableFuture<Result<String, Object>> failed = new CompletableFuture<>();
        IOException ioException = new IOException("connection reset");
        failed.completeExceptionally(ioException);

        // When & Then
        assertThatThrownBy(() -> asyncResults.await(failed))
            .isInstanceOf(IllegalStateException.class)
            .hasCause(ioException);
    }

    @Test
    void await_StageCompletedWithNull_ThrowsInvariantViolation() {
        // Given
        CompletableFuture<Result<String, Object>> empty = CompletableFuture.completedFuture(null);

        // When & Then
        assertThatThrownBy(() -> asyncResults.await(empty))
            .isInstanceOf(InvariantViolationException.class);
    }

    @Test
    void constructor_NullConfig_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> new AsyncResults(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config cannot be null");
    }
}
