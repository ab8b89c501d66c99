package com.ryuqq.expected.testkit.assertion;

import com.ryuqq.expected.core.errorset.ErrorSet;
import com.ryuqq.expected.core.result.Result;
import org.assertj.core.api.AbstractAssert;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * AssertJ assertions for {@link Result}.
 *
 * <p>Failure messages always include the full error list, so a broken
 * expectation points straight at the unexpected error.</p>
 *
 * <pre>
 * assertThatResult(authService.login("user", "wrong"))
 *     .isFailed()
 *     .hasSingleError(InvalidCredentials.class);
 * </pre>
 *
 * @param <T> success value type
 * @param <E> error supertype
 *
 * @author Expected Team
 * @since 1.0.0
 */
public class ResultAssert<T, E> extends AbstractAssert<ResultAssert<T, E>, Result<T, E>> {

    protected ResultAssert(Result<T, E> actual) {
        super(actual, ResultAssert.class);
    }

    public ResultAssert<T, E> isSuccessful() {
        isNotNull();
        if (!actual.isSuccessful()) {
            failWithMessage("Expected successful result but was failed with errors: %s", actual.errors());
        }
        return this;
    }

    public ResultAssert<T, E> isFailed() {
        isNotNull();
        if (!actual.isFailed()) {
            failWithMessage("Expected failed result but was successful with value: %s", actual.value());
        }
        return this;
    }

    /**
     * Verifies the result is successful and holds the given value.
     *
     * @param expected expected success value
     * @return this assertion
     */
    public ResultAssert<T, E> hasValue(T expected) {
        isSuccessful();
        if (!Objects.equals(actual.value(), expected)) {
            failWithMessage("Expected value <%s> but was <%s>", expected, actual.value());
        }
        return this;
    }

    public ResultAssert<T, E> hasError(Class<?> variant) {
        isFailed();
        if (!actual.hasError(variant)) {
            failWithMessage("Expected an error of type %s but errors were: %s",
                variant.getSimpleName(), actual.errors());
        }
        return this;
    }

    public ResultAssert<T, E> doesNotHaveError(Class<?> variant) {
        isNotNull();
        if (actual.hasError(variant)) {
            failWithMessage("Expected no error of type %s but errors were: %s",
                variant.getSimpleName(), actual.errors());
        }
        return this;
    }

    /**
     * Verifies the result failed with exactly one error, of the given variant.
     *
     * @param variant expected error type
     * @return this assertion
     */
    public ResultAssert<T, E> hasSingleError(Class<?> variant) {
        isFailed();
        if (!actual.hasSingleError(variant)) {
            failWithMessage("Expected a single error of type %s but errors were: %s",
                variant.getSimpleName(), actual.errors());
        }
        return this;
    }

    /**
     * Verifies the exact error list, order included.
     *
     * @param expected expected errors
     * @return this assertion
     */
    public ResultAssert<T, E> hasErrorsExactly(Object... expected) {
        isFailed();
        List<Object> expectedList = Arrays.asList(expected);
        if (!actual.errors().equals(expectedList)) {
            failWithMessage("Expected errors %s but were %s", expectedList, actual.errors());
        }
        return this;
    }

    public ResultAssert<T, E> hasErrorSet(ErrorSet<?> expected) {
        isNotNull();
        if (!actual.errorSet().equals(expected)) {
            failWithMessage("Expected error set %s but was %s", expected, actual.errorSet());
        }
        return this;
    }
}
