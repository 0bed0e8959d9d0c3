package com.ryuqq.result.core.outcome;

import com.ryuqq.result.core.combinator.Results;
import com.ryuqq.result.core.combinator.ThrowingFunction;
import com.ryuqq.result.core.error.ResultError;

import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * 성공 시 값을 가지는 연산 결과.
 *
 * <p>ValueResult는 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, 값 보관</li>
 *   <li>{@link Failure}: 실패, 오류 목록 보관 (값 없음)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 실패로 전이된 결과는 항상 {@link Failure}이며, Failure에는 값 슬롯이
 * 없으므로 이전 값이 남아 있을 수 없습니다. 실패 결과의 {@link #value()}는
 * {@link IllegalStateException}을 발생시킵니다.</p>
 *
 * <p><strong>파이프라인 예시:</strong></p>
 * <pre>
 * ValueResult&lt;String&gt; greeting = ValueResult.success(true)
 *     .transform(ok -&gt; ok ? "Great!" : "Not so great...")
 *     .tap(log::info);
 * </pre>
 *
 * @param <T> 값 타입
 * @author Result Team
 * @since 1.0.0
 */
public sealed interface ValueResult<T> extends Outcome permits ValueResult.Success, ValueResult.Failure {

    /**
     * 값을 가진 성공 결과.
     *
     * @param value 결과 값 (null 허용)
     * @param <T> 값 타입
     */
    record Success<T>(T value) implements ValueResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public List<ResultError> errors() {
            return List.of();
        }
    }

    /**
     * 실패 결과.
     *
     * @param errors 오류 목록 (복사되어 보관됨, null 요소 불가)
     * @param <T> 값 타입
     */
    record Failure<T>(List<ResultError> errors) implements ValueResult<T> {

        /**
         * Compact Constructor.
         *
         * @throws IllegalArgumentException errors가 null이거나 null 요소를 포함한 경우
         */
        public Failure {
            errors = Outcomes.copyErrors(errors);
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Cannot access value of a faulted result");
        }
    }

    /**
     * 값 조회.
     *
     * @return 성공 결과의 값
     * @throws IllegalStateException 실패한 결과인 경우
     */
    T value();

    /**
     * 값을 가진 성공 결과 생성.
     *
     * @param value 결과 값
     * @param <T> 값 타입
     * @return 성공 ValueResult
     */
    static <T> ValueResult<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 기본 오류({@link ResultError#DEFAULT})를 가진 실패 결과 생성.
     *
     * @param <T> 값 타입
     * @return 실패 ValueResult
     */
    static <T> ValueResult<T> failure() {
        return new Failure<>(List.of(ResultError.DEFAULT));
    }

    /**
     * 메시지로 만든 단일 오류를 가진 실패 결과 생성.
     *
     * @param message 오류 메시지
     * @param <T> 값 타입
     * @return 실패 ValueResult
     */
    static <T> ValueResult<T> failure(String message) {
        return new Failure<>(List.of(new ResultError(message)));
    }

    /**
     * 단일 오류를 가진 실패 결과 생성.
     *
     * @param error 오류
     * @param <T> 값 타입
     * @return 실패 ValueResult
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> ValueResult<T> failure(ResultError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Failure<>(List.of(error));
    }

    /**
     * 오류 목록 전체를 가진 실패 결과 생성.
     *
     * @param errors 오류 목록 (비어 있을 수 있음)
     * @param <T> 값 타입
     * @return 실패 ValueResult
     */
    static <T> ValueResult<T> failure(List<ResultError> errors) {
        return new Failure<>(errors);
    }

    /**
     * 예외를 실패 결과로 변환.
     *
     * @param cause 원인 예외
     * @param <T> 값 타입
     * @return {@link ResultError#fromCause(Throwable)}를 가진 실패 ValueResult
     */
    static <T> ValueResult<T> fromCause(Throwable cause) {
        return failure(ResultError.fromCause(cause));
    }

    /**
     * 오류를 덧붙인 실패 결과 반환. 값은 버려집니다.
     *
     * @param error 추가할 오류
     * @return 기존 오류 뒤에 error가 붙은 실패 ValueResult
     * @throws IllegalArgumentException error가 null인 경우
     */
    default ValueResult<T> addError(ResultError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Failure<>(Outcomes.append(errors(), List.of(error)));
    }

    /**
     * 오류 목록을 덧붙인 실패 결과 반환. 값은 버려집니다.
     *
     * @param errors 추가할 오류 목록
     * @return 기존 오류 뒤에 errors가 순서대로 붙은 실패 ValueResult
     * @throws IllegalArgumentException errors가 null인 경우
     */
    default ValueResult<T> addErrors(Collection<ResultError> errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        return new Failure<>(Outcomes.append(errors(), errors));
    }

    /**
     * 다른 결과들의 오류를 합친 결과 반환.
     *
     * <p>실패한 인자가 하나도 없으면 현재 인스턴스(값 포함)를 그대로 반환합니다.</p>
     *
     * @param others 합칠 결과들
     * @return 합쳐진 ValueResult
     */
    default ValueResult<T> combine(Outcome... others) {
        if (!Outcomes.anyFaulted(others)) {
            return this;
        }
        return new Failure<>(Outcomes.append(errors(), Outcomes.faultedErrors(others)));
    }

    /**
     * 값을 버린 {@link Result}로 변환.
     *
     * @return 성공이면 {@link Result#success()}, 실패면 같은 오류를 가진 {@link Result#failure(List)}
     */
    default Result toResult() {
        return isSuccess() ? Result.success() : Result.failure(errors());
    }

    /**
     * @see Results#bind(ValueResult, Function)
     */
    default <U> ValueResult<U> bind(Function<? super T, ValueResult<U>> next) {
        return Results.bind(this, next);
    }

    /**
     * @see Results#bindTryCatch(ValueResult, ThrowingFunction, ResultError)
     */
    default <U> ValueResult<U> bindTryCatch(ThrowingFunction<? super T, ? extends U, ? extends Exception> next,
                                            ResultError fallbackError) {
        return Results.bindTryCatch(this, next, fallbackError);
    }

    /**
     * @see Results#bindTryCatch(ValueResult, ThrowingFunction, Class, ResultError)
     */
    default <U, X extends Exception> ValueResult<U> bindTryCatch(ThrowingFunction<? super T, ? extends U, ? extends X> next,
                                                                 Class<X> exceptionType,
                                                                 ResultError fallbackError) {
        return Results.bindTryCatch(this, next, exceptionType, fallbackError);
    }

    /**
     * @see Results#transform(ValueResult, Function)
     */
    default <U> ValueResult<U> transform(Function<? super T, ? extends U> mapper) {
        return Results.transform(this, mapper);
    }

    /**
     * @see Results#tap(ValueResult, Consumer)
     */
    default ValueResult<T> tap(Consumer<? super T> action) {
        return Results.tap(this, action);
    }
}
