package com.ryuqq.result.core.combinator;

import com.ryuqq.result.core.error.ResultError;
import com.ryuqq.result.core.outcome.Result;
import com.ryuqq.result.core.outcome.ValueResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Result / ValueResult 조합 함수 모음.
 *
 * <p>모든 함수는 상태가 없으며 입력 결과를 변경하지 않습니다.</p>
 *
 * <p><strong>제공 기능:</strong></p>
 * <ul>
 *   <li>{@code match}: 성공/실패 중 정확히 한 분기 실행</li>
 *   <li>{@code map}: 성공/실패 분기 중 하나의 반환값으로 변환</li>
 *   <li>{@code bind}: 성공이면 다음 단계 실행, 실패면 오류를 그대로 전달 (short-circuit)</li>
 *   <li>{@code bindTryCatch}: 예외를 던지는 외부 연산을 결과로 변환하는 경계</li>
 *   <li>{@code transform}: 성공 값만 변환</li>
 *   <li>{@code tap}: 결과를 바꾸지 않고 부수 효과 실행</li>
 * </ul>
 *
 * <p><strong>Railway 예시:</strong></p>
 * <pre>
 * ValueResult&lt;Invoice&gt; invoice = Results.bind(
 *     Results.bindTryCatch(parseOrder(json), repository::save, ResultError.of("Save failed", 500)),
 *     invoiceService::issue
 * );
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class Results {

    private static final Logger log = LoggerFactory.getLogger(Results.class);

    // Utility class - prevent instantiation
    private Results() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태에 따라 정확히 한 분기를 실행.
     *
     * @param result 대상 결과
     * @param onSuccess 성공 시 실행
     * @param onFailure 실패 시 오류 목록과 함께 실행
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static void match(Result result, Runnable onSuccess, Consumer<List<ResultError>> onFailure) {
        requireNonNull(result, "result");
        requireNonNull(onSuccess, "onSuccess");
        requireNonNull(onFailure, "onFailure");

        if (result.isSuccess()) {
            onSuccess.run();
        } else {
            onFailure.accept(result.errors());
        }
    }

    /**
     * 상태에 따라 정확히 한 분기를 실행. 성공 시 값을 전달합니다.
     *
     * @param result 대상 결과
     * @param onSuccess 성공 시 값과 함께 실행
     * @param onFailure 실패 시 오류 목록과 함께 실행
     * @param <T> 값 타입
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T> void match(ValueResult<T> result,
                                 Consumer<? super T> onSuccess,
                                 Consumer<List<ResultError>> onFailure) {
        requireNonNull(result, "result");
        requireNonNull(onSuccess, "onSuccess");
        requireNonNull(onFailure, "onFailure");

        if (result.isSuccess()) {
            onSuccess.accept(result.value());
        } else {
            onFailure.accept(result.errors());
        }
    }

    /**
     * 상태에 따라 선택된 분기의 반환값을 돌려줌.
     *
     * @param result 대상 결과
     * @param onSuccess 성공 시 호출
     * @param onFailure 실패 시 오류 목록과 함께 호출
     * @param <X> 반환 타입
     * @return 선택된 분기의 반환값
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <X> X map(Result result,
                            Supplier<? extends X> onSuccess,
                            Function<List<ResultError>, ? extends X> onFailure) {
        requireNonNull(result, "result");
        requireNonNull(onSuccess, "onSuccess");
        requireNonNull(onFailure, "onFailure");

        return result.isSuccess() ? onSuccess.get() : onFailure.apply(result.errors());
    }

    /**
     * 상태에 따라 선택된 분기의 반환값을 돌려줌. 성공 시 값을 전달합니다.
     *
     * @param result 대상 결과
     * @param onSuccess 성공 시 값과 함께 호출
     * @param onFailure 실패 시 오류 목록과 함께 호출
     * @param <T> 값 타입
     * @param <X> 반환 타입
     * @return 선택된 분기의 반환값
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public static <T, X> X map(ValueResult<T> result,
                               Function<? super T, ? extends X> onSuccess,
                               Function<List<ResultError>, ? extends X> onFailure) {
        requireNonNull(result, "result");
        requireNonNull(onSuccess, "onSuccess");
        requireNonNull(onFailure, "onFailure");

        return result.isSuccess() ? onSuccess.apply(result.value()) : onFailure.apply(result.errors());
    }

    /**
     * 다음 단계를 연결.
     *
     * <p>입력이 성공이면 next의 결과를 그대로 반환하고, 실패면 next를 호출하지 않고
     * 입력의 오류를 가진 새 실패 결과를 반환합니다.</p>
     *
     * @param input 입력 결과
     * @param next 다음 단계
     * @param <T> 입력 값 타입
     * @param <U> 출력 값 타입
     * @return next의 결과 또는 오류가 전달된 실패 결과
     * @throws IllegalArgumentException 인자가 null이거나 next가 null을 반환한 경우
     */
    public static <T, U> ValueResult<U> bind(ValueResult<T> input, Function<? super T, ValueResult<U>> next) {
        requireNonNull(input, "input");
        requireNonNull(next, "next");

        if (input.isFaulted()) {
            return ValueResult.failure(input.errors());
        }
        ValueResult<U> output = next.apply(input.value());
        requireNonNull(output, "bound function result");
        return output;
    }

    /**
     * 예외를 던지는 연산을 연결. 모든 {@link Exception}을 오류로 변환합니다.
     *
     * @param input 입력 결과
     * @param next 예외를 던질 수 있는 다음 단계
     * @param fallbackError 예외 발생 시 사용할 오류
     * @param <T> 입력 값 타입
     * @param <U> 출력 값 타입
     * @return 성공 값, 변환된 오류, 또는 전달된 입력 오류를 가진 결과
     * @see #bindTryCatch(ValueResult, ThrowingFunction, Class, ResultError)
     */
    public static <T, U> ValueResult<U> bindTryCatch(ValueResult<T> input,
                                                     ThrowingFunction<? super T, ? extends U, ? extends Exception> next,
                                                     ResultError fallbackError) {
        return bindTryCatch(input, next, Exception.class, fallbackError);
    }

    /**
     * 예외를 던지는 연산을 연결. 지정한 타입의 예외만 오류로 변환합니다.
     *
     * <p>입력이 성공이면 next를 실행합니다:</p>
     * <ul>
     *   <li>정상 반환: 반환값을 가진 성공 결과</li>
     *   <li>exceptionType 예외: fallbackError 복사본에 잡힌 예외를
     *       {@link ResultError#EXCEPTION_METADATA_KEY} 메타데이터로 붙인 실패 결과</li>
     *   <li>그 외 예외: 변환하지 않고 그대로 전파</li>
     * </ul>
     *
     * <p>입력이 실패면 next를 호출하지 않고 입력의 오류를 전달합니다.
     * fallbackError 자체는 변경되지 않으므로 상수로 재사용할 수 있습니다.</p>
     *
     * @param input 입력 결과
     * @param next 예외를 던질 수 있는 다음 단계
     * @param exceptionType 오류로 변환할 예외 타입
     * @param fallbackError 예외 발생 시 사용할 오류
     * @param <T> 입력 값 타입
     * @param <U> 출력 값 타입
     * @param <X> 변환 대상 예외 타입
     * @return 성공 값, 변환된 오류, 또는 전달된 입력 오류를 가진 결과
     * @throws IllegalArgumentException 인자가 null인 경우, 또는 fallbackError에 이미 예외 메타데이터 키가 있는 경우
     */
    public static <T, U, X extends Exception> ValueResult<U> bindTryCatch(
        ValueResult<T> input,
        ThrowingFunction<? super T, ? extends U, ? extends X> next,
        Class<X> exceptionType,
        ResultError fallbackError
    ) {
        requireNonNull(input, "input");
        requireNonNull(next, "next");
        requireNonNull(exceptionType, "exceptionType");
        requireNonNull(fallbackError, "fallbackError");

        if (input.isFaulted()) {
            return ValueResult.failure(input.errors());
        }

        U value;
        try {
            value = next.apply(input.value());
        } catch (Exception e) {
            if (!exceptionType.isInstance(e)) {
                // undeclared checked exceptions included
                throw Results.<RuntimeException>rethrow(e);
            }
            log.debug("Converted {} to error '{}'", e.getClass().getName(), fallbackError.getMessage(), e);
            return ValueResult.failure(fallbackError.withMetadata(ResultError.EXCEPTION_METADATA_KEY, e));
        }
        return ValueResult.success(value);
    }

    /**
     * 성공 값만 변환. 실패면 mapper를 호출하지 않고 오류를 전달합니다.
     *
     * @param input 입력 결과
     * @param mapper 값 변환 함수
     * @param <T> 입력 값 타입
     * @param <U> 출력 값 타입
     * @return 변환된 값을 가진 성공 결과 또는 오류가 전달된 실패 결과
     */
    public static <T, U> ValueResult<U> transform(ValueResult<T> input, Function<? super T, ? extends U> mapper) {
        requireNonNull(input, "input");
        requireNonNull(mapper, "mapper");

        if (input.isFaulted()) {
            return ValueResult.failure(input.errors());
        }
        return ValueResult.success(mapper.apply(input.value()));
    }

    /**
     * 성공이면 값으로 부수 효과를 실행하고, 항상 입력을 그대로 반환.
     *
     * @param input 입력 결과
     * @param action 부수 효과
     * @param <T> 값 타입
     * @return input (같은 인스턴스)
     */
    public static <T> ValueResult<T> tap(ValueResult<T> input, Consumer<? super T> action) {
        requireNonNull(input, "input");
        requireNonNull(action, "action");

        if (input.isSuccess()) {
            action.accept(input.value());
        }
        return input;
    }

    /**
     * 성공이면 부수 효과를 실행하고, 항상 입력을 그대로 반환.
     *
     * @param input 입력 결과
     * @param action 부수 효과
     * @return input (같은 인스턴스)
     */
    public static Result tap(Result input, Runnable action) {
        requireNonNull(input, "input");
        requireNonNull(action, "action");

        if (input.isSuccess()) {
            action.run();
        }
        return input;
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> RuntimeException rethrow(Throwable t) throws E {
        throw (E) t;
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }
}
