package com.ryuqq.result.core.combinator;

/**
 * 예외를 던질 수 있는 함수.
 *
 * <p>{@link Results#bindTryCatch}에 넘기는 외부 연산의 형태입니다.
 * 검사 예외(checked exception)를 던지는 API를 람다로 그대로 감쌀 수 있습니다.</p>
 *
 * @param <T> 입력 타입
 * @param <R> 반환 타입
 * @param <X> 던질 수 있는 예외 타입
 * @author Result Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ThrowingFunction<T, R, X extends Exception> {

    /**
     * 함수 실행.
     *
     * @param input 입력 값
     * @return 결과 값
     * @throws X 연산 실패 시
     */
    R apply(T input) throws X;
}
