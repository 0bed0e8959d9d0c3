package com.ryuqq.result.core.outcome;

import com.ryuqq.result.core.error.ResultError;

import java.util.Collection;
import java.util.List;

/**
 * 값이 없는 연산 결과.
 *
 * <p>Result는 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Success}: 성공, 오류 없음</li>
 *   <li>{@link Failure}: 실패, 오류 목록 보관 (비어 있을 수 있음)</li>
 * </ul>
 *
 * <p><strong>상태 전이:</strong> 성공 → 실패 방향으로만 가능합니다.
 * {@link #addError(ResultError)}, {@link #addErrors(Collection)}, {@link #combine(Outcome...)}는
 * 현재 인스턴스를 바꾸지 않고 새 인스턴스를 반환하며, 기존 오류를 제거하지 않습니다.</p>
 *
 * <p><strong>변환 팩토리:</strong></p>
 * <pre>
 * Result.of(true);                     // success()
 * Result.of(false);                    // failure() - [DEFAULT]
 * Result.failure(error);               // 단일 오류
 * Result.failure(List.of(e1, e2));     // 오류 목록
 * Result.fromCause(exception);         // 예외를 오류로 감싸서 실패
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
public sealed interface Result extends Outcome permits Result.Success, Result.Failure {

    /**
     * 성공 결과.
     */
    record Success() implements Result {

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
     */
    record Failure(List<ResultError> errors) implements Result {

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
    }

    /**
     * 성공 결과 생성.
     *
     * @return 성공 Result
     */
    static Result success() {
        return new Success();
    }

    /**
     * 기본 오류({@link ResultError#DEFAULT})를 가진 실패 결과 생성.
     *
     * @return 실패 Result
     */
    static Result failure() {
        return new Failure(List.of(ResultError.DEFAULT));
    }

    /**
     * 메시지로 만든 단일 오류를 가진 실패 결과 생성.
     *
     * @param message 오류 메시지
     * @return 실패 Result
     */
    static Result failure(String message) {
        return new Failure(List.of(new ResultError(message)));
    }

    /**
     * 단일 오류를 가진 실패 결과 생성.
     *
     * @param error 오류
     * @return 실패 Result
     * @throws IllegalArgumentException error가 null인 경우
     */
    static Result failure(ResultError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Failure(List.of(error));
    }

    /**
     * 오류 목록 전체를 가진 실패 결과 생성.
     *
     * @param errors 오류 목록 (비어 있을 수 있음)
     * @return 실패 Result
     */
    static Result failure(List<ResultError> errors) {
        return new Failure(errors);
    }

    /**
     * boolean을 Result로 변환.
     *
     * @param success 성공 여부
     * @return true면 {@link #success()}, false면 {@link #failure()}
     */
    static Result of(boolean success) {
        return success ? success() : failure();
    }

    /**
     * 예외를 실패 결과로 변환.
     *
     * @param cause 원인 예외
     * @return {@link ResultError#fromCause(Throwable)}를 가진 실패 Result
     */
    static Result fromCause(Throwable cause) {
        return failure(ResultError.fromCause(cause));
    }

    /**
     * 오류를 덧붙인 실패 결과 반환.
     *
     * @param error 추가할 오류
     * @return 기존 오류 뒤에 error가 붙은 실패 Result
     * @throws IllegalArgumentException error가 null인 경우
     */
    default Result addError(ResultError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Failure(Outcomes.append(errors(), List.of(error)));
    }

    /**
     * 오류 목록을 덧붙인 실패 결과 반환.
     *
     * <p>errors가 비어 있어도 결과는 실패 상태가 됩니다.</p>
     *
     * @param errors 추가할 오류 목록
     * @return 기존 오류 뒤에 errors가 순서대로 붙은 실패 Result
     * @throws IllegalArgumentException errors가 null인 경우
     */
    default Result addErrors(Collection<ResultError> errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        return new Failure(Outcomes.append(errors(), errors));
    }

    /**
     * 다른 결과들의 오류를 합친 결과 반환.
     *
     * <p>인자 순서대로, 실패한 결과의 오류만 덧붙입니다. 실패한 인자가 하나도 없으면
     * 현재 인스턴스를 그대로 반환합니다.</p>
     *
     * @param others 합칠 결과들
     * @return 합쳐진 Result
     */
    default Result combine(Outcome... others) {
        if (!Outcomes.anyFaulted(others)) {
            return this;
        }
        return new Failure(Outcomes.append(errors(), Outcomes.faultedErrors(others)));
    }
}
