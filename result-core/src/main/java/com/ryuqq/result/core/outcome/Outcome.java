package com.ryuqq.result.core.outcome;

import com.ryuqq.result.core.error.ResultError;

import java.util.List;

/**
 * 연산 결과의 공통 조회 인터페이스.
 *
 * <p>Outcome은 두 가지 형태를 가집니다:</p>
 * <ul>
 *   <li>{@link Result}: 값이 없는 성공/실패</li>
 *   <li>{@link ValueResult}: 성공 시 값을 가지는 성공/실패</li>
 * </ul>
 *
 * <p>두 형태 모두 실패 시 0개 이상의 {@link ResultError}를 순서대로 보관합니다.
 * 성공한 결과의 오류 목록은 항상 비어 있습니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Result, ValueResult {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    boolean isSuccess();

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부 ({@link #isSuccess()}의 반대)
     */
    default boolean isFaulted() {
        return !isSuccess();
    }

    /**
     * 오류 목록 조회.
     *
     * <p>상태와 관계없이 항상 안전하게 읽을 수 있습니다.</p>
     *
     * @return 읽기 전용 오류 목록 (성공 시 빈 목록)
     */
    List<ResultError> errors();

    /**
     * 대표 오류 조회.
     *
     * @return 첫 번째 오류, 목록이 비어 있으면 {@link ResultError#DEFAULT}
     * @throws IllegalStateException 성공한 결과인 경우
     */
    default ResultError rootError() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot access root error of a successful result");
        }
        List<ResultError> errors = errors();
        return errors.isEmpty() ? ResultError.DEFAULT : errors.get(0);
    }
}
