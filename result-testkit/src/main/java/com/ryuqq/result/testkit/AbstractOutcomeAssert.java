package com.ryuqq.result.testkit;

import com.ryuqq.result.core.error.ResultError;
import com.ryuqq.result.core.outcome.Outcome;
import org.assertj.core.api.AbstractAssert;

import java.util.List;

/**
 * Outcome 공통 AssertJ 검증.
 *
 * <p>{@link ResultAssert}와 {@link ValueResultAssert}가 공유하는 상태/오류 검증을 제공합니다.</p>
 *
 * @param <SELF> 구현 Assert 타입
 * @param <ACTUAL> 검증 대상 Outcome 타입
 * @author Result Team
 * @since 1.0.0
 */
public abstract class AbstractOutcomeAssert<SELF extends AbstractOutcomeAssert<SELF, ACTUAL>, ACTUAL extends Outcome>
    extends AbstractAssert<SELF, ACTUAL> {

    protected AbstractOutcomeAssert(ACTUAL actual, Class<?> selfType) {
        super(actual, selfType);
    }

    /**
     * 성공 상태 검증.
     *
     * @return this
     */
    public SELF isSuccess() {
        isNotNull();
        if (actual.isFaulted()) {
            failWithMessage("Expected outcome to be successful but it was faulted with <%s>", actual.errors());
        }
        return myself;
    }

    /**
     * 실패 상태 검증.
     *
     * @return this
     */
    public SELF isFaulted() {
        isNotNull();
        if (actual.isSuccess()) {
            failWithMessage("Expected outcome to be faulted but it was successful");
        }
        return myself;
    }

    /**
     * 실패 상태이며 오류 목록이 정확히 일치하는지 검증 (순서 포함).
     *
     * @param expected 기대 오류
     * @return this
     */
    public SELF hasErrors(ResultError... expected) {
        isFaulted();
        List<ResultError> expectedErrors = List.of(expected);
        if (!actual.errors().equals(expectedErrors)) {
            failWithMessage("Expected errors <%s> but were <%s>", expectedErrors, actual.errors());
        }
        return myself;
    }

    /**
     * 오류 개수 검증.
     *
     * @param expected 기대 개수
     * @return this
     */
    public SELF hasErrorCount(int expected) {
        isNotNull();
        if (actual.errors().size() != expected) {
            failWithMessage("Expected <%s> errors but found <%s>: <%s>", expected, actual.errors().size(), actual.errors());
        }
        return myself;
    }

    /**
     * 대표 오류의 메시지 검증.
     *
     * @param expected 기대 메시지
     * @return this
     */
    public SELF hasRootErrorMessage(String expected) {
        isFaulted();
        String message = actual.rootError().getMessage();
        if (!message.equals(expected)) {
            failWithMessage("Expected root error message <%s> but was <%s>", expected, message);
        }
        return myself;
    }

    /**
     * 대표 오류의 코드 검증.
     *
     * @param expected 기대 코드
     * @return this
     */
    public SELF hasRootErrorCode(int expected) {
        isFaulted();
        int code = actual.rootError().getCode();
        if (code != expected) {
            failWithMessage("Expected root error code <%s> but was <%s>", expected, code);
        }
        return myself;
    }

    /**
     * 대표 오류가 bindTryCatch로 잡힌 예외를 메타데이터로 가지고 있는지 검증.
     *
     * @param exceptionType 기대 예외 타입
     * @return this
     */
    public SELF hasCaughtException(Class<? extends Exception> exceptionType) {
        isFaulted();
        Object caught = actual.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY);
        if (!exceptionType.isInstance(caught)) {
            failWithMessage("Expected root error to carry <%s> under <%s> but found <%s>",
                exceptionType.getName(), ResultError.EXCEPTION_METADATA_KEY, caught);
        }
        return myself;
    }
}
