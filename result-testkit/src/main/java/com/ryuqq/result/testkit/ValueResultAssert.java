package com.ryuqq.result.testkit;

import com.ryuqq.result.core.outcome.ValueResult;

import java.util.Objects;

/**
 * {@link ValueResult} AssertJ 검증.
 *
 * @param <T> 값 타입
 * @author Result Team
 * @since 1.0.0
 */
public class ValueResultAssert<T> extends AbstractOutcomeAssert<ValueResultAssert<T>, ValueResult<T>> {

    public ValueResultAssert(ValueResult<T> actual) {
        super(actual, ValueResultAssert.class);
    }

    /**
     * 성공 상태이며 값이 일치하는지 검증.
     *
     * @param expected 기대 값
     * @return this
     */
    public ValueResultAssert<T> hasValue(T expected) {
        isSuccess();
        if (!Objects.equals(actual.value(), expected)) {
            failWithMessage("Expected value <%s> but was <%s>", expected, actual.value());
        }
        return myself;
    }
}
