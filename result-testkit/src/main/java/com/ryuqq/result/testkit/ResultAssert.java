package com.ryuqq.result.testkit;

import com.ryuqq.result.core.outcome.Result;

/**
 * {@link Result} AssertJ 검증.
 *
 * @author Result Team
 * @since 1.0.0
 */
public class ResultAssert extends AbstractOutcomeAssert<ResultAssert, Result> {

    public ResultAssert(Result actual) {
        super(actual, ResultAssert.class);
    }
}
