package com.ryuqq.result.testkit;

import com.ryuqq.result.core.outcome.Result;
import com.ryuqq.result.core.outcome.ValueResult;

/**
 * Result / ValueResult 검증 진입점.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * import static com.ryuqq.result.testkit.ResultAssertions.assertThat;
 *
 * assertThat(orderService.place(request))
 *     .isFaulted()
 *     .hasRootErrorMessage("Out of stock")
 *     .hasRootErrorCode(409);
 *
 * assertThat(parser.parse("42")).hasValue(42);
 * </pre>
 *
 * @author Result Team
 * @since 1.0.0
 */
public final class ResultAssertions {

    // Utility class - prevent instantiation
    private ResultAssertions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ResultAssert assertThat(Result actual) {
        return new ResultAssert(actual);
    }

    public static <T> ValueResultAssert<T> assertThat(ValueResult<T> actual) {
        return new ValueResultAssert<>(actual);
    }
}
