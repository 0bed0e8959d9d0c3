package com.ryuqq.result.core.outcome;

import com.ryuqq.result.core.error.ResultError;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValueResult 테스트.
 *
 * <p>값 접근 규칙과, 실패로 전이되면 값이 남지 않는 불변식을 검증합니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
class ValueResultTest {

    private final ResultError e1 = ResultError.of("first", 1);
    private final ResultError e2 = ResultError.of("second", 2);

    @Test
    void success_값과_상태_보관() {
        // when
        ValueResult<String> result = ValueResult.success("order-1");

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo("order-1");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void success_null_값_허용() {
        // when
        ValueResult<String> result = ValueResult.success(null);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isNull();
    }

    @Test
    void failure_value_접근시_IllegalStateException() {
        // given
        ValueResult<Integer> result = ValueResult.failure();

        // when & then
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.errors()).containsExactly(ResultError.DEFAULT);
        assertThatThrownBy(result::value)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Cannot access value of a faulted result");
    }

    @Test
    void failure_팩토리별_오류() {
        assertThat(ValueResult.<Integer>failure("bad input").rootError().getMessage()).isEqualTo("bad input");
        assertThat(ValueResult.<Integer>failure(e1).errors()).containsExactly(e1);
        assertThat(ValueResult.<Integer>failure(List.of(e1, e2)).errors()).containsExactly(e1, e2);
        assertThat(ValueResult.<Integer>failure(List.of()).errors()).isEmpty();
    }

    @Test
    void failure_null_요소가_있는_목록은_예외() {
        assertThatThrownBy(() -> ValueResult.<Integer>failure(Arrays.asList(e1, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("errors cannot contain null");
    }

    @Test
    void fromCause_예외를_오류로_감쌈() {
        // given
        IOException cause = new IOException("disk full");

        // when
        ValueResult<byte[]> result = ValueResult.fromCause(cause);

        // then
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.rootError().getCause()).isSameAs(cause);
    }

    @Test
    void addError_성공에서_실패로_전이하면_값_제거() {
        // given
        ValueResult<String> result = ValueResult.success("stale");

        // when
        ValueResult<String> faulted = result.addError(e1);

        // then
        assertThat(faulted).isInstanceOf(ValueResult.Failure.class);
        assertThat(faulted.errors()).containsExactly(e1);
        assertThatThrownBy(faulted::value).isInstanceOf(IllegalStateException.class);
        assertThat(result.value()).isEqualTo("stale");
    }

    @Test
    void addErrors_순서대로_추가() {
        // when
        ValueResult<String> faulted = ValueResult.success("stale").addErrors(List.of(e1, e2));

        // then
        assertThat(faulted.errors()).containsExactly(e1, e2);
        assertThatThrownBy(faulted::value).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void combine_실패_인자가_있으면_값_제거() {
        // when
        ValueResult<String> combined = ValueResult.success("stale")
            .combine(Result.success(), Result.failure(e1), ValueResult.failure(e2));

        // then
        assertThat(combined.errors()).containsExactly(e1, e2);
        assertThatThrownBy(combined::value).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void combine_모두_성공이면_값_유지() {
        // given
        ValueResult<String> result = ValueResult.success("kept");

        // when
        ValueResult<String> combined = result.combine(Result.success());

        // then
        assertThat(combined).isSameAs(result);
        assertThat(combined.value()).isEqualTo("kept");
    }

    @Test
    void rootError_성공이면_IllegalStateException() {
        assertThatThrownBy(() -> ValueResult.success(1).rootError())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void toResult_값_버리고_상태와_오류_유지() {
        assertThat(ValueResult.success(1).toResult()).isEqualTo(Result.success());
        assertThat(ValueResult.<Integer>failure(List.of(e1, e2)).toResult().errors()).containsExactly(e1, e2);
    }

    @Test
    void equals_같은_값이면_같음() {
        assertThat(ValueResult.success("a")).isEqualTo(ValueResult.success("a"));
        assertThat(ValueResult.<String>failure(e1)).isEqualTo(ValueResult.<String>failure(e1));
        assertThat(ValueResult.success("a")).isNotEqualTo(ValueResult.success("b"));
    }
}
