package com.ryuqq.result.core.combinator;

import com.ryuqq.result.core.error.ResultError;
import com.ryuqq.result.core.outcome.ValueResult;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * bindTryCatch 테스트.
 *
 * <p>예외 → 오류 변환 경계를 검증합니다:</p>
 * <ul>
 *   <li>정상 반환은 성공으로 감쌈</li>
 *   <li>예외는 fallbackError 복사본 + 예외 메타데이터로 변환</li>
 *   <li>타입 지정 시 일치하지 않는 예외는 그대로 전파</li>
 *   <li>입력 실패 시 함수 미호출</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
class BindTryCatchTest {

    private static final ResultError BOOM = ResultError.of("boom");

    @Test
    void 정상_반환이면_성공으로_감쌈() {
        // when
        ValueResult<String> result = Results.bindTryCatch(ValueResult.success(10), value -> "v" + value, BOOM);

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.value()).isEqualTo("v10");
    }

    @Test
    void 예외_발생시_fallback_오류와_예외_메타데이터() {
        // given
        IllegalStateException thrown = new IllegalStateException("cannot handle 10");

        // when
        ValueResult<String> result = Results.bindTryCatch(
            ValueResult.success(10),
            value -> {
                throw thrown;
            },
            BOOM
        );

        // then
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.rootError().getMessage()).isEqualTo("boom");
        assertThat(result.rootError().getMetadata())
            .containsEntry(ResultError.EXCEPTION_METADATA_KEY, thrown);
    }

    @Test
    void 검사_예외도_변환() {
        // given
        IOException thrown = new IOException("disk full");

        // when
        ValueResult<byte[]> result = ValueResult.success("report.csv").bindTryCatch(
            path -> {
                throw thrown;
            },
            BOOM
        );

        // then
        assertThat(result.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY)).isSameAs(thrown);
    }

    @Test
    void fallback_오류는_변경되지_않아_재사용_가능() {
        // given
        ThrowingFunction<Integer, Integer, Exception> failing = value -> {
            throw new IllegalArgumentException("bad " + value);
        };

        // when
        ValueResult<Integer> first = Results.bindTryCatch(ValueResult.success(1), failing, BOOM);
        ValueResult<Integer> second = Results.bindTryCatch(ValueResult.success(2), failing, BOOM);

        // then
        assertThat(BOOM.getMetadata()).isEmpty();
        assertThat(((Exception) first.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY)).getMessage())
            .isEqualTo("bad 1");
        assertThat(((Exception) second.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY)).getMessage())
            .isEqualTo("bad 2");
    }

    @Test
    void 입력_실패면_함수_미호출_오류_전달() {
        // given
        ResultError upstream = ResultError.of("upstream", 7);
        AtomicInteger calls = new AtomicInteger();

        // when
        ValueResult<String> result = Results.bindTryCatch(
            ValueResult.<Integer>failure(upstream),
            value -> {
                calls.incrementAndGet();
                return "unused";
            },
            BOOM
        );

        // then
        assertThat(calls).hasValue(0);
        assertThat(result.errors()).containsExactly(upstream);
    }

    @Test
    void 타입_지정_일치하는_예외만_변환() {
        // when
        ValueResult<Integer> result = Results.bindTryCatch(
            ValueResult.success("abc"),
            Integer::parseInt,
            NumberFormatException.class,
            BOOM
        );

        // then
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY))
            .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void 타입_지정_일치하지_않는_예외는_그대로_전파() {
        // given
        UnsupportedOperationException thrown = new UnsupportedOperationException("not supported");

        // when & then
        assertThatThrownBy(() -> Results.bindTryCatch(
            ValueResult.success("abc"),
            value -> {
                throw thrown;
            },
            NumberFormatException.class,
            BOOM
        )).isSameAs(thrown);
    }

    @Test
    void 타입_지정_검사_예외_변환() {
        // given
        FileNotFoundException thrown = new FileNotFoundException("missing.yml");

        // when
        ValueResult<String> result = ValueResult.success("missing.yml").bindTryCatch(
            path -> {
                throw thrown;
            },
            IOException.class,
            ResultError.of("Cannot read", 404)
        );

        // then
        assertThat(result.isFaulted()).isTrue();
        assertThat(result.errors()).hasSize(1);
        assertThat(result.rootError().getCode()).isEqualTo(404);
        assertThat(result.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY)).isSameAs(thrown);
    }

    @Test
    void 타입_지정_비검사_예외_변환() {
        // when
        ValueResult<String> result = ValueResult.success("config.yml").bindTryCatch(
            path -> {
                throw new UncheckedIOException(new IOException(path));
            },
            UncheckedIOException.class,
            ResultError.of("Cannot read", 404)
        );

        // then
        assertThat(result.rootError().getCode()).isEqualTo(404);
        assertThat(result.rootError().getMetadata().get(ResultError.EXCEPTION_METADATA_KEY))
            .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void 타입_지정_선언되지_않은_검사_예외도_그대로_전파() {
        // given
        IOException thrown = new IOException("disk");

        // when & then
        assertThatThrownBy(() -> Results.bindTryCatch(
            ValueResult.success("42"),
            value -> {
                BindTryCatchTest.<RuntimeException>throwUnchecked(thrown);
                return Integer.parseInt(value);
            },
            NumberFormatException.class,
            BOOM
        )).isSameAs(thrown);
    }

    @Test
    void Error는_잡지_않음() {
        // when & then
        assertThatThrownBy(() -> Results.bindTryCatch(
            ValueResult.success(1),
            value -> {
                throw new AssertionError("fatal");
            },
            BOOM
        )).isInstanceOf(AssertionError.class);
    }

    @Test
    void fallback_오류에_예외_키가_이미_있으면_예외() {
        // given
        ResultError reserved = ResultError.of("reserved").addMetadata(ResultError.EXCEPTION_METADATA_KEY, "taken");

        // when & then
        assertThatThrownBy(() -> Results.bindTryCatch(
            ValueResult.success(1),
            value -> {
                throw new IllegalStateException();
            },
            reserved
        )).isInstanceOf(IllegalArgumentException.class);
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void throwUnchecked(Throwable t) throws E {
        throw (E) t;
    }
}
