package com.ryuqq.result.sample;

import com.ryuqq.result.core.combinator.Results;
import com.ryuqq.result.core.error.ResultError;
import com.ryuqq.result.core.outcome.Outcome;
import com.ryuqq.result.core.outcome.Result;
import com.ryuqq.result.core.outcome.ValueResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Result SDK 사용 예시 애플리케이션.
 *
 * <p>세 가지 데모를 순서대로 실행하고 결과를 로그로 출력합니다:</p>
 * <ul>
 *   <li>생성 경로: 팩토리와 변환 팩토리로 결과 만들기</li>
 *   <li>Railway 호출: transform → tap 체이닝</li>
 *   <li>등록 파이프라인: {@link SampleDataFactory}로 입력 검증</li>
 * </ul>
 *
 * @author Result Team
 * @since 1.0.0
 */
public class SampleApplication {

    private static final Logger log = LoggerFactory.getLogger(SampleApplication.class);

    private final SampleDataFactory factory;

    public SampleApplication(SampleDataFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        this.factory = factory;
    }

    public static void main(String[] args) {
        new SampleApplication(new SampleDataFactory()).run();
    }

    /**
     * 모든 데모 실행.
     */
    public void run() {
        constructionDemo();
        railwayDemo(true);
        railwayDemo(false);
        registrationDemo("John", "30");
        registrationDemo("", "two hundred");
    }

    /**
     * 생성 경로 데모.
     *
     * @return 생성된 결과 목록 (생성 순서)
     */
    public List<Outcome> constructionDemo() {
        log.info("Construction demo");

        List<Outcome> outcomes = List.of(
            ValueResult.success(true),
            ValueResult.success(new SampleData("John", 30)),
            ValueResult.<SampleData>failure(new ResultError("Error message")),
            ValueResult.<SampleData>failure(),
            Result.of(false),
            Result.fromCause(new IllegalStateException("Connection reset"))
        );

        for (Outcome outcome : outcomes) {
            log.info("  {}", describe(outcome));
        }
        return outcomes;
    }

    /**
     * Railway 호출 데모.
     *
     * @param flag 입력 값
     * @return 변환된 메시지 결과
     */
    public ValueResult<String> railwayDemo(boolean flag) {
        log.info("Railway demo (input={})", flag);

        return ValueResult.success(flag)
            .transform(ok -> ok ? "Great!" : "Not so great...")
            .tap(message -> log.info("  {}", message));
    }

    /**
     * 등록 파이프라인 데모.
     *
     * @param name 이름 입력
     * @param ageText 나이 입력
     * @return 등록 결과
     */
    public ValueResult<SampleData> registrationDemo(String name, String ageText) {
        log.info("Registration demo (name='{}', age='{}')", name, ageText);

        ValueResult<SampleData> registered = factory.create(name, ageText);
        Results.match(
            registered,
            data -> log.info("  Registered {}", data),
            errors -> log.warn("  Rejected: {}", summarize(errors))
        );
        return registered;
    }

    static String describe(Outcome outcome) {
        if (outcome instanceof ValueResult<?> valueResult) {
            return Results.map(
                valueResult,
                value -> "success(" + value + ")",
                errors -> "failure(" + summarize(errors) + ")"
            );
        }
        return Results.map((Result) outcome, () -> "success", errors -> "failure(" + summarize(errors) + ")");
    }

    static String summarize(List<ResultError> errors) {
        return errors.stream()
            .map(error -> error.getMessage() + " [" + error.getCode() + "]")
            .collect(Collectors.joining(", "));
    }
}
