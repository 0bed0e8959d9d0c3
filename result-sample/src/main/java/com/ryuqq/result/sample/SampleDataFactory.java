package com.ryuqq.result.sample;

import com.ryuqq.result.core.error.ResultError;
import com.ryuqq.result.core.outcome.Result;
import com.ryuqq.result.core.outcome.ValueResult;

/**
 * 입력 문자열로부터 {@link SampleData}를 만드는 Railway 파이프라인.
 *
 * <p><strong>단계:</strong></p>
 * <ol>
 *   <li>나이 입력 존재 확인 (bind)</li>
 *   <li>정수 변환 (bindTryCatch, {@link NumberFormatException}만 오류로 변환)</li>
 *   <li>나이 범위 확인 (bind)</li>
 *   <li>이름 검증 결과와 병합 (combine)</li>
 *   <li>SampleData 생성 (transform)</li>
 * </ol>
 *
 * <p>이름 검증은 나이 파이프라인과 독립적으로 수행되므로, 두 입력이 모두 잘못되면
 * 오류가 모두 보고됩니다.</p>
 *
 * @author Result Team
 * @since 1.0.0
 */
public class SampleDataFactory {

    public static final int MIN_AGE = 0;
    public static final int MAX_AGE = 150;

    static final int MISSING_AGE_CODE = 4001;
    static final int INVALID_AGE_CODE = 4002;
    static final int AGE_OUT_OF_RANGE_CODE = 4003;
    static final int MISSING_NAME_CODE = 4004;

    private static final ResultError INVALID_AGE = ResultError.of("Age must be a number", INVALID_AGE_CODE);

    /**
     * SampleData 생성.
     *
     * @param name 이름
     * @param ageText 나이 입력 문자열
     * @return 생성된 SampleData 또는 모든 검증 오류
     */
    public ValueResult<SampleData> create(String name, String ageText) {
        Result nameCheck = validateName(name);

        return ValueResult.success(ageText)
            .bind(SampleDataFactory::requirePresent)
            .bindTryCatch(Integer::parseInt, NumberFormatException.class, INVALID_AGE)
            .bind(SampleDataFactory::validateAge)
            .combine(nameCheck)
            .transform(age -> new SampleData(name.trim(), age));
    }

    static Result validateName(String name) {
        if (name == null || name.isBlank()) {
            return Result.failure(ResultError.of("Name is required", MISSING_NAME_CODE));
        }
        return Result.success();
    }

    private static ValueResult<String> requirePresent(String ageText) {
        if (ageText == null || ageText.isBlank()) {
            return ValueResult.failure(ResultError.of("Age is required", MISSING_AGE_CODE));
        }
        return ValueResult.success(ageText.trim());
    }

    private static ValueResult<Integer> validateAge(int age) {
        if (age < MIN_AGE || age > MAX_AGE) {
            return ValueResult.failure(
                ResultError.of("Age must be between " + MIN_AGE + " and " + MAX_AGE, AGE_OUT_OF_RANGE_CODE)
                    .addMetadata("age", age)
            );
        }
        return ValueResult.success(age);
    }
}
