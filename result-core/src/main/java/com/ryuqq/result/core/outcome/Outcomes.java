package com.ryuqq.result.core.outcome;

import com.ryuqq.result.core.error.ResultError;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 오류 목록 병합 헬퍼 (패키지 전용).
 *
 * @author Result Team
 * @since 1.0.0
 */
final class Outcomes {

    // Utility class - prevent instantiation
    private Outcomes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static List<ResultError> append(List<ResultError> current, Collection<ResultError> added) {
        List<ResultError> merged = new ArrayList<>(current.size() + added.size());
        merged.addAll(current);
        merged.addAll(added);
        return merged;
    }

    /**
     * null 요소 없는 불변 복사본.
     */
    static List<ResultError> copyErrors(List<ResultError> errors) {
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        for (ResultError error : errors) {
            if (error == null) {
                throw new IllegalArgumentException("errors cannot contain null");
            }
        }
        return List.copyOf(errors);
    }

    static boolean anyFaulted(Outcome... outcomes) {
        requireOutcomes(outcomes);
        for (Outcome outcome : outcomes) {
            if (outcome.isFaulted()) {
                return true;
            }
        }
        return false;
    }

    /**
     * 실패한 결과들의 오류를 인자 순서대로 모음.
     */
    static List<ResultError> faultedErrors(Outcome... outcomes) {
        requireOutcomes(outcomes);
        List<ResultError> collected = new ArrayList<>();
        for (Outcome outcome : outcomes) {
            if (outcome.isFaulted()) {
                collected.addAll(outcome.errors());
            }
        }
        return collected;
    }

    private static void requireOutcomes(Outcome... outcomes) {
        if (outcomes == null) {
            throw new IllegalArgumentException("outcomes cannot be null");
        }
        for (Outcome outcome : outcomes) {
            if (outcome == null) {
                throw new IllegalArgumentException("outcomes cannot contain null");
            }
        }
    }
}
