package com.ryuqq.result.sample;

/**
 * 데모용 사용자 데이터.
 *
 * @param name 이름
 * @param age 나이
 *
 * @author Result Team
 * @since 1.0.0
 */
public record SampleData(String name, int age) {
}
