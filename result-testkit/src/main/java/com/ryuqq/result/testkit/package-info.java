/**
 * AssertJ assertions for outcomes.
 *
 * <p>This package provides fluent assertions for testing code that returns
 * {@link com.ryuqq.result.core.outcome.Result} or {@link com.ryuqq.result.core.outcome.ValueResult}.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.testkit.ResultAssertions} - Static entry points</li>
 *   <li>{@link com.ryuqq.result.testkit.ResultAssert} - Value-less result assertions</li>
 *   <li>{@link com.ryuqq.result.testkit.ValueResultAssert} - Value-carrying result assertions</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.testkit;
