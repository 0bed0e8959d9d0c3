/**
 * Stateless combinators for railway-oriented pipelines.
 *
 * <p>{@link com.ryuqq.result.core.combinator.Results} branches on, transforms and chains outcomes.
 * Once a stage fails, every later stage is skipped and the original errors flow through.</p>
 *
 * <p>{@code bindTryCatch} is the single boundary where exceptions thrown by external code
 * ({@link com.ryuqq.result.core.combinator.ThrowingFunction}) are converted into errors.</p>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.combinator;
