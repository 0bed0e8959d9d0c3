/**
 * Operation outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for operation results,
 * so every state is known at compile-time.</p>
 *
 * <h2>Sealed Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.result.core.outcome.Outcome} - Common read surface (permits Result, ValueResult)</li>
 *   <li>{@link com.ryuqq.result.core.outcome.Result} - Value-less outcome (Success, Failure)</li>
 *   <li>{@link com.ryuqq.result.core.outcome.ValueResult} - Value-carrying outcome (Success, Failure)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * Result saved = Result.success()
 *     .combine(validateName(request), validateEmail(request));
 *
 * if (saved.isFaulted()) {
 *     log.warn("Rejected: {}", saved.rootError().getMessage());
 * }
 * </pre>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> addError, addErrors and combine return new instances</li>
 *   <li><strong>Downward-only:</strong> A faulted outcome never becomes successful again</li>
 *   <li><strong>No stale values:</strong> A faulted ValueResult has no value slot</li>
 *   <li><strong>Fail-Fast:</strong> Reading value() of a failure or rootError() of a success throws IllegalStateException</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.outcome;
