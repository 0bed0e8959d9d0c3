/**
 * Structured error descriptor package.
 *
 * <ul>
 *   <li>{@link com.ryuqq.result.core.error.ResultError} - Message, code, optional cause and metadata</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.core.error;
