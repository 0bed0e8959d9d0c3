/**
 * Sample application for the Result SDK.
 *
 * <ul>
 *   <li>{@link com.ryuqq.result.sample.SampleApplication} - Runs construction, railway and registration demos</li>
 *   <li>{@link com.ryuqq.result.sample.SampleDataFactory} - Validation pipeline built with bind, bindTryCatch and combine</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Result Team
 */
package com.ryuqq.result.sample;
