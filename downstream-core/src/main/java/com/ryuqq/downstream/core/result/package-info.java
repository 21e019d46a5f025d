/**
 * Uniform query result.
 *
 * <p>{@link com.ryuqq.downstream.core.result.QueryResult} pairs execution statistics and headers
 * with a {@link com.ryuqq.downstream.core.result.ResultValue} payload (streams, vector or matrix).</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.result;
