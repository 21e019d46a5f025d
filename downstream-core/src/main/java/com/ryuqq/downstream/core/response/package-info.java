/**
 * Wire-shape responses returned by the downstream handler.
 *
 * <p>{@link com.ryuqq.downstream.core.response.DownstreamResponse} is a closed sum type. Only the
 * log-stream and sample-stream variants carry query results; the metadata variants exist so that a
 * handler wired to the wrong endpoint fails with an explicit translation error.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.response;
