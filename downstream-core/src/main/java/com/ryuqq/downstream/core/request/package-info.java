/**
 * Wire-shape requests sent to the downstream handler.
 *
 * <p>{@link com.ryuqq.downstream.core.request.DownstreamRequest} is a sealed interface with a
 * range and an instant variant. The variant is chosen only by
 * {@link com.ryuqq.downstream.core.model.QueryParams#isInstant()}.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.request;
