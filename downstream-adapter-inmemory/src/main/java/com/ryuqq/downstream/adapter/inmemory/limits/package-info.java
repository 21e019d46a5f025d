/**
 * In-memory {@link com.ryuqq.downstream.core.spi.LimitsProvider} implementation.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
package com.ryuqq.downstream.adapter.inmemory.limits;
