/**
 * Query execution exceptions.
 *
 * <p>All types are unchecked and non-retryable at this layer. Argument validation throughout the
 * project uses {@link java.lang.IllegalArgumentException} instead.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.exception;
