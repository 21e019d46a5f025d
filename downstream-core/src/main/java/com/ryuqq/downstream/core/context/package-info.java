/**
 * Execution context and cancellation scope.
 *
 * <p>A {@link com.ryuqq.downstream.core.context.QueryContext} is threaded explicitly through every
 * call that takes part in a query evaluation. Cancellation flows from parent to child scopes only.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.downstream.core.context.QueryContext} - values + cancellation state</li>
 *   <li>{@link com.ryuqq.downstream.core.context.QueryScope} - closeable cancellable child scope</li>
 *   <li>{@link com.ryuqq.downstream.core.context.CancellationReason} - why a scope was cancelled</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.context;
