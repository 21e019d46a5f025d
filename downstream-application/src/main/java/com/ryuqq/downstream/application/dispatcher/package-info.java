/**
 * Dispatcher application contracts.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.downstream.application.dispatcher.DispatcherFactory} - builds one dispatcher per query evaluation</li>
 *   <li>{@link com.ryuqq.downstream.application.dispatcher.Dispatcher} - bounded, order-preserving, fail-fast fan-out</li>
 *   <li>{@link com.ryuqq.downstream.application.dispatcher.DownstreamWork} - unit of work per sub-query</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (BoundedDispatcher, DownstreamDispatcherFactory)
 *   ↓ implements
 * application (Dispatcher, DispatcherFactory)
 *   ↓ depends on
 * core (QueryContext, DownstreamQuery, QueryResult, translators, SPI)
 * </pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
package com.ryuqq.downstream.application.dispatcher;
