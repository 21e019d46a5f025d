/**
 * Sub-query data model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.downstream.core.model.DownstreamQuery} - one unit of downstream work</li>
 *   <li>{@link com.ryuqq.downstream.core.model.QueryParams} - logical range/instant parameters</li>
 *   <li>{@link com.ryuqq.downstream.core.model.QueryExpression} - opaque, stringifiable expression</li>
 *   <li>{@link com.ryuqq.downstream.core.model.ShardSet} / {@link com.ryuqq.downstream.core.model.Shard} - partition descriptors</li>
 *   <li>{@link com.ryuqq.downstream.core.model.Label} - series label</li>
 * </ul>
 *
 * <p>All types are immutable and validate their arguments on construction.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.model;
