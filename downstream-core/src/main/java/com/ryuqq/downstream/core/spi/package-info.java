/**
 * Service Provider Interface (SPI) package.
 *
 * <p>External collaborators of the dispatcher, specified only at their boundary.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.downstream.core.spi.TenantResolver} - tenant id extraction from a context</li>
 *   <li>{@link com.ryuqq.downstream.core.spi.LimitsProvider} - per-tenant parallelism override</li>
 *   <li>{@link com.ryuqq.downstream.core.spi.DownstreamHandler} - executes one translated request</li>
 * </ul>
 *
 * <p>Reference implementations of the first two live in {@code downstream-adapter-inmemory}.</p>
 *
 * @since 1.0.0
 * @author Downstream Team
 */
package com.ryuqq.downstream.core.spi;
