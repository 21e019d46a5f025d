package com.ryuqq.downstream.adapter.inmemory.limits;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.spi.LimitsProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link LimitsProvider} SPI for testing and reference purposes.
 *
 * <p>Holds a per-tenant {@code maxQueryParallelism} table backed by a {@link ConcurrentHashMap}.
 * Tenants without an entry get the fallback value, which defaults to {@code 0} ("no override").</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryLimits limits = new InMemoryLimits();
 * limits.setMaxQueryParallelism("tenant-a", 256);
 *
 * limits.maxQueryParallelism(ctx, "tenant-a"); // 256
 * limits.maxQueryParallelism(ctx, "tenant-b"); // 0 (dispatcher default applies)
 * </pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class InMemoryLimits implements LimitsProvider {

    private final Map<String, Integer> maxQueryParallelism = new ConcurrentHashMap<>();
    private final int fallback;

    /**
     * Creates limits with no fallback override.
     */
    public InMemoryLimits() {
        this(0);
    }

    /**
     * Creates limits with a fallback applied to tenants without an entry.
     *
     * @param fallback value returned for unknown tenants (non-positive means "no override")
     */
    public InMemoryLimits(int fallback) {
        this.fallback = fallback;
    }

    @Override
    public int maxQueryParallelism(QueryContext ctx, String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        return maxQueryParallelism.getOrDefault(tenantId, fallback);
    }

    /**
     * Sets the parallelism override for a tenant.
     *
     * @param tenantId tenant id
     * @param parallelism override (non-positive disables the override for this tenant)
     * @throws IllegalArgumentException if tenantId is null or blank
     */
    public void setMaxQueryParallelism(String tenantId, int parallelism) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        maxQueryParallelism.put(tenantId, parallelism);
    }

    /**
     * Removes every per-tenant entry. For test isolation.
     */
    public void clear() {
        maxQueryParallelism.clear();
    }
}
