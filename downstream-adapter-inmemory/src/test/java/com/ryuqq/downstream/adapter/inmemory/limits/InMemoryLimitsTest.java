package com.ryuqq.downstream.adapter.inmemory.limits;

import com.ryuqq.downstream.core.context.QueryContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryLimits 테스트.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class InMemoryLimitsTest {

    private InMemoryLimits limits;

    @BeforeEach
    void setUp() {
        limits = new InMemoryLimits();
    }

    @Test
    void maxQueryParallelism_ConfiguredTenant_ReturnsOverride() {
        limits.setMaxQueryParallelism("tenant-a", 32);

        assertEquals(32, limits.maxQueryParallelism(QueryContext.background(), "tenant-a"));
    }

    @Test
    void maxQueryParallelism_UnknownTenant_ReturnsFallback() {
        assertEquals(0, limits.maxQueryParallelism(QueryContext.background(), "tenant-x"));
        assertEquals(8, new InMemoryLimits(8).maxQueryParallelism(QueryContext.background(), "tenant-x"));
    }

    @Test
    void clear_RemovesOverrides() {
        limits.setMaxQueryParallelism("tenant-a", 32);

        limits.clear();

        assertEquals(0, limits.maxQueryParallelism(QueryContext.background(), "tenant-a"));
    }

    @Test
    void setMaxQueryParallelism_BlankTenant_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> limits.setMaxQueryParallelism(" ", 4));
        assertThrows(IllegalArgumentException.class, () -> limits.maxQueryParallelism(QueryContext.background(), null));
    }
}
