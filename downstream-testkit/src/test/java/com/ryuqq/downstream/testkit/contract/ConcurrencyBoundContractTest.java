package com.ryuqq.downstream.testkit.contract;

import com.ryuqq.downstream.application.dispatcher.Dispatcher;
import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.result.QueryResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: at most p sub-queries execute concurrently per dispatcher instance.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>n ≫ p: observed concurrency never exceeds p</li>
 *   <li>p = 1: execution is fully serialised</li>
 *   <li>Two concurrent calls on one instance share the same bound</li>
 *   <li>Tokens are returned: the instance remains usable after a run</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class ConcurrencyBoundContractTest extends AbstractContractTest {

    private static final String TENANT = "bounded-tenant";

    @Test
    void testBound_ManyMoreQueriesThanTokens_NeverExceedsParallelism() {
        // Given
        limits.setMaxQueryParallelism(TENANT, 4);
        handler.delayAll(Duration.ofMillis(5));
        QueryContext ctx = tenantContext(TENANT);
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When
        List<QueryResult> results = dispatcher.downstream(ctx, rangeQueries(100));

        // Then
        assertInInputOrder(results, 100);
        assertTrue(handler.maxConcurrent() <= 4,
            "observed concurrency " + handler.maxConcurrent() + " exceeds bound 4");
        assertTrue(handler.maxConcurrent() >= 1);
    }

    @Test
    void testBound_SingleToken_SerialisesExecution() {
        // Given
        limits.setMaxQueryParallelism(TENANT, 1);
        handler.delayAll(Duration.ofMillis(2));
        QueryContext ctx = tenantContext(TENANT);

        // When
        List<QueryResult> results = factory.buildDispatcher(ctx).downstream(ctx, rangeQueries(20));

        // Then
        assertInInputOrder(results, 20);
        assertEquals(1, handler.maxConcurrent());
    }

    @Test
    void testBound_ConcurrentCallsOnSameInstance_ShareTokenPool() throws Exception {
        // Given: one query evaluation fanning out twice at the same time
        limits.setMaxQueryParallelism(TENANT, 3);
        handler.delayAll(Duration.ofMillis(5));
        QueryContext ctx = tenantContext(TENANT);
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When
        CompletableFuture<List<QueryResult>> left =
            CompletableFuture.supplyAsync(() -> dispatcher.downstream(ctx, rangeQueries(30)));
        CompletableFuture<List<QueryResult>> right =
            CompletableFuture.supplyAsync(() -> dispatcher.downstream(ctx, rangeQueries(30)));

        // Then
        assertInInputOrder(left.get(10, TimeUnit.SECONDS), 30);
        assertInInputOrder(right.get(10, TimeUnit.SECONDS), 30);
        assertTrue(handler.maxConcurrent() <= 3,
            "observed concurrency " + handler.maxConcurrent() + " exceeds shared bound 3");
    }

    @Test
    void testBound_AfterRun_InstanceIsReusable() {
        // Given
        limits.setMaxQueryParallelism(TENANT, 2);
        QueryContext ctx = tenantContext(TENANT);
        Dispatcher dispatcher = factory.buildDispatcher(ctx);
        dispatcher.downstream(ctx, rangeQueries(10));

        // When: a leaked token would shrink or deadlock the second run
        List<QueryResult> results = dispatcher.downstream(ctx, rangeQueries(10));

        // Then
        assertInInputOrder(results, 10);
        assertEquals(20, handler.callCount());
    }
}
