package com.ryuqq.downstream.testkit.contract;

import com.ryuqq.downstream.application.dispatcher.Dispatcher;
import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.model.DownstreamQuery;
import com.ryuqq.downstream.core.result.QueryResult;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: results come back in input order.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Randomised completion latency per index → results[i] still matches queries[i]</li>
 *   <li>Reverse-ordered latency (last query finishes first)</li>
 *   <li>Empty input → empty list, handler never called</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class OrderingContractTest extends AbstractContractTest {

    @Test
    void testOrdering_RandomLatency_ResultsFollowInputOrder() {
        // Given
        int n = 40;
        Random random = new Random(42);
        for (int i = 0; i < n; i++) {
            handler.delay(queryName(i), Duration.ofMillis(random.nextInt(30)));
        }
        QueryContext ctx = QueryContext.background();
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When
        List<QueryResult> results = dispatcher.downstream(ctx, rangeQueries(n));

        // Then
        assertInInputOrder(results, n);
        assertEquals(n, handler.callCount(), "every sub-query dispatched exactly once");
    }

    @Test
    void testOrdering_ReverseLatency_ResultsFollowInputOrder() {
        // Given: earlier indices are slower, so completion order is reversed
        int n = 8;
        for (int i = 0; i < n; i++) {
            handler.delay(queryName(i), Duration.ofMillis((n - i) * 20L));
        }
        QueryContext ctx = QueryContext.background();

        // When
        List<QueryResult> results = factory.buildDispatcher(ctx).downstream(ctx, rangeQueries(n));

        // Then
        assertInInputOrder(results, n);
    }

    @Test
    void testOrdering_EmptyInput_ReturnsEmptyListWithoutDispatch() {
        // Given
        QueryContext ctx = QueryContext.background();
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When
        List<QueryResult> results = dispatcher.downstream(ctx, List.<DownstreamQuery>of());

        // Then
        assertTrue(results.isEmpty());
        assertEquals(0, handler.callCount());
    }

    @Test
    void testOrdering_SingleQuery_ReturnsSingleResult() {
        // Given
        QueryContext ctx = QueryContext.background();

        // When
        List<QueryResult> results = factory.buildDispatcher(ctx).downstream(ctx, rangeQueries(1));

        // Then
        assertInInputOrder(results, 1);
    }
}
