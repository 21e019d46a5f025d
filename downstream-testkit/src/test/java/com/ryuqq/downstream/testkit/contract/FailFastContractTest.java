package com.ryuqq.downstream.testkit.contract;

import com.ryuqq.downstream.application.dispatcher.Dispatcher;
import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.exception.DownstreamErrorException;
import com.ryuqq.downstream.core.response.LogStreamResponse;
import com.ryuqq.downstream.core.response.SampleStreamResponse;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: the first failure aborts the whole batch.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>One failing sub-query → error, never a partial result list</li>
 *   <li>Failure while siblings are slow → call returns without waiting for them</li>
 *   <li>Several simultaneous failures → some error is returned (which one is not specified)</li>
 *   <li>Handler exception is propagated verbatim</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class FailFastContractTest extends AbstractContractTest {

    @Test
    void testFailFast_OneErrorResponse_ThrowsWithoutPartialResults() {
        // Given
        handler.respondWith(queryName(3), LogStreamResponse.failure("execution", "too many streams"));
        QueryContext ctx = QueryContext.background();
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When & Then
        DownstreamErrorException exception = assertThrows(
            DownstreamErrorException.class,
            () -> dispatcher.downstream(ctx, rangeQueries(10))
        );
        assertEquals("execution: too many streams", exception.getMessage());
    }

    @Test
    void testFailFast_FailureWhileSiblingsSlow_ReturnsWithoutWaiting() {
        // Given: every sibling would take 10 seconds
        handler.delayAll(Duration.ofSeconds(10));
        handler.delay(queryName(0), Duration.ZERO);
        handler.failWith(queryName(0), new IllegalStateException("backend unavailable"));
        QueryContext ctx = QueryContext.background();
        Dispatcher dispatcher = factory.buildDispatcher(ctx);
        long startNanos = System.nanoTime();

        // When
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> dispatcher.downstream(ctx, rangeQueries(5))
        );

        // Then
        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000L;
        assertEquals("backend unavailable", exception.getMessage());
        assertTrue(elapsedMs < 5_000, "dispatcher waited " + elapsedMs + "ms for cancelled siblings");

        // In-flight siblings observe the cancelled scope and return promptly
        awaitCondition(() -> handler.inFlight() == 0, Duration.ofSeconds(3),
            "in-flight sub-queries did not observe cancellation");
    }

    @Test
    void testFailFast_MultipleFailures_SomeErrorReturned() {
        // Given
        for (int i = 0; i < 6; i += 2) {
            handler.respondWith(queryName(i), SampleStreamResponse.failure("bad_data", "failure " + i));
        }
        QueryContext ctx = QueryContext.background();
        Dispatcher dispatcher = factory.buildDispatcher(ctx);

        // When & Then: which failure wins is a delivery race
        DownstreamErrorException exception = assertThrows(
            DownstreamErrorException.class,
            () -> dispatcher.downstream(ctx, rangeQueries(6))
        );
        assertTrue(exception.getMessage().startsWith("bad_data: failure "));
    }

    @Test
    void testFailFast_AfterFailure_InstanceStillHonoursBound() {
        // Given
        limits.setMaxQueryParallelism("tenant-ff", 2);
        handler.failWith(queryName(1), new IllegalArgumentException("rejected"));
        QueryContext ctx = tenantContext("tenant-ff");
        Dispatcher dispatcher = factory.buildDispatcher(ctx);
        assertThrows(IllegalArgumentException.class, () -> dispatcher.downstream(ctx, rangeQueries(4)));
        handler.clear();

        // When: tokens released on the failure path must be available again
        assertInInputOrder(dispatcher.downstream(ctx, rangeQueries(6)), 6);

        // Then
        assertTrue(handler.maxConcurrent() <= 2);
    }
}
