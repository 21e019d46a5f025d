package com.ryuqq.downstream.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueryParams 테스트.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class QueryParamsTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void instant_SameStartEndZeroStep_IsInstant() {
        QueryParams params = QueryParams.instant("{app=\"api\"}", START, Direction.BACKWARD, 10);

        assertTrue(params.isInstant());
        assertEquals(START, params.end());
    }

    @Test
    void range_DistinctStartEnd_IsNotInstant() {
        QueryParams params = QueryParams.range("{app=\"api\"}", START, START.plusSeconds(60),
            Duration.ofSeconds(15), Duration.ZERO, Direction.FORWARD, 100);

        assertFalse(params.isInstant());
    }

    @Test
    void range_SameStartEndWithStep_IsNotInstant() {
        QueryParams params = QueryParams.range("{app=\"api\"}", START, START,
            Duration.ofSeconds(15), Duration.ZERO, Direction.FORWARD, 100);

        assertFalse(params.isInstant());
    }

    @Test
    void constructor_EndBeforeStart_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> QueryParams.range("q", START, START.minusSeconds(1), Duration.ZERO, Duration.ZERO, Direction.FORWARD, 1)
        );
        assertTrue(exception.getMessage().contains("end cannot be before start"));
    }

    @Test
    void constructor_NegativeStep_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryParams.range("q", START, START, Duration.ofSeconds(-1), Duration.ZERO, Direction.FORWARD, 1));
    }

    @Test
    void constructor_NullDirection_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> QueryParams.instant("q", START, null, 1));
    }
}
