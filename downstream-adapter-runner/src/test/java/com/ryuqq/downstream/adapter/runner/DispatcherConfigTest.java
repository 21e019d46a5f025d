package com.ryuqq.downstream.adapter.runner;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DispatcherConfig 테스트.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
class DispatcherConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        DispatcherConfig config = new DispatcherConfig();

        assertEquals(128, config.defaultConcurrency());
        assertEquals("downstream-worker", config.threadNamePrefix());
        assertEquals(60_000L, config.shutdownTimeoutMs());
    }

    @Test
    void withMethods_ReturnModifiedCopy() {
        DispatcherConfig base = new DispatcherConfig();

        DispatcherConfig modified = base.withDefaultConcurrency(32)
            .withThreadNamePrefix("fanout")
            .withShutdownTimeoutMs(1_000);

        assertEquals(32, modified.defaultConcurrency());
        assertEquals("fanout", modified.threadNamePrefix());
        assertEquals(1_000L, modified.shutdownTimeoutMs());
        assertEquals(128, base.defaultConcurrency());
    }

    @Test
    void constructor_NonPositiveConcurrency_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new DispatcherConfig().withDefaultConcurrency(0)
        );
        assertEquals("defaultConcurrency must be positive (current: 0)", exception.getMessage());
    }

    @Test
    void constructor_BlankPrefix_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new DispatcherConfig().withThreadNamePrefix(" "));
    }

    @Test
    void constructor_NegativeShutdownTimeout_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new DispatcherConfig().withShutdownTimeoutMs(-1));
    }
}
