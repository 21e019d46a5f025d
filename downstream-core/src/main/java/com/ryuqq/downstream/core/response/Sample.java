package com.ryuqq.downstream.core.response;

/**
 * 샘플 하나 (밀리초 타임스탬프, 값).
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record Sample(long timestampMs, double value) {
}
