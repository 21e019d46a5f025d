package com.ryuqq.downstream.core.model;

/**
 * 로그 엔트리 정렬 방향.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public enum Direction {
    FORWARD,
    BACKWARD
}
