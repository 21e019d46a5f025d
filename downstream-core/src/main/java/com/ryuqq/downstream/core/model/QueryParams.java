package com.ryuqq.downstream.core.model;

import java.time.Duration;
import java.time.Instant;

/**
 * 논리 쿼리 파라미터.
 *
 * <p>같은 파라미터 객체가 하나의 기본 쿼리에서 파생된 여러 샤드 변형에 재사용됩니다.</p>
 *
 * <p><strong>범위 판정:</strong> {@code start == end}이고 {@code step}이 0이면 instant 쿼리,
 * 그 외에는 range 쿼리입니다.</p>
 *
 * @param query 원본 쿼리 텍스트
 * @param start 시작 시각 (instant 쿼리의 평가 시각)
 * @param end 종료 시각 (start 이상)
 * @param step 평가 간격 (0 이상)
 * @param interval 로그 샘플링 간격 (0 이상)
 * @param direction 정렬 방향
 * @param limit 결과 제한 (0 이상)
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record QueryParams(
    String query,
    Instant start,
    Instant end,
    Duration step,
    Duration interval,
    Direction direction,
    int limit
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public QueryParams {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end cannot be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end cannot be before start (start: " + start + ", end: " + end + ")");
        }
        if (step == null || step.isNegative()) {
            throw new IllegalArgumentException("step must be non-negative (current: " + step + ")");
        }
        if (interval == null || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be non-negative (current: " + interval + ")");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
    }

    /**
     * range 쿼리 파라미터 생성.
     */
    public static QueryParams range(String query, Instant start, Instant end, Duration step,
                                    Duration interval, Direction direction, int limit) {
        return new QueryParams(query, start, end, step, interval, direction, limit);
    }

    /**
     * instant 쿼리 파라미터 생성 (start == end, step == 0).
     */
    public static QueryParams instant(String query, Instant time, Direction direction, int limit) {
        return new QueryParams(query, time, time, Duration.ZERO, Duration.ZERO, direction, limit);
    }

    /**
     * instant 평가 여부.
     *
     * @return start == end 이고 step == 0 이면 true
     */
    public boolean isInstant() {
        return start.equals(end) && step.isZero();
    }
}
