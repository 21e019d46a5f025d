package com.ryuqq.downstream.core.request;

import com.ryuqq.downstream.core.model.Direction;

import java.time.Instant;
import java.util.List;

/**
 * range 쿼리 요청.
 *
 * @param query 쿼리 텍스트
 * @param limit 결과 제한
 * @param stepMs 평가 간격 (밀리초)
 * @param intervalMs 샘플링 간격 (밀리초)
 * @param start 시작 시각
 * @param end 종료 시각
 * @param direction 정렬 방향
 * @param path 경로 태그 ({@link #PATH})
 * @param shards 인코딩된 shard 집합
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record RangeRequest(
    String query,
    int limit,
    long stepMs,
    long intervalMs,
    Instant start,
    Instant end,
    Direction direction,
    String path,
    List<String> shards
) implements DownstreamRequest {

    public static final String PATH = "/loki/api/v1/query_range";

    public RangeRequest {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (start == null || end == null) {
            throw new IllegalArgumentException("start and end cannot be null");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        shards = shards == null ? List.of() : List.copyOf(shards);
    }

    @Override
    public RangeRequest withQuery(String query) {
        return new RangeRequest(query, limit, stepMs, intervalMs, start, end, direction, path, shards);
    }
}
