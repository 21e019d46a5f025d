package com.ryuqq.downstream.core.request;

import com.ryuqq.downstream.core.model.Direction;

import java.time.Instant;
import java.util.List;

/**
 * instant 쿼리 요청.
 *
 * @param query 쿼리 텍스트
 * @param limit 결과 제한
 * @param time 평가 시각
 * @param direction 정렬 방향
 * @param path 경로 태그 ({@link #PATH})
 * @param shards 인코딩된 shard 집합
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record InstantRequest(
    String query,
    int limit,
    Instant time,
    Direction direction,
    String path,
    List<String> shards
) implements DownstreamRequest {

    public static final String PATH = "/loki/api/v1/query";

    public InstantRequest {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (time == null) {
            throw new IllegalArgumentException("time cannot be null");
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
    public long stepMs() {
        return 0;
    }

    @Override
    public InstantRequest withQuery(String query) {
        return new InstantRequest(query, limit, time, direction, path, shards);
    }
}
