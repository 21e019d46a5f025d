package com.ryuqq.downstream.core.request;

import com.ryuqq.downstream.core.model.Direction;

import java.util.List;

/**
 * downstream handler로 전달되는 요청.
 *
 * <p>두 가지 형태만 존재합니다:</p>
 * <ul>
 *   <li>{@link RangeRequest}: step/interval/start/end를 가진 range 쿼리</li>
 *   <li>{@link InstantRequest}: 단일 평가 시각을 가진 instant 쿼리</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public sealed interface DownstreamRequest permits RangeRequest, InstantRequest {

    String query();

    int limit();

    Direction direction();

    /**
     * 요청 종류를 식별하는 고정 경로 태그.
     *
     * @return 예: "/loki/api/v1/query_range"
     */
    String path();

    /**
     * 인코딩된 shard 집합.
     *
     * @return shard 토큰 목록 (빈 목록 허용)
     */
    List<String> shards();

    /**
     * 평가 간격 (밀리초).
     *
     * @return range 요청의 step, instant 요청은 0
     */
    long stepMs();

    /**
     * 쿼리 텍스트만 교체한 사본 생성.
     *
     * @param query 최종 쿼리 표현식 문자열
     * @return 새 요청
     */
    DownstreamRequest withQuery(String query);
}
