package com.ryuqq.downstream.core.response;

import java.util.List;
import java.util.Map;

/**
 * series 메타데이터 응답.
 *
 * <p>메타데이터 조회 엔드포인트의 응답 형태로, 쿼리 결과로 변환할 수 없습니다.</p>
 *
 * @param status 상태
 * @param series 라벨 맵 목록
 * @param headers 응답 헤더
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record SeriesResponse(
    String status,
    List<Map<String, String>> series,
    List<ResponseHeader> headers
) implements DownstreamResponse {

    public SeriesResponse {
        series = series == null ? List.of() : List.copyOf(series);
        headers = headers == null ? List.of() : List.copyOf(headers);
    }
}
