package com.ryuqq.downstream.core.response;

import java.util.List;

/**
 * label 이름 조회 응답. 쿼리 결과로 변환할 수 없습니다.
 *
 * @param status 상태
 * @param names label 이름 목록
 * @param headers 응답 헤더
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record LabelNamesResponse(
    String status,
    List<String> names,
    List<ResponseHeader> headers
) implements DownstreamResponse {

    public LabelNamesResponse {
        names = names == null ? List.of() : List.copyOf(names);
        headers = headers == null ? List.of() : List.copyOf(headers);
    }
}
