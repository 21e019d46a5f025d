package com.ryuqq.downstream.core.result;

import com.ryuqq.downstream.core.response.ResponseHeader;
import com.ryuqq.downstream.core.response.Statistics;

import java.util.List;

/**
 * 하위 쿼리 하나의 균일한 결과.
 *
 * <p>dispatcher 호출자가 보게 되는 유일한 형태입니다. 응답의 구체 형태(로그/샘플 스트림)는
 * {@link ResultValue}로 정규화됩니다.</p>
 *
 * @param statistics 실행 통계
 * @param data 결과 데이터
 * @param headers 응답 헤더
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record QueryResult(
    Statistics statistics,
    ResultValue data,
    List<ResponseHeader> headers
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException data가 null인 경우
     */
    public QueryResult {
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
        statistics = statistics == null ? Statistics.empty() : statistics;
        headers = headers == null ? List.of() : List.copyOf(headers);
    }
}
