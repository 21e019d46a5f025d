package com.ryuqq.downstream.core.response;

import java.util.List;

/**
 * 샘플 스트림 응답 (Prometheus vector/matrix).
 *
 * <p>{@code resultType}이 {@value #RESULT_TYPE_VECTOR}이면 각 스트림은 instant 쿼리 규약에 따라
 * 샘플을 하나만 가집니다. 그 외의 값은 matrix로 취급됩니다.</p>
 *
 * @param status 상태 ("success" / "error")
 * @param resultType 결과 형태 ("vector" / "matrix")
 * @param result 샘플 스트림 목록
 * @param errorType 오류 타입 (null 허용)
 * @param error 오류 메시지 (null 허용)
 * @param statistics 실행 통계
 * @param headers 응답 헤더
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record SampleStreamResponse(
    String status,
    String resultType,
    List<SampleStream> result,
    String errorType,
    String error,
    Statistics statistics,
    List<ResponseHeader> headers
) implements DownstreamResponse {

    public static final String RESULT_TYPE_VECTOR = "vector";
    public static final String RESULT_TYPE_MATRIX = "matrix";

    public SampleStreamResponse {
        result = result == null ? List.of() : List.copyOf(result);
        statistics = statistics == null ? Statistics.empty() : statistics;
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public static SampleStreamResponse vector(List<SampleStream> result, Statistics statistics) {
        return new SampleStreamResponse("success", RESULT_TYPE_VECTOR, result, null, null, statistics, null);
    }

    public static SampleStreamResponse matrix(List<SampleStream> result, Statistics statistics) {
        return new SampleStreamResponse("success", RESULT_TYPE_MATRIX, result, null, null, statistics, null);
    }

    public static SampleStreamResponse failure(String errorType, String error) {
        return new SampleStreamResponse("error", null, List.of(), errorType, error, null, null);
    }

    public boolean hasError() {
        return error != null && !error.isEmpty();
    }

    public boolean isVector() {
        return RESULT_TYPE_VECTOR.equals(resultType);
    }
}
