package com.ryuqq.downstream.core.response;

import com.ryuqq.downstream.core.model.Direction;

import java.util.List;

/**
 * 로그 스트림 응답.
 *
 * <p>{@code error}가 비어있지 않으면 실패 응답이며, 이때 스트림 데이터는 무시됩니다.</p>
 *
 * @param status 상태 ("success" / "error")
 * @param direction 정렬 방향
 * @param limit 결과 제한
 * @param version 프로토콜 버전
 * @param streams 로그 스트림 목록
 * @param errorType 오류 타입 (null 허용)
 * @param error 오류 메시지 (null 허용)
 * @param statistics 실행 통계
 * @param headers 응답 헤더
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record LogStreamResponse(
    String status,
    Direction direction,
    int limit,
    int version,
    List<LogStream> streams,
    String errorType,
    String error,
    Statistics statistics,
    List<ResponseHeader> headers
) implements DownstreamResponse {

    public static final String RESULT_TYPE = "streams";

    public LogStreamResponse {
        streams = streams == null ? List.of() : List.copyOf(streams);
        statistics = statistics == null ? Statistics.empty() : statistics;
        headers = headers == null ? List.of() : List.copyOf(headers);
    }

    /**
     * 성공 응답 생성.
     */
    public static LogStreamResponse success(Direction direction, int limit, List<LogStream> streams,
                                            Statistics statistics, List<ResponseHeader> headers) {
        return new LogStreamResponse("success", direction, limit, 1, streams, null, null, statistics, headers);
    }

    /**
     * 실패 응답 생성.
     */
    public static LogStreamResponse failure(String errorType, String error) {
        return new LogStreamResponse("error", Direction.FORWARD, 0, 1, List.of(), errorType, error, null, null);
    }

    /**
     * 응답이 오류를 담고 있는지 여부.
     *
     * @return error 메시지가 비어있지 않으면 true
     */
    public boolean hasError() {
        return error != null && !error.isEmpty();
    }
}
