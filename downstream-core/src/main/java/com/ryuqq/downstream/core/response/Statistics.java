package com.ryuqq.downstream.core.response;

/**
 * 실행 통계 요약.
 *
 * @param totalBytesProcessed 처리한 총 바이트
 * @param totalLinesProcessed 처리한 총 라인 수
 * @param execTimeSeconds 실행 시간 (초)
 * @param queueTimeSeconds 큐 대기 시간 (초)
 * @param subqueries 하위 쿼리 수
 * @param totalEntriesReturned 반환한 엔트리 수
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record Statistics(
    long totalBytesProcessed,
    long totalLinesProcessed,
    double execTimeSeconds,
    double queueTimeSeconds,
    int subqueries,
    long totalEntriesReturned
) {

    private static final Statistics EMPTY = new Statistics(0, 0, 0.0, 0.0, 0, 0);

    /**
     * 빈 통계.
     *
     * @return 모든 값이 0인 Statistics
     */
    public static Statistics empty() {
        return EMPTY;
    }
}
