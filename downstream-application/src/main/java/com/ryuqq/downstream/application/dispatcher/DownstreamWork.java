package com.ryuqq.downstream.application.dispatcher;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.model.DownstreamQuery;
import com.ryuqq.downstream.core.result.QueryResult;

/**
 * 하위 쿼리 하나를 실행하는 작업 단위.
 *
 * <p>dispatcher는 작업의 내용을 알지 못하며, 동시성 제한과 순서 보존, 취소만 책임집니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DownstreamWork {

    /**
     * 하위 쿼리 실행.
     *
     * @param scope dispatcher 호출 하나에 묶인 취소 가능 범위
     * @param query 하위 쿼리
     * @return 결과
     * @throws Exception 실행 실패 (배치 전체가 중단됨)
     */
    QueryResult execute(QueryContext scope, DownstreamQuery query) throws Exception;
}
