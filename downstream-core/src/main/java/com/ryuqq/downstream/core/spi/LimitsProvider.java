package com.ryuqq.downstream.core.spi;

import com.ryuqq.downstream.core.context.QueryContext;

/**
 * 테넌트별 제한값 조회 SPI.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LimitsProvider {

    /**
     * 테넌트의 최대 쿼리 병렬도 조회.
     *
     * <p>0 이하의 값은 "override 없음"을 의미하며, 이 경우 기본 동시성이 사용됩니다.</p>
     *
     * @param ctx 실행 컨텍스트
     * @param tenantId 테넌트 ID
     * @return 최대 병렬도 (0 이하: override 없음)
     */
    int maxQueryParallelism(QueryContext ctx, String tenantId);
}
