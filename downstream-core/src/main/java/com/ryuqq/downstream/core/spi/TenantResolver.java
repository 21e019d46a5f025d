package com.ryuqq.downstream.core.spi;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.exception.TenantResolutionException;

/**
 * 실행 컨텍스트에서 테넌트 ID를 추출하는 SPI.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TenantResolver {

    /**
     * 테넌트 ID 추출.
     *
     * @param ctx 실행 컨텍스트
     * @return 테넌트 ID
     * @throws TenantResolutionException 테넌트를 결정할 수 없는 경우 (없음, 다중 테넌트, 잘못된 형식)
     */
    String resolve(QueryContext ctx);
}
