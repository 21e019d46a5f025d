package com.ryuqq.downstream.application.dispatcher;

import com.ryuqq.downstream.core.context.QueryContext;

/**
 * 쿼리 평가마다 Dispatcher를 생성하는 팩토리.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public interface DispatcherFactory {

    /**
     * 실행 컨텍스트에 맞는 Dispatcher 생성.
     *
     * <p>동시성 상한은 테넌트 override가 있으면 그 값, 없으면 기본값입니다.
     * I/O나 블로킹이 없습니다.</p>
     *
     * @param ctx 실행 컨텍스트
     * @return 새 Dispatcher 인스턴스
     */
    Dispatcher buildDispatcher(QueryContext ctx);
}
