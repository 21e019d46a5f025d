package com.ryuqq.downstream.core.spi;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.request.DownstreamRequest;
import com.ryuqq.downstream.core.response.DownstreamResponse;

/**
 * 번역된 요청 하나를 실행하는 downstream handler SPI.
 *
 * <p>구현체는 불투명한 실행 백엔드입니다 (HTTP 클라이언트, 큐 프론트엔드, 로컬 엔진 등).</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>thread-safe해야 합니다. 여러 worker가 동시에 호출합니다.</li>
 *   <li>ctx가 취소되면 빠르게 반환해야 합니다 (dispatcher는 이를 강제하지 않고 의존합니다).</li>
 *   <li>실패는 예외로 알립니다. unchecked 예외는 그대로 호출자에게 전파되고,
 *       checked 예외는 {@link com.ryuqq.downstream.core.exception.HandlerException}으로 래핑됩니다.</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DownstreamHandler {

    /**
     * 요청 실행.
     *
     * @param ctx 실행 범위 (취소 신호 포함)
     * @param request 번역된 요청
     * @return downstream 응답
     * @throws Exception 전송, 디코딩 등 실행 실패
     */
    DownstreamResponse execute(QueryContext ctx, DownstreamRequest request) throws Exception;
}
