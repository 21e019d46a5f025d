/**
 * Runner Adapter Layer - Dispatcher 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.downstream.adapter.runner.DownstreamDispatcherFactory} - 테넌트별 동시성 상한 결정 + 인스턴스 생성</li>
 *   <li>{@link com.ryuqq.downstream.adapter.runner.BoundedDispatcher} - 토큰 풀 기반 fan-out, 순서 보존, 빠른 실패</li>
 *   <li>{@link com.ryuqq.downstream.adapter.runner.DispatcherConfig} - 기본 동시성, 스레드 이름, shutdown 대기 시간</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BoundedDispatcher)
 *   ↓ implements
 * application (Dispatcher, DispatcherFactory)
 *   ↓ depends on
 * core (QueryContext, TokenPool, RequestTranslator, ResponseTranslator)
 *   ↓ depends on
 * core/spi (DownstreamHandler, TenantResolver, LimitsProvider)
 * </pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
package com.ryuqq.downstream.adapter.runner;
