package com.ryuqq.downstream.adapter.runner;

import com.ryuqq.downstream.application.dispatcher.Dispatcher;
import com.ryuqq.downstream.application.dispatcher.DispatcherFactory;
import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.exception.TenantResolutionException;
import com.ryuqq.downstream.core.spi.DownstreamHandler;
import com.ryuqq.downstream.core.spi.LimitsProvider;
import com.ryuqq.downstream.core.spi.TenantResolver;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 쿼리 평가마다 {@link BoundedDispatcher}를 생성하는 팩토리.
 *
 * <p><strong>동시성 상한 결정:</strong></p>
 * <ol>
 *   <li>기본값 {@link DispatcherConfig#defaultConcurrency()} (128)으로 시작</li>
 *   <li>TenantResolver로 테넌트 ID 추출 (실패 시 기본값 유지, 오류 아님)</li>
 *   <li>LimitsProvider가 양수를 반환하면 그 값으로 교체</li>
 * </ol>
 *
 * <p>기본값보다 높은 병렬도가 설정된 테넌트가 이 계층에서 병목을 겪지 않도록
 * override는 기본값보다 커질 수 있습니다.</p>
 *
 * <p><strong>리소스:</strong> 팩토리는 모든 dispatcher 인스턴스가 공유하는 worker 스레드 풀을 소유합니다.
 * 동시 태스크 수는 인스턴스별 토큰 풀이 제한하므로 풀 자체는 상한을 두지 않습니다.
 * 사용이 끝나면 {@link #shutdown()}을 호출해야 합니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class DownstreamDispatcherFactory implements DispatcherFactory {

    private static final Logger log = LoggerFactory.getLogger(DownstreamDispatcherFactory.class);
    static final String INSTRUMENTATION_NAME = "com.ryuqq.downstream";

    private final DownstreamHandler handler;
    private final TenantResolver tenantResolver;
    private final LimitsProvider limits;
    private final DispatcherConfig config;
    private final Tracer tracer;
    private final ExecutorService workerExecutor;

    /**
     * 생성자 (기본 설정, no-op Tracer).
     *
     * @param handler downstream handler
     * @param tenantResolver 테넌트 추출기
     * @param limits 테넌트별 제한값
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DownstreamDispatcherFactory(DownstreamHandler handler, TenantResolver tenantResolver, LimitsProvider limits) {
        this(handler, tenantResolver, limits, new DispatcherConfig(),
            OpenTelemetry.noop().getTracer(INSTRUMENTATION_NAME));
    }

    /**
     * 생성자 (설정, Tracer 주입).
     *
     * @param handler downstream handler
     * @param tenantResolver 테넌트 추출기
     * @param limits 테넌트별 제한값
     * @param config 설정
     * @param tracer 하위 쿼리 span용 Tracer
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DownstreamDispatcherFactory(DownstreamHandler handler, TenantResolver tenantResolver, LimitsProvider limits,
                                       DispatcherConfig config, Tracer tracer) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (tenantResolver == null) {
            throw new IllegalArgumentException("tenantResolver cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer cannot be null");
        }

        this.handler = handler;
        this.tenantResolver = tenantResolver;
        this.limits = limits;
        this.config = config;
        this.tracer = tracer;
        this.workerExecutor = Executors.newCachedThreadPool(new WorkerThreadFactory(config.threadNamePrefix()));

        log.info("DownstreamDispatcherFactory initialized (defaultConcurrency={}, handler={})",
            config.defaultConcurrency(), handler.getClass().getName());
    }

    @Override
    public Dispatcher buildDispatcher(QueryContext ctx) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        return new BoundedDispatcher(resolveParallelism(ctx), handler, workerExecutor, tracer);
    }

    /**
     * 동시성 상한 결정.
     *
     * @param ctx 실행 컨텍스트
     * @return 테넌트 override (양수인 경우) 또는 기본값
     */
    int resolveParallelism(QueryContext ctx) {
        int parallelism = config.defaultConcurrency();

        String tenantId;
        try {
            tenantId = tenantResolver.resolve(ctx);
        } catch (TenantResolutionException e) {
            log.debug("No tenant resolved, using default parallelism {}: {}", parallelism, e.getMessage());
            return parallelism;
        }

        int override = limits.maxQueryParallelism(ctx, tenantId);
        if (override > 0) {
            parallelism = override;
        }
        return parallelism;
    }

    /**
     * 팩토리 종료 (worker 스레드 풀 정리).
     *
     * <p>진행 중인 작업이 완료되도록 shutdownTimeoutMs 동안 대기한 후, 남은 작업은 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
            log.warn("Worker pool did not terminate within {}ms, forcing shutdown", config.shutdownTimeoutMs());
            workerExecutor.shutdownNow();
        }
        log.info("DownstreamDispatcherFactory shut down");
    }

    /**
     * 이름이 붙은 daemon worker 스레드 생성기.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger sequence = new AtomicInteger();

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, prefix + "-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
