package com.ryuqq.downstream.adapter.runner;

import com.ryuqq.downstream.application.dispatcher.Dispatcher;
import com.ryuqq.downstream.application.dispatcher.DownstreamWork;
import com.ryuqq.downstream.core.context.CancellationReason;
import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.context.QueryScope;
import com.ryuqq.downstream.core.exception.HandlerException;
import com.ryuqq.downstream.core.exception.QueryCancelledException;
import com.ryuqq.downstream.core.model.DownstreamQuery;
import com.ryuqq.downstream.core.protection.TokenPool;
import com.ryuqq.downstream.core.request.DownstreamRequest;
import com.ryuqq.downstream.core.response.DownstreamResponse;
import com.ryuqq.downstream.core.result.QueryResult;
import com.ryuqq.downstream.core.spi.DownstreamHandler;
import com.ryuqq.downstream.core.translate.RequestTranslator;
import com.ryuqq.downstream.core.translate.ResponseTranslator;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;

/**
 * 토큰 풀로 동시성을 제한하는 Dispatcher 구현체.
 *
 * <p>하나의 논리 쿼리 평가마다 {@link DownstreamDispatcherFactory}가 생성하며,
 * 평가가 끝나면 버려집니다. 같은 인스턴스에 대한 여러 호출은 하나의 토큰 풀을 공유하므로,
 * 한 쿼리 안에서 발생하는 모든 fan-out이 합쳐서 p개를 넘지 않습니다.</p>
 *
 * <p><strong>처리 흐름 ({@link #forEach}):</strong></p>
 * <pre>
 * forEach(ctx, queries, work)
 *   ↓
 * scope = ctx.withCancel()                 ← 모든 종료 경로에서 취소됨
 *   ↓
 * supervisor (태스크 1개):
 *   for i in 0..n-1:
 *     취소됨? → 중단
 *     tokens.acquire()                     ← 풀이 비어있으면 블로킹
 *     worker(i) 생성 후 즉시 다음 i로
 *   ↓
 * worker(i):
 *   work.execute(scope, queries[i])
 *   tokens.release()                       ← 성공/실패와 무관하게 항상
 *   취소되지 않았으면 (i, value, error) 게시
 *   ↓
 * collector (호출 스레드):
 *   n개 수집 → 오류면 즉시 실패 + 취소, 아니면 results[i]에 저장
 * </pre>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>태스크 간 공유 상태는 토큰 풀과 결과 큐 두 가지뿐</li>
 *   <li>토큰 획득은 인덱스 순서대로 시도되지만 완료 순서는 제한 없음</li>
 *   <li>결과는 인덱스 태그로 입력 순서에 맞춰 배치</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class BoundedDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(BoundedDispatcher.class);
    static final String SPAN_NAME = "DownstreamHandler.instance";

    private final int parallelism;
    private final TokenPool tokens;
    private final DownstreamHandler handler;
    private final ExecutorService executor;
    private final Tracer tracer;

    /**
     * 생성자.
     *
     * <p>parallelism 크기의 토큰 풀을 가득 채워 할당합니다.</p>
     *
     * @param parallelism 동시성 상한 (양수)
     * @param handler downstream handler
     * @param executor supervisor/worker 태스크 실행기 (최소 parallelism + 1개의 동시 태스크 수용)
     * @param tracer 하위 쿼리 span 생성용 Tracer
     * @throws IllegalArgumentException 인자가 유효하지 않은 경우
     */
    public BoundedDispatcher(int parallelism, DownstreamHandler handler, ExecutorService executor, Tracer tracer) {
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive (current: " + parallelism + ")");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (tracer == null) {
            throw new IllegalArgumentException("tracer cannot be null");
        }
        this.parallelism = parallelism;
        this.tokens = new TokenPool(parallelism);
        this.handler = handler;
        this.executor = executor;
        this.tracer = tracer;
    }

    @Override
    public List<QueryResult> downstream(QueryContext ctx, List<DownstreamQuery> queries) {
        Context traceParent = Context.current();
        return forEach(ctx, queries, (scope, query) -> execute(scope, query, traceParent));
    }

    @Override
    public List<QueryResult> forEach(QueryContext ctx, List<DownstreamQuery> queries, DownstreamWork work) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (queries == null) {
            throw new IllegalArgumentException("queries cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (queries.isEmpty()) {
            return List.of();
        }

        try (QueryScope scope = ctx.withCancel()) {
            QueryContext scoped = scope.context();
            BlockingQueue<TaggedResult> results = new LinkedBlockingQueue<>();

            // 호출자 취소를 collector에 전달
            QueryContext.Registration wakeCollector = scoped.onCancel(() -> results.offer(TaggedResult.CANCELLED));
            Future<?> supervisor = executor.submit(() -> dispatchAll(scoped, queries, work, results));
            try {
                return collect(scoped, queries.size(), results);
            } finally {
                scope.cancel();
                supervisor.cancel(true);
                wakeCollector.close();
            }
        }
    }

    @Override
    public int parallelism() {
        return parallelism;
    }

    TokenPool tokens() {
        return tokens;
    }

    /**
     * supervisor: 인덱스 순서대로 토큰을 획득하고 worker를 생성합니다.
     */
    private void dispatchAll(QueryContext scope, List<DownstreamQuery> queries,
                             DownstreamWork work, BlockingQueue<TaggedResult> results) {
        for (int i = 0; i < queries.size(); i++) {
            if (scope.isCancelled()) {
                return;
            }
            try {
                tokens.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (scope.isCancelled()) {
                tokens.release();
                return;
            }

            int index = i;
            DownstreamQuery query = queries.get(i);
            try {
                executor.execute(() -> runWorker(scope, index, query, work, results));
            } catch (RejectedExecutionException e) {
                tokens.release();
                results.offer(new TaggedResult(index, null, e));
                return;
            }
        }
    }

    private void runWorker(QueryContext scope, int index, DownstreamQuery query,
                           DownstreamWork work, BlockingQueue<TaggedResult> results) {
        QueryResult value = null;
        Throwable error = null;
        try {
            value = work.execute(scope, query);
            if (value == null) {
                error = new IllegalStateException("work returned null result for sub-query " + index);
            }
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            error = t;
        } finally {
            tokens.release();
        }

        // 이미 끝난 호출이면 결과를 버림
        if (!scope.isCancelled()) {
            results.offer(new TaggedResult(index, value, error));
        }
    }

    /**
     * collector: n개의 결과를 수집하여 입력 순서로 배치합니다.
     */
    private List<QueryResult> collect(QueryContext scope, int n, BlockingQueue<TaggedResult> results) {
        QueryResult[] collected = new QueryResult[n];
        for (int received = 0; received < n; received++) {
            TaggedResult next;
            try {
                next = results.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new QueryCancelledException(CancellationReason.CANCELED, e);
            }

            if (next == TaggedResult.CANCELLED) {
                throw new QueryCancelledException(scope.cancellationReason().orElse(CancellationReason.CANCELED));
            }
            if (next.error() != null) {
                log.debug("Sub-query {} of {} failed, cancelling remaining work", next.index(), n, next.error());
                throw propagate(next.error());
            }
            collected[next.index()] = next.value();
        }
        return Collections.unmodifiableList(Arrays.asList(collected));
    }

    /**
     * 표준 작업 단위: 요청 번역 → handler 실행 → 응답 번역.
     */
    private QueryResult execute(QueryContext scope, DownstreamQuery query, Context traceParent) throws Exception {
        DownstreamRequest request = RequestTranslator.toRequest(query.params(), query.shards())
            .withQuery(query.expression().render());

        Span span = tracer.spanBuilder(SPAN_NAME)
            .setParent(traceParent)
            .setAttribute("shards", query.shards().toString())
            .setAttribute("query", request.query())
            .setAttribute("step", request.stepMs())
            .setAttribute("handler", handler.getClass().getName())
            .startSpan();
        try (Scope ignored = span.makeCurrent()) {
            log.debug("Downstream sub-query shards={} query={} step={} handler={}",
                query.shards(), request.query(), request.stepMs(), handler.getClass().getName());

            DownstreamResponse response = handler.execute(scope, request);
            return ResponseTranslator.toResult(response);
        } catch (Exception e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            throw e;
        } finally {
            span.end();
        }
    }

    private static RuntimeException propagate(Throwable error) {
        if (error instanceof RuntimeException) {
            return (RuntimeException) error;
        }
        if (error instanceof Error) {
            throw (Error) error;
        }
        return new HandlerException(error);
    }

    /**
     * 인덱스 태그가 붙은 worker 결과.
     *
     * <p>{@link #CANCELLED}는 취소를 collector에 알리는 표지입니다.</p>
     */
    private record TaggedResult(int index, QueryResult value, Throwable error) {

        static final TaggedResult CANCELLED = new TaggedResult(-1, null, null);
    }
}
