package com.ryuqq.downstream.core.context;

/**
 * 취소 가능한 실행 범위.
 *
 * <p>{@link QueryContext#withCancel()} 또는 {@link QueryContext#withTimeout(java.time.Duration)}로 생성됩니다.
 * close()는 범위를 취소하므로, try-with-resources로 감싸면 모든 종료 경로(성공, 예외)에서
 * 범위 안의 작업이 취소 신호를 받습니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class QueryScope implements AutoCloseable {

    private final QueryContext context;

    QueryScope(QueryContext context) {
        this.context = context;
    }

    /**
     * 이 범위의 컨텍스트.
     *
     * @return 범위에 묶인 QueryContext
     */
    public QueryContext context() {
        return context;
    }

    /**
     * 범위 취소 (CANCELED).
     *
     * @return 이번 호출로 취소되었으면 true
     */
    public boolean cancel() {
        return cancel(CancellationReason.CANCELED);
    }

    boolean cancel(CancellationReason reason) {
        return context.cancel(reason);
    }

    @Override
    public void close() {
        cancel();
    }
}
