package com.ryuqq.downstream.core.exception;

import com.ryuqq.downstream.core.context.CancellationReason;

/**
 * 실행 범위가 모든 결과를 수집하기 전에 취소되었을 때 발생.
 *
 * <p>"작업이 완료되지 않았음"을 나타내며, 취소를 유발한 실패와는 구분됩니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class QueryCancelledException extends QueryExecutionException {

    private final CancellationReason reason;

    public QueryCancelledException(CancellationReason reason) {
        super("query execution did not complete: " + reason.description());
        this.reason = reason;
    }

    public QueryCancelledException(CancellationReason reason, Throwable cause) {
        super("query execution did not complete: " + reason.description(), cause);
        this.reason = reason;
    }

    public CancellationReason getReason() {
        return reason;
    }
}
