package com.ryuqq.downstream.core.context;

/**
 * 실행 범위(QueryContext)가 취소된 이유.
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public enum CancellationReason {

    /**
     * 호출자 또는 형제 작업 실패로 명시적으로 취소됨.
     */
    CANCELED("context canceled"),

    /**
     * withTimeout()으로 지정한 시간이 지나 취소됨.
     */
    DEADLINE_EXCEEDED("context deadline exceeded");

    private final String description;

    CancellationReason(String description) {
        this.description = description;
    }

    /**
     * 사람이 읽을 수 있는 설명.
     *
     * @return 설명 문자열 (예: "context canceled")
     */
    public String description() {
        return description;
    }
}
