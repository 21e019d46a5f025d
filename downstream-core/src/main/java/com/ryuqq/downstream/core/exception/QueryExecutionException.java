package com.ryuqq.downstream.core.exception;

/**
 * 쿼리 실행 실패의 공통 상위 예외.
 *
 * <p>이 계층의 예외는 모두 재시도 불가로 취급됩니다.
 * dispatcher는 어떤 하위 쿼리에서든 실패가 발생하면 전체 배치를 중단하고
 * 호출자에게 동기적으로 예외를 전파합니다 (부분 결과 없음).</p>
 *
 * <p><strong>하위 타입:</strong></p>
 * <ul>
 *   <li>{@link TranslationException}: 해석할 수 없는 응답 형태</li>
 *   <li>{@link DownstreamErrorException}: 응답 자체에 담긴 오류 (type + message)</li>
 *   <li>{@link HandlerException}: downstream handler 호출 실패 (checked 예외 래핑)</li>
 *   <li>{@link QueryCancelledException}: 모든 결과 수집 전 실행 범위 취소</li>
 * </ul>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public abstract class QueryExecutionException extends RuntimeException {

    protected QueryExecutionException(String message) {
        super(message);
    }

    protected QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
