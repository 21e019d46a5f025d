package com.ryuqq.downstream.core.exception;

/**
 * downstream handler 호출 실패 (checked 예외 래핑).
 *
 * <p>handler가 던진 unchecked 예외는 래핑 없이 그대로 전파되며,
 * checked 예외(IOException 등)만 이 타입으로 감싸집니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class HandlerException extends QueryExecutionException {

    public HandlerException(Throwable cause) {
        super("downstream handler failed: " + cause.getMessage(), cause);
    }
}
