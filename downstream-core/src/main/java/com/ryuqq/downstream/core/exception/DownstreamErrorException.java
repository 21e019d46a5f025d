package com.ryuqq.downstream.core.exception;

/**
 * downstream 응답이 명시적으로 오류를 담고 있을 때 발생.
 *
 * <p>메시지는 항상 {@code "<errorType>: <error>"} 형식입니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class DownstreamErrorException extends QueryExecutionException {

    private final String errorType;
    private final String error;

    /**
     * 생성자.
     *
     * @param errorType 오류 타입 (예: "execution", "bad_data")
     * @param error 오류 메시지
     */
    public DownstreamErrorException(String errorType, String error) {
        super(errorType + ": " + error);
        this.errorType = errorType;
        this.error = error;
    }

    public String getErrorType() {
        return errorType;
    }

    public String getError() {
        return error;
    }
}
