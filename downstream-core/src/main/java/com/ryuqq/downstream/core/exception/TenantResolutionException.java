package com.ryuqq.downstream.core.exception;

/**
 * 실행 컨텍스트에서 테넌트 ID를 추출하지 못했을 때 발생.
 *
 * <p>dispatcher factory는 이 예외를 "override 없음"으로 취급하고 기본 동시성으로 진행합니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public class TenantResolutionException extends RuntimeException {

    public TenantResolutionException(String message) {
        super(message);
    }
}
