package com.ryuqq.downstream.core.model;

/**
 * 불투명한 쿼리 표현식.
 *
 * <p>dispatcher는 표현식의 의미를 알지 못하며, 요청에 싣기 위해 문자열로 변환할 뿐입니다.
 * 쿼리 파서/샤딩 계층이 자신의 AST 타입으로 이 인터페이스를 구현합니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface QueryExpression {

    /**
     * 표현식 문자열화.
     *
     * @return downstream 요청에 실릴 쿼리 텍스트
     */
    String render();

    /**
     * 이미 문자열인 표현식 래핑.
     *
     * @param query 쿼리 텍스트
     * @return QueryExpression
     * @throws IllegalArgumentException query가 null인 경우
     */
    static QueryExpression of(String query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        return () -> query;
    }
}
