package com.ryuqq.downstream.core.model;

/**
 * 하나의 하위 쿼리 (downstream 작업 단위).
 *
 * <p>불변이며 dispatcher 호출자가 소유합니다. 실행 중에는 복사되지 않고 참조만 됩니다.</p>
 *
 * @param expression 쿼리 표현식
 * @param params 논리 파라미터
 * @param shards shard 집합 (빈 집합 허용)
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public record DownstreamQuery(
    QueryExpression expression,
    QueryParams params,
    ShardSet shards
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException null 인자가 있는 경우
     */
    public DownstreamQuery {
        if (expression == null) {
            throw new IllegalArgumentException("expression cannot be null");
        }
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (shards == null) {
            throw new IllegalArgumentException("shards cannot be null");
        }
    }

    /**
     * 샤딩 없는 하위 쿼리 생성.
     */
    public static DownstreamQuery unsharded(QueryExpression expression, QueryParams params) {
        return new DownstreamQuery(expression, params, ShardSet.none());
    }
}
