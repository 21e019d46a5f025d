package com.ryuqq.downstream.core.translate;

import com.ryuqq.downstream.core.model.QueryParams;
import com.ryuqq.downstream.core.model.ShardSet;
import com.ryuqq.downstream.core.request.DownstreamRequest;
import com.ryuqq.downstream.core.request.InstantRequest;
import com.ryuqq.downstream.core.request.RangeRequest;

/**
 * 논리 쿼리 파라미터 → downstream 요청 변환.
 *
 * <p>순수 함수이며 I/O가 없습니다. 결과 요청의 쿼리 텍스트는 파라미터의 원본 쿼리이며,
 * 최종 표현식 문자열은 호출자가 {@link DownstreamRequest#withQuery(String)}로 붙입니다.
 * 이렇게 두 단계로 나누면 같은 파라미터 객체를 여러 샤드 변형에 재사용할 수 있습니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class RequestTranslator {

    private RequestTranslator() {
    }

    /**
     * 요청 생성.
     *
     * <ul>
     *   <li>instant 파라미터: {@link InstantRequest} (평가 시각 = start)</li>
     *   <li>그 외: {@link RangeRequest} (step/interval은 밀리초)</li>
     * </ul>
     *
     * @param params 논리 파라미터
     * @param shards shard 집합
     * @return downstream 요청
     * @throws IllegalArgumentException params 또는 shards가 null인 경우
     */
    public static DownstreamRequest toRequest(QueryParams params, ShardSet shards) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (shards == null) {
            throw new IllegalArgumentException("shards cannot be null");
        }

        if (params.isInstant()) {
            return new InstantRequest(
                params.query(),
                params.limit(),
                params.start(),
                params.direction(),
                InstantRequest.PATH,
                shards.encode()
            );
        }
        return new RangeRequest(
            params.query(),
            params.limit(),
            params.step().toMillis(),
            params.interval().toMillis(),
            params.start(),
            params.end(),
            params.direction(),
            RangeRequest.PATH,
            shards.encode()
        );
    }
}
