package com.ryuqq.downstream.application.dispatcher;

import com.ryuqq.downstream.core.context.QueryContext;
import com.ryuqq.downstream.core.model.DownstreamQuery;
import com.ryuqq.downstream.core.result.QueryResult;

import java.util.List;

/**
 * 하위 쿼리 fan-out 실행자.
 *
 * <p>하나의 논리 쿼리 평가 동안만 사용되며, 관련 없는 쿼리 사이에서 공유되지 않습니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>동시에 실행 중인 하위 쿼리는 최대 {@link #parallelism()}개</li>
 *   <li>결과 i번째는 항상 입력 i번째에 대응 (완료 순서와 무관)</li>
 *   <li>하나라도 실패하면 나머지를 취소하고 예외 전파 (부분 결과 없음)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Dispatcher dispatcher = factory.buildDispatcher(ctx);
 * List&lt;QueryResult&gt; results = dispatcher.downstream(ctx, subQueries);
 * </pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * 하위 쿼리들을 downstream handler로 실행.
     *
     * <p>각 하위 쿼리는 요청으로 번역되어 handler에서 실행되고, 응답은 QueryResult로 번역됩니다.</p>
     *
     * @param ctx 호출자 컨텍스트 (취소 시 실행 중단)
     * @param queries 하위 쿼리 목록
     * @return 입력과 같은 순서의 결과 목록
     * @throws com.ryuqq.downstream.core.exception.QueryExecutionException 실행 실패 또는 취소
     * @throws IllegalArgumentException ctx 또는 queries가 null인 경우
     */
    List<QueryResult> downstream(QueryContext ctx, List<DownstreamQuery> queries);

    /**
     * 임의의 작업 함수를 하위 쿼리 목록에 대해 실행.
     *
     * @param ctx 호출자 컨텍스트
     * @param queries 하위 쿼리 목록
     * @param work 작업 함수
     * @return 입력과 같은 순서의 결과 목록
     * @throws com.ryuqq.downstream.core.exception.QueryExecutionException 취소 또는 checked 예외 래핑
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    List<QueryResult> forEach(QueryContext ctx, List<DownstreamQuery> queries, DownstreamWork work);

    /**
     * 이 인스턴스의 동시성 상한.
     *
     * @return 병렬도 p
     */
    int parallelism();
}
