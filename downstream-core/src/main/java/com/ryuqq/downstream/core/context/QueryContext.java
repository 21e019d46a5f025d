package com.ryuqq.downstream.core.context;

import com.ryuqq.downstream.core.exception.QueryCancelledException;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * 하나의 쿼리 실행에 동반되는 컨텍스트.
 *
 * <p>QueryContext는 두 가지를 운반합니다:</p>
 * <ul>
 *   <li>불변 key/value (예: 테넌트 org id)</li>
 *   <li>취소 상태 (호출자 타임아웃, 형제 작업 실패 등)</li>
 * </ul>
 *
 * <p>컨텍스트는 전역 상태가 아니라 모든 호출(supervisor, worker, collector, downstream handler)에
 * 명시적으로 전달되는 값입니다. 따라서 중첩되거나 반복되는 dispatcher 호출에서도 취소가 올바르게 합성됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * QueryContext root = QueryContext.background()
 *     .withValue(ContextTenantResolver.ORG_ID_KEY, "tenant-a");
 *
 * try (QueryScope scope = root.withTimeout(Duration.ofSeconds(30))) {
 *     List<QueryResult> results = dispatcher.downstream(scope.context(), queries);
 * }
 * }</pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class QueryContext {

    private static final QueryContext BACKGROUND = new QueryContext(Map.of(), Cancellation.NEVER);

    private final Map<String, Object> values;
    private final Cancellation cancellation;

    private QueryContext(Map<String, Object> values, Cancellation cancellation) {
        this.values = values;
        this.cancellation = cancellation;
    }

    /**
     * 취소되지 않는 빈 루트 컨텍스트.
     *
     * @return background 컨텍스트
     */
    public static QueryContext background() {
        return BACKGROUND;
    }

    /**
     * key/value를 추가한 자식 컨텍스트 생성.
     *
     * <p>자식은 이 컨텍스트의 취소 상태를 그대로 공유합니다.</p>
     *
     * @param key 키
     * @param value 값
     * @return 새 QueryContext
     * @throws IllegalArgumentException key 또는 value가 null인 경우
     */
    public QueryContext withValue(String key, Object value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        Map<String, Object> copy = new HashMap<>(values);
        copy.put(key, value);
        return new QueryContext(Map.copyOf(copy), cancellation);
    }

    /**
     * 값 조회.
     *
     * @param key 키
     * @param type 기대 타입
     * @param <T> 값 타입
     * @return 값 (없거나 타입이 다르면 empty)
     */
    public <T> Optional<T> value(String key, Class<T> type) {
        Object value = values.get(key);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    /**
     * 취소 가능한 자식 범위 생성.
     *
     * <p>부모가 취소되면 자식도 취소되지만, 자식의 취소는 부모에 영향을 주지 않습니다.
     * 반환된 QueryScope는 반드시 닫아야 합니다 (try-with-resources 권장).</p>
     *
     * @return 새 QueryScope
     */
    public QueryScope withCancel() {
        return new QueryScope(new QueryContext(values, cancellation.child()));
    }

    /**
     * 일정 시간 후 자동 취소되는 자식 범위 생성.
     *
     * @param timeout 제한 시간 (양수)
     * @return 새 QueryScope (시간 초과 시 DEADLINE_EXCEEDED로 취소)
     * @throws IllegalArgumentException timeout이 null이거나 양수가 아닌 경우
     */
    public QueryScope withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        QueryScope scope = withCancel();
        CompletableFuture.delayedExecutor(timeout.toNanos(), TimeUnit.NANOSECONDS)
            .execute(() -> scope.cancel(CancellationReason.DEADLINE_EXCEEDED));
        return scope;
    }

    /**
     * 취소 여부.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    /**
     * 취소 이유 조회.
     *
     * @return 취소 이유 (취소되지 않았으면 empty)
     */
    public Optional<CancellationReason> cancellationReason() {
        return Optional.ofNullable(cancellation.reason());
    }

    /**
     * 취소되었으면 QueryCancelledException을 던집니다.
     *
     * @throws QueryCancelledException 컨텍스트가 취소된 경우
     */
    public void throwIfCancelled() {
        CancellationReason reason = cancellation.reason();
        if (reason != null) {
            throw new QueryCancelledException(reason);
        }
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행됩니다.
     * background 컨텍스트에서는 리스너가 실행되지 않습니다.</p>
     *
     * @param listener 취소 시 실행할 작업 (빠르게 반환해야 함)
     * @return 등록 해제 핸들
     * @throws IllegalArgumentException listener가 null인 경우
     */
    public Registration onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        return cancellation.onCancel(listener);
    }

    boolean cancel(CancellationReason reason) {
        return cancellation.cancel(reason);
    }

    @Override
    public String toString() {
        return "QueryContext{values=" + values.keySet() + ", cancelled=" + isCancelled() + '}';
    }

    /**
     * 취소 리스너 등록 해제 핸들.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
