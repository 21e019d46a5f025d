package com.ryuqq.downstream.adapter.runner;

/**
 * Dispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultConcurrency: 테넌트 override가 없을 때의 동시성 상한 (기본 128)</li>
 *   <li>threadNamePrefix: worker 스레드 이름 접두사 (기본 "downstream-worker")</li>
 *   <li>shutdownTimeoutMs: shutdown 시 진행 중 작업 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong> defaultConcurrency는 downstream 백엔드가 하나의 쿼리에 대해
 * 감당할 수 있는 동시 요청 수에 맞춥니다. 테넌트별로 더 높은 병렬도가 필요하면
 * LimitsProvider의 override를 사용합니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 * @param defaultConcurrency 기본 동시성 상한 (1 이상)
 * @param threadNamePrefix worker 스레드 이름 접두사 (빈 문자열 불가)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 0 이상)
 */
public record DispatcherConfig(
    int defaultConcurrency,
    String threadNamePrefix,
    long shutdownTimeoutMs
) {

    public static final int DEFAULT_CONCURRENCY = 128;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultConcurrency=128, threadNamePrefix="downstream-worker", shutdownTimeoutMs=60000ms</p>
     */
    public DispatcherConfig() {
        this(DEFAULT_CONCURRENCY, "downstream-worker", 60_000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DispatcherConfig {
        if (defaultConcurrency <= 0) {
            throw new IllegalArgumentException(
                "defaultConcurrency must be positive (current: " + defaultConcurrency + ")"
            );
        }
        if (threadNamePrefix == null || threadNamePrefix.isBlank()) {
            throw new IllegalArgumentException("threadNamePrefix cannot be null or blank");
        }
        if (shutdownTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs cannot be negative (current: " + shutdownTimeoutMs + ")"
            );
        }
    }

    /**
     * defaultConcurrency만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withDefaultConcurrency(int defaultConcurrency) {
        return new DispatcherConfig(defaultConcurrency, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * threadNamePrefix만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withThreadNamePrefix(String threadNamePrefix) {
        return new DispatcherConfig(defaultConcurrency, threadNamePrefix, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public DispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new DispatcherConfig(defaultConcurrency, threadNamePrefix, shutdownTimeoutMs);
    }
}
