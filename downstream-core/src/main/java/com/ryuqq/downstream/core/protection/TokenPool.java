package com.ryuqq.downstream.core.protection;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * 고정 용량 토큰 풀 (counting semaphore).
 *
 * <p>동시에 실행 중인 downstream 작업 수를 제한합니다. 생성 시 capacity만큼 가득 채워지며,
 * 풀의 크기는 인스턴스 수명 동안 변하지 않습니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>acquire(): 풀이 비어있으면 토큰이 반환될 때까지 블로킹 (인터럽트 가능)</li>
 *   <li>release(): 항상 즉시 반환, 블로킹 없음</li>
 *   <li>획득한 것보다 많이 반환하면 IllegalStateException (누수/중복 반환 탐지)</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * pool.acquire();
 * try {
 *     // downstream 작업 실행
 * } finally {
 *     pool.release();
 * }
 * }</pre>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
public final class TokenPool {

    private final int capacity;
    private final BlockingQueue<Token> tokens;

    /**
     * 가득 찬 토큰 풀 생성.
     *
     * @param capacity 토큰 수 (양수)
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public TokenPool(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        this.capacity = capacity;
        this.tokens = new ArrayBlockingQueue<>(capacity);
        for (int i = 0; i < capacity; i++) {
            tokens.add(Token.PERMIT);
        }
    }

    /**
     * 토큰 획득 (블로킹).
     *
     * @throws InterruptedException 대기 중 인터럽트 발생
     */
    public void acquire() throws InterruptedException {
        tokens.take();
    }

    /**
     * 토큰 획득 시도 (비블로킹).
     *
     * @return 획득했으면 true
     */
    public boolean tryAcquire() {
        return tokens.poll() != null;
    }

    /**
     * 토큰 반환 (비블로킹).
     *
     * @throws IllegalStateException 풀이 이미 가득 찬 경우 (획득 없이 반환)
     */
    public void release() {
        if (!tokens.offer(Token.PERMIT)) {
            throw new IllegalStateException("token released without matching acquire (capacity: " + capacity + ")");
        }
    }

    /**
     * 현재 사용 가능한 토큰 수.
     *
     * @return 남은 토큰 수
     */
    public int available() {
        return tokens.size();
    }

    /**
     * 현재 사용 중인 토큰 수.
     *
     * @return capacity - available
     */
    public int inUse() {
        return capacity - tokens.size();
    }

    public int capacity() {
        return capacity;
    }

    /**
     * 내용 없는 교환 가능 토큰.
     */
    private enum Token {
        PERMIT
    }
}
