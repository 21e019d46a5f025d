package com.ryuqq.downstream.core.context;

import java.util.ArrayList;
import java.util.List;

/**
 * QueryContext 트리의 취소 상태.
 *
 * <p>하나의 Cancellation은 여러 QueryContext(withValue로 파생된 컨텍스트)가 공유하며,
 * withCancel()로 만들어진 자식 Cancellation은 부모가 취소되면 같은 이유로 함께 취소됩니다.</p>
 *
 * <p>모든 상태 변경은 {@code lock}으로 보호됩니다. 리스너는 락 밖에서 호출됩니다.</p>
 *
 * @author Downstream Team
 * @since 1.0.0
 */
final class Cancellation {

    /**
     * 절대 취소되지 않는 루트 (background 컨텍스트용).
     */
    static final Cancellation NEVER = new Cancellation(false);

    private final boolean cancellable;
    private final Object lock = new Object();
    private final List<Runnable> listeners = new ArrayList<>();
    private CancellationReason reason;

    private Cancellation(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * 이 Cancellation에 연결된 자식 생성.
     *
     * <p>부모가 이미 취소된 경우 자식은 즉시 같은 이유로 취소됩니다.
     * 자식이 스스로 취소되면 부모의 리스너 목록에서 제거됩니다.</p>
     *
     * @return 자식 Cancellation
     */
    Cancellation child() {
        Cancellation child = new Cancellation(true);
        QueryContext.Registration link = onCancel(() -> child.cancel(reason()));
        child.onCancel(link::close);
        return child;
    }

    /**
     * 취소 (멱등).
     *
     * @param cancellationReason 취소 이유
     * @return 이번 호출로 취소 상태가 되었으면 true, 이미 취소되어 있었으면 false
     */
    boolean cancel(CancellationReason cancellationReason) {
        if (!cancellable) {
            throw new IllegalStateException("background context cannot be cancelled");
        }
        List<Runnable> toNotify;
        synchronized (lock) {
            if (reason != null) {
                return false;
            }
            reason = cancellationReason;
            toNotify = new ArrayList<>(listeners);
            listeners.clear();
        }
        for (Runnable listener : toNotify) {
            listener.run();
        }
        return true;
    }

    boolean isCancelled() {
        synchronized (lock) {
            return reason != null;
        }
    }

    CancellationReason reason() {
        synchronized (lock) {
            return reason;
        }
    }

    /**
     * 취소 리스너 등록.
     *
     * <p>이미 취소된 상태라면 호출 스레드에서 즉시 실행됩니다.</p>
     *
     * @param listener 취소 시 실행할 작업
     * @return 등록 해제 핸들
     */
    QueryContext.Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return () -> { };
        }
        synchronized (lock) {
            if (reason == null) {
                listeners.add(listener);
                return () -> {
                    synchronized (lock) {
                        listeners.remove(listener);
                    }
                };
            }
        }
        listener.run();
        return () -> { };
    }
}
