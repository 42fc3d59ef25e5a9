package com.ryuqq.statehub.adapter.inmemory.store;

import java.util.ArrayDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * 단일 소유자 FIFO 뮤테이션 잠금.
 *
 * <p>{@link #acquireAsync()}는 스레드를 막지 않고 소유권이 넘어올 때 완료되는 future를 반환합니다.
 * {@link #acquire()}는 같은 대기열에서 호출 스레드를 막고 기다립니다.</p>
 *
 * <p><strong>소유권 이전:</strong></p>
 * <pre>
 * release()
 *   ├─ 대기자 없음 → 잠금 해제
 *   └─ 대기자 있음 → 가장 오래된 대기자의 future 완료 (잠금은 계속 held)
 * </pre>
 *
 * <p>대기 중인 비동기 획득의 후속 작업은 {@link #release()}를 호출한 스레드에서 실행됩니다.
 * 잠금은 스레드에 묶이지 않으므로 획득한 스레드와 해제하는 스레드가 달라도 됩니다.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
final class MutationLock {

    private final ArrayDeque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private boolean held;

    /**
     * 잠금 획득 요청 (논블로킹).
     *
     * @return 이 호출자가 잠금을 소유하게 되면 완료되는 future
     */
    CompletableFuture<Void> acquireAsync() {
        synchronized (this) {
            if (!held) {
                held = true;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * 잠금 획득 (블로킹).
     *
     * <p>대기 중 인터럽트되면 대기열에서 빠지고, 그 사이 소유권을 받았다면 바로 반납합니다.</p>
     *
     * @throws RuntimeException 대기 중 인터럽트된 경우 (인터럽트 플래그 복원)
     */
    void acquire() {
        CompletableFuture<Void> waiter = acquireAsync();
        try {
            waiter.get();
        } catch (InterruptedException e) {
            abandon(waiter);
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for the mutation lock", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Mutation lock waiter failed", e.getCause());
        }
    }

    /**
     * 잠금 해제. 대기자가 있으면 가장 오래된 대기자에게 소유권을 넘깁니다.
     */
    void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            if (!held) {
                throw new IllegalStateException("Mutation lock is not held");
            }
            next = waiters.pollFirst();
            if (next == null) {
                held = false;
                return;
            }
        }
        next.complete(null);
    }

    private void abandon(CompletableFuture<Void> waiter) {
        boolean granted;
        synchronized (this) {
            granted = !waiters.remove(waiter);
        }
        if (granted) {
            release();
        }
    }
}
