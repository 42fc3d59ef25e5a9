package com.ryuqq.statehub.application.scope;

import com.ryuqq.statehub.core.spi.EventBus;
import com.ryuqq.statehub.core.spi.StateStore;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 하나의 범위에 속한 StateStore와 EventBus 쌍.
 *
 * <p>두 인스턴스의 수명은 컨테이너와 같습니다. {@link #close()} 호출 시 둘 다 dispose되며,
 * 여러 번 호출해도 한 번만 처리됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (StateContainer container = new StateContainer("session-1", store, eventBus)) {
 *     container.store().mutate(CartState.class, cart -&gt; cart.getItems().add("apple"));
 *     container.eventBus().publish(new CartUpdated(1));
 * }
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class StateContainer implements AutoCloseable {

    private final String id;
    private final StateStore store;
    private final EventBus eventBus;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * StateContainer 생성.
     *
     * @param id 컨테이너 식별자 (세션 ID 또는 전역 식별자)
     * @param store 상태 저장소
     * @param eventBus 이벤트 버스
     * @throws IllegalArgumentException 파라미터가 null이거나 id가 빈 문자열인 경우
     */
    public StateContainer(String id, StateStore store, EventBus eventBus) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (eventBus == null) {
            throw new IllegalArgumentException("eventBus cannot be null");
        }
        this.id = id;
        this.store = store;
        this.eventBus = eventBus;
    }

    /**
     * 컨테이너 식별자 조회.
     *
     * @return 식별자
     */
    public String id() {
        return id;
    }

    /**
     * 상태 저장소 조회.
     *
     * @return StateStore
     * @throws IllegalStateException 컨테이너가 닫힌 경우
     */
    public StateStore store() {
        ensureOpen();
        return store;
    }

    /**
     * 이벤트 버스 조회.
     *
     * @return EventBus
     * @throws IllegalStateException 컨테이너가 닫힌 경우
     */
    public EventBus eventBus() {
        ensureOpen();
        return eventBus;
    }

    /**
     * 닫힘 여부 확인.
     *
     * @return close() 호출 여부
     */
    public boolean isClosed() {
        return closed.get();
    }

    /**
     * store와 bus를 dispose.
     *
     * <p>store dispose가 실패해도 bus dispose는 시도하며, 발생한 예외는 다시 던집니다.</p>
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            store.dispose();
        } finally {
            eventBus.dispose();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("StateContainer '" + id + "' has been closed");
        }
    }

    @Override
    public String toString() {
        return "StateContainer{id='" + id + "', closed=" + closed.get() + '}';
    }
}
