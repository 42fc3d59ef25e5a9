package com.ryuqq.statehub.application.scope;

import com.ryuqq.statehub.core.spi.EventBus;
import com.ryuqq.statehub.core.spi.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link StateScope}에 따라 컨테이너를 나눠주는 StateContainerProvider 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>SESSION: 세션 ID별로 컨테이너를 지연 생성하여 ConcurrentHashMap에 보관</li>
 *   <li>GLOBAL: 최초 요청 시 하나의 컨테이너를 만들고 모든 세션에 같은 인스턴스 반환</li>
 * </ul>
 *
 * <p>store/bus 생성은 팩토리에 위임하므로 이 모듈은 어댑터 구현에 의존하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateContainerProvider provider = ScopedStateContainerProvider.session(
 *     InMemoryStateStore::new,
 *     InMemoryEventBus::new
 * );
 *
 * StateContainer container = provider.containerFor(sessionId);
 * // ... 연결 종료 시
 * provider.endSession(sessionId);
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class ScopedStateContainerProvider implements StateContainerProvider {

    private static final Logger log = LoggerFactory.getLogger(ScopedStateContainerProvider.class);

    /**
     * GLOBAL 범위 컨테이너의 식별자.
     */
    public static final String GLOBAL_CONTAINER_ID = "global";

    private final StateScope scope;
    private final Supplier<? extends StateStore> storeFactory;
    private final Supplier<? extends EventBus> eventBusFactory;

    private final ConcurrentHashMap<String, StateContainer> containers;
    private final AtomicBoolean closed;

    /**
     * ScopedStateContainerProvider 생성.
     *
     * @param scope 공유 범위
     * @param storeFactory 컨테이너마다 새 StateStore를 만드는 팩토리
     * @param eventBusFactory 컨테이너마다 새 EventBus를 만드는 팩토리
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ScopedStateContainerProvider(StateScope scope,
                                        Supplier<? extends StateStore> storeFactory,
                                        Supplier<? extends EventBus> eventBusFactory) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (storeFactory == null) {
            throw new IllegalArgumentException("storeFactory cannot be null");
        }
        if (eventBusFactory == null) {
            throw new IllegalArgumentException("eventBusFactory cannot be null");
        }
        this.scope = scope;
        this.storeFactory = storeFactory;
        this.eventBusFactory = eventBusFactory;
        this.containers = new ConcurrentHashMap<>();
        this.closed = new AtomicBoolean(false);
    }

    /**
     * 세션별 격리 provider 생성.
     *
     * @param storeFactory StateStore 팩토리
     * @param eventBusFactory EventBus 팩토리
     * @return SESSION 범위 provider
     */
    public static ScopedStateContainerProvider session(Supplier<? extends StateStore> storeFactory,
                                                       Supplier<? extends EventBus> eventBusFactory) {
        return new ScopedStateContainerProvider(StateScope.SESSION, storeFactory, eventBusFactory);
    }

    /**
     * 전역 공유 provider 생성.
     *
     * @param storeFactory StateStore 팩토리
     * @param eventBusFactory EventBus 팩토리
     * @return GLOBAL 범위 provider
     */
    public static ScopedStateContainerProvider global(Supplier<? extends StateStore> storeFactory,
                                                      Supplier<? extends EventBus> eventBusFactory) {
        return new ScopedStateContainerProvider(StateScope.GLOBAL, storeFactory, eventBusFactory);
    }

    @Override
    public StateContainer containerFor(String sessionId) {
        requireSessionId(sessionId);
        ensureOpen();

        String containerId = scope == StateScope.GLOBAL ? GLOBAL_CONTAINER_ID : sessionId;
        StateContainer container = containers.computeIfAbsent(containerId, this::createContainer);

        // close() may have drained the map between ensureOpen() and the insertion above
        if (closed.get()) {
            containers.remove(containerId, container);
            container.close();
            throw new IllegalStateException("ScopedStateContainerProvider has been closed");
        }
        return container;
    }

    @Override
    public void endSession(String sessionId) {
        requireSessionId(sessionId);
        if (scope == StateScope.GLOBAL) {
            log.debug("Session {} ended, global container kept", sessionId);
            return;
        }

        StateContainer container = containers.remove(sessionId);
        if (container != null) {
            container.close();
            log.debug("Closed state container for session {}", sessionId);
        }
    }

    @Override
    public int activeContainerCount() {
        return containers.size();
    }

    @Override
    public StateScope scope() {
        return scope;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }

        List<StateContainer> remaining = new ArrayList<>(containers.values());
        containers.clear();

        RuntimeException failure = null;
        for (StateContainer container : remaining) {
            try {
                container.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close state container {}", container.id(), e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        log.debug("Closed {} provider ({} containers)", scope, remaining.size());

        if (failure != null) {
            throw failure;
        }
    }

    /**
     * 닫힘 여부 확인.
     *
     * @return close() 호출 여부
     */
    public boolean isClosed() {
        return closed.get();
    }

    private StateContainer createContainer(String containerId) {
        StateStore store = storeFactory.get();
        if (store == null) {
            throw new IllegalStateException("storeFactory must not return null (container: " + containerId + ")");
        }

        EventBus eventBus;
        try {
            eventBus = eventBusFactory.get();
        } catch (RuntimeException e) {
            store.dispose();
            throw e;
        }
        if (eventBus == null) {
            store.dispose();
            throw new IllegalStateException("eventBusFactory must not return null (container: " + containerId + ")");
        }
        log.debug("Created {} state container {}", scope, containerId);
        return new StateContainer(containerId, store, eventBus);
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId cannot be null or blank");
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("ScopedStateContainerProvider has been closed");
        }
    }
}
