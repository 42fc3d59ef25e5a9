package com.ryuqq.statehub.adapter.inmemory.bus;

import com.ryuqq.statehub.core.channel.BroadcastChannel;
import com.ryuqq.statehub.core.spi.EventBus;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link EventBus} SPI.
 *
 * <p>One forward-only {@link BroadcastChannel} per event type, created on first use and kept
 * until {@link #dispose()}. Delivery is synchronous on the publishing thread.</p>
 *
 * <p><strong>Handler Failures:</strong></p>
 * <ul>
 *   <li>{@code subscribeAction} handlers: exception logged at WARN, handler stays subscribed</li>
 *   <li>Raw {@link Observable} subscribers: RxJava terminates the failing subscriber and routes the
 *       error to {@code RxJavaPlugins.onError}; other subscribers are unaffected</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * EventBus eventBus = new InMemoryEventBus();
 *
 * Disposable subscription = eventBus.subscribeAction(UserLoggedIn.class, event -&gt; greet(event.name()));
 * eventBus.publish(new UserLoggedIn("ryu"));
 *
 * subscription.dispose();
 * eventBus.dispose();
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final ConcurrentHashMap<Class<?>, BroadcastChannel<?>> channels;
    private final AtomicBoolean disposed;

    /**
     * Creates an empty bus.
     */
    public InMemoryEventBus() {
        this.channels = new ConcurrentHashMap<>();
        this.disposed = new AtomicBoolean(false);
    }

    @Override
    public <E> void publish(Class<E> type, E event) {
        requireType(type);
        ensureActive();
        if (event == null) {
            return;
        }
        if (!type.isInstance(event)) {
            throw new IllegalArgumentException(
                "event is a " + event.getClass().getName() + ", not a " + type.getName());
        }
        channel(type).publish(event);
    }

    @Override
    public void publish(Object event) {
        ensureActive();
        if (event == null) {
            return;
        }
        dispatch(event.getClass(), event);
    }

    @Override
    public <E> Observable<E> subscribe(Class<E> type) {
        requireType(type);
        ensureActive();
        return channel(type).stream();
    }

    @Override
    public <E> Observable<E> subscribe(Class<E> type, Predicate<? super E> predicate) {
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return subscribe(type).filter(predicate::test);
    }

    @Override
    public <E> Disposable subscribeAction(Class<E> type, Consumer<? super E> handler) {
        return subscribeAction(type, handler, event -> true);
    }

    @Override
    public <E> Disposable subscribeAction(Class<E> type, Consumer<? super E> handler, Predicate<? super E> predicate) {
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (predicate == null) {
            throw new IllegalArgumentException("predicate cannot be null");
        }
        return subscribe(type).subscribe(
            event -> deliver(type, handler, predicate, event),
            error -> log.warn("Subscription to {} terminated with error", type.getName(), error));
    }

    @Override
    public int subscriberCount(Class<?> type) {
        requireType(type);
        BroadcastChannel<?> channel = channels.get(type);
        return channel == null ? 0 : channel.subscriberCount();
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        channels.values().forEach(BroadcastChannel::close);
        int channelCount = channels.size();
        channels.clear();
        log.debug("Disposed event bus ({} event types)", channelCount);
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    private static <E> void deliver(Class<E> type, Consumer<? super E> handler,
                                    Predicate<? super E> predicate, E event) {
        try {
            if (predicate.test(event)) {
                handler.accept(event);
            }
        } catch (RuntimeException e) {
            log.warn("Handler for {} failed, event dropped for this handler", type.getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private <E> void dispatch(Class<E> type, Object event) {
        channel(type).publish((E) event);
    }

    @SuppressWarnings("unchecked")
    private <E> BroadcastChannel<E> channel(Class<E> type) {
        return (BroadcastChannel<E>) channels.computeIfAbsent(type, key -> {
            log.debug("Creating event channel for {}", type.getName());
            return BroadcastChannel.changeEvents();
        });
    }

    private static void requireType(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    private void ensureActive() {
        if (disposed.get()) {
            throw new IllegalStateException("InMemoryEventBus has been disposed");
        }
    }
}
