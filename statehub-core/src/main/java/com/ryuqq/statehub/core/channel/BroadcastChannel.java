package com.ryuqq.statehub.core.channel;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.subjects.BehaviorSubject;
import io.reactivex.rxjava3.subjects.PublishSubject;
import io.reactivex.rxjava3.subjects.Subject;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-subscriber stream of values of one type.
 *
 * <p><strong>Variants:</strong></p>
 * <ul>
 *   <li>{@link #currentValue(Object)}: replays the latest value to every new subscriber
 *       ({@link BehaviorSubject})</li>
 *   <li>{@link #changeEvents()}: carries values forward only, no replay ({@link PublishSubject})</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> the underlying subject is serialized, so {@link #publish(Object)}
 * may be called from several threads and subscribers never see overlapping calls. Without contention
 * a value is delivered on the publishing thread before {@code publish} returns, in subscription
 * order. When another thread is already emitting, the value is queued and that thread delivers it,
 * so {@code publish} may return before subscribers have seen it. Callers that need delivery to
 * finish before they continue must serialize their publishes, as the state store does under its
 * mutation lock.</p>
 *
 * <p><strong>Lifecycle:</strong> {@link #close()} completes every subscriber. Values published after
 * close are dropped; owners reject their own operations after disposal before reaching the channel.</p>
 *
 * @param <T> value type
 * @author StateHub Team
 * @since 1.0.0
 */
public final class BroadcastChannel<T> {

    private final Subject<T> subject;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger subscriberCount = new AtomicInteger();

    private BroadcastChannel(Subject<T> subject) {
        this.subject = subject.toSerialized();
    }

    /**
     * Creates a channel that replays its latest value.
     *
     * @param initial the value replayed until the first publish
     * @param <T> value type
     * @return new current-value channel
     * @throws IllegalArgumentException if initial is null
     */
    public static <T> BroadcastChannel<T> currentValue(T initial) {
        if (initial == null) {
            throw new IllegalArgumentException("initial cannot be null");
        }
        return new BroadcastChannel<>(BehaviorSubject.createDefault(initial));
    }

    /**
     * Creates a forward-only channel.
     *
     * @param <T> value type
     * @return new change-event channel
     */
    public static <T> BroadcastChannel<T> changeEvents() {
        return new BroadcastChannel<>(PublishSubject.create());
    }

    /**
     * Delivers a value to every current subscriber.
     *
     * @param value the value to broadcast
     * @throws IllegalArgumentException if value is null
     */
    public void publish(T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        if (closed.get()) {
            return;
        }
        subject.onNext(value);
    }

    /**
     * Returns a stream over this channel.
     *
     * <p>Each subscription is independent. Disposing one does not affect the others.</p>
     *
     * @return infinite stream, completed when the channel closes
     */
    public Observable<T> stream() {
        return subject
            .doOnSubscribe(disposable -> subscriberCount.incrementAndGet())
            .doFinally(subscriberCount::decrementAndGet);
    }

    /**
     * Completes every subscriber. Idempotent.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            subject.onComplete();
        }
    }

    /**
     * Returns the number of live subscriptions obtained through {@link #stream()}.
     *
     * @return live subscription count
     */
    public int subscriberCount() {
        return subscriberCount.get();
    }
}
