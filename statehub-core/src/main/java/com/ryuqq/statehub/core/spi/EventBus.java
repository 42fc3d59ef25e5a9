package com.ryuqq.statehub.core.spi;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;

import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Type-keyed publish/subscribe SPI.
 *
 * <p>Each event type owns one broadcast channel, created lazily on the first publish or
 * subscribe. Subscribers register against the exact event class; publishing a subclass does
 * not reach subscribers of its superclass.</p>
 *
 * <p><strong>Delivery Semantics:</strong></p>
 * <ul>
 *   <li>Synchronous, on the publishing thread, in subscription order</li>
 *   <li>No subscriber: the event is dropped</li>
 *   <li>{@code null} event: no-op</li>
 *   <li>Handler failure: logged and swallowed; the publisher and other subscribers are unaffected</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Disposable subscription = eventBus.subscribeAction(
 *     CartUpdated.class,
 *     event -&gt; refreshBadge(event.itemCount()),
 *     event -&gt; event.itemCount() &gt; 0);
 *
 * eventBus.publish(new CartUpdated(3));
 *
 * subscription.dispose();
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public interface EventBus {

    /**
     * Publishes an event to the subscribers of {@code type}.
     *
     * @param type the event type subscribers registered against
     * @param event the event (null is ignored)
     * @param <E> event type
     * @throws IllegalArgumentException if type is null
     * @throws IllegalStateException if the bus has been disposed
     */
    <E> void publish(Class<E> type, E event);

    /**
     * Publishes an event to the subscribers of its runtime class.
     *
     * @param event the event (null is ignored)
     * @throws IllegalStateException if the bus has been disposed
     */
    void publish(Object event);

    /**
     * Subscribes to every event of a type.
     *
     * @param type the event type
     * @param <E> event type
     * @return infinite stream, completed on disposal
     * @throws IllegalArgumentException if type is null
     * @throws IllegalStateException if the bus has been disposed
     */
    <E> Observable<E> subscribe(Class<E> type);

    /**
     * Subscribes to the events of a type that satisfy a predicate.
     *
     * @param type the event type
     * @param predicate filter applied per subscriber
     * @param <E> event type
     * @return infinite stream, completed on disposal
     * @throws IllegalArgumentException if type or predicate is null
     * @throws IllegalStateException if the bus has been disposed
     */
    <E> Observable<E> subscribe(Class<E> type, Predicate<? super E> predicate);

    /**
     * Invokes a handler for every event of a type.
     *
     * @param type the event type
     * @param handler callback invoked on the publishing thread
     * @param <E> event type
     * @return handle whose disposal stops delivery to this handler only
     * @throws IllegalArgumentException if type or handler is null
     * @throws IllegalStateException if the bus has been disposed
     */
    <E> Disposable subscribeAction(Class<E> type, Consumer<? super E> handler);

    /**
     * Invokes a handler for the events of a type that satisfy a predicate.
     *
     * @param type the event type
     * @param handler callback invoked on the publishing thread
     * @param predicate filter applied before the handler
     * @param <E> event type
     * @return handle whose disposal stops delivery to this handler only
     * @throws IllegalArgumentException if an argument is null
     * @throws IllegalStateException if the bus has been disposed
     */
    <E> Disposable subscribeAction(Class<E> type, Consumer<? super E> handler, Predicate<? super E> predicate);

    /**
     * Returns the number of live subscriptions for an event type.
     *
     * @param type the event type
     * @return live subscription count (0 if the type was never used)
     * @throws IllegalArgumentException if type is null
     */
    int subscriberCount(Class<?> type);

    /**
     * Completes every channel. Idempotent.
     */
    void dispose();

    /**
     * Returns whether {@link #dispose()} has been called.
     *
     * @return disposed flag
     */
    boolean isDisposed();
}
