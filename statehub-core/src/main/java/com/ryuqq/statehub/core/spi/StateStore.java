package com.ryuqq.statehub.core.spi;

import com.ryuqq.statehub.core.model.StateChange;
import io.reactivex.rxjava3.core.Observable;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Typed state store SPI.
 *
 * <p>Holds at most one live instance per state type, keyed by the type's {@link Class} token.
 * Instances are created on first access through the type's no-arg constructor.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Lazy, identity-stable access to the instance of each state type</li>
 *   <li>Serialized mutation with per-property change detection</li>
 *   <li>Broadcasting current values and change events to subscribers</li>
 * </ul>
 *
 * <p><strong>Mutation Sequence (atomic per type):</strong></p>
 * <pre>
 * acquire mutation lock
 *   1. snapshot(state)          → comparison keys of every readable property
 *   2. update(state)            → caller edits the live instance in place
 *   3. diff(snapshot, state)    → changed properties, declaration order
 *   4. publish current value    → always
 *   5. publish StateChange      → only if at least one property changed
 * release mutation lock
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: every method may be called concurrently from any thread</li>
 *   <li>Per type, notifications are observed in the order the operations completed</li>
 *   <li>After {@link #dispose()}, every operation throws {@link IllegalStateException}</li>
 * </ul>
 *
 * <p><strong>Reentrancy:</strong> the mutation lock is not reentrant. Subscribers must not call
 * {@code mutate} synchronously from inside a notification.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public interface StateStore {

    /**
     * Returns the instance of a state type, creating it on first access.
     *
     * <p>Repeated calls return the same instance until {@link #replace(Class, Object)} installs
     * another one.</p>
     *
     * @param type the state type
     * @param <T> state type
     * @return the live instance (never null)
     * @throws IllegalArgumentException if type is null or cannot be default-constructed
     * @throws IllegalStateException if the store has been disposed
     */
    <T> T get(Class<T> type);

    /**
     * Installs a new instance for a state type.
     *
     * <p>The value is published on the current-value channel. No change detection runs and
     * nothing is published on the change-event channel: a replacement is a reset, not a
     * tracked delta.</p>
     *
     * @param type the state type
     * @param state the new instance
     * @param <T> state type
     * @throws IllegalArgumentException if type or state is null
     * @throws IllegalStateException if the store has been disposed
     */
    <T> void replace(Class<T> type, T state);

    /**
     * Mutates the live instance under the mutation lock.
     *
     * <p>If {@code update} throws, the lock is released, the exception propagates and nothing
     * is published.</p>
     *
     * @param type the state type
     * @param update in-place edit of the live instance
     * @param <T> state type
     * @return the change, or empty if no property changed
     * @throws IllegalArgumentException if type or update is null
     * @throws IllegalStateException if the store has been disposed
     */
    <T> Optional<StateChange<T>> mutate(Class<T> type, Consumer<? super T> update);

    /**
     * Mutates the live instance with an asynchronous update.
     *
     * <p>The mutation lock is held until the stage returned by {@code update} completes, so a
     * slow update delays every later mutation that shares the lock. If the stage fails, the
     * returned future fails with the same cause and nothing is published.</p>
     *
     * <p>Waiting for the lock never blocks the calling thread: while another mutation holds it,
     * this method returns a pending future and {@code update} runs once the lock is handed over.</p>
     *
     * @param type the state type
     * @param update asynchronous in-place edit of the live instance
     * @param <T> state type
     * @return future completing with the change, or empty if no property changed
     * @throws IllegalArgumentException if type or update is null
     * @throws IllegalStateException if the store has been disposed
     */
    <T> CompletableFuture<Optional<StateChange<T>>> mutateAsync(
        Class<T> type, Function<? super T, ? extends CompletionStage<?>> update);

    /**
     * Streams the current value followed by every later value of a state type.
     *
     * @param type the state type
     * @param <T> state type
     * @return infinite stream, completed on disposal
     * @throws IllegalArgumentException if type is null
     * @throws IllegalStateException if the store has been disposed
     */
    <T> Observable<T> observeCurrent(Class<T> type);

    /**
     * Streams future change events of a state type. Past changes are not replayed.
     *
     * @param type the state type
     * @param <T> state type
     * @return infinite stream, completed on disposal
     * @throws IllegalArgumentException if type is null
     * @throws IllegalStateException if the store has been disposed
     */
    <T> Observable<StateChange<T>> observeChanges(Class<T> type);

    /**
     * Returns whether an instance of a state type has been created or installed.
     *
     * @param type the state type
     * @return true if {@link #get(Class)} would return an existing instance
     * @throws IllegalArgumentException if type is null
     * @throws IllegalStateException if the store has been disposed
     */
    boolean contains(Class<?> type);

    /**
     * Completes every channel and releases all resources. Idempotent.
     */
    void dispose();

    /**
     * Returns whether {@link #dispose()} has been called.
     *
     * @return disposed flag
     */
    boolean isDisposed();
}
