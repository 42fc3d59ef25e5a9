package com.ryuqq.statehub.adapter.inmemory.store;

import com.ryuqq.statehub.core.change.ChangeDetector;
import com.ryuqq.statehub.core.change.Snapshot;
import com.ryuqq.statehub.core.channel.BroadcastChannel;
import com.ryuqq.statehub.core.model.PropertyChange;
import com.ryuqq.statehub.core.model.StateChange;
import com.ryuqq.statehub.core.spi.StateStore;
import io.reactivex.rxjava3.core.Observable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory implementation of {@link StateStore} SPI.
 *
 * <p>Keeps one live instance per state type and two broadcast channels per type, all in
 * {@link ConcurrentHashMap} registries owned by this instance.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>states:</strong> ConcurrentHashMap&lt;Class, Object&gt; - Live instance per type, created on first access</li>
 *   <li><strong>currentValueChannels:</strong> ConcurrentHashMap&lt;Class, BroadcastChannel&gt; - Replaying channel per type</li>
 *   <li><strong>changeEventChannels:</strong> ConcurrentHashMap&lt;Class, BroadcastChannel&gt; - Forward-only change channel per type</li>
 *   <li><strong>typeLocks:</strong> ConcurrentHashMap&lt;Class, MutationLock&gt; - Mutation locks when {@link LockGranularity#PER_TYPE}</li>
 * </ul>
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li>Mutation locks are FIFO {@link MutationLock}s. {@code mutate} blocks while waiting;
 *       {@code mutateAsync} never blocks and returns a pending future instead</li>
 *   <li>A queued asynchronous update runs on the thread that releases the lock, usually the one
 *       completing the previous caller's stage</li>
 *   <li>{@code get}, {@code replace} and the observe methods take no mutation lock</li>
 *   <li>Subscribers run inside the lock; calling {@code mutate} from a notification deadlocks</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * StateStore store = new InMemoryStateStore();
 *
 * store.observeChanges(CartState.class)
 *     .subscribe(change -&gt; render(change.changedProperties()));
 *
 * Optional&lt;StateChange&lt;CartState&gt;&gt; change =
 *     store.mutate(CartState.class, cart -&gt; cart.getItems().add("apple"));
 *
 * store.dispose();
 * </pre>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private final StateStoreConfig config;
    private final ChangeDetector changeDetector;

    private final ConcurrentHashMap<Class<?>, Object> states;
    private final ConcurrentHashMap<Class<?>, BroadcastChannel<?>> currentValueChannels;
    private final ConcurrentHashMap<Class<?>, BroadcastChannel<?>> changeEventChannels;

    private final MutationLock globalLock;
    private final ConcurrentHashMap<Class<?>, MutationLock> typeLocks;

    private final AtomicBoolean disposed;

    /**
     * Creates a store with the default configuration (STRUCTURAL comparison, GLOBAL lock).
     */
    public InMemoryStateStore() {
        this(new StateStoreConfig());
    }

    /**
     * Creates a store with the given configuration.
     *
     * @param config store configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryStateStore(StateStoreConfig config) {
        this(config, config == null ? null : ChangeDetector.forStrategy(config.comparisonStrategy()));
    }

    /**
     * Creates a store with the given configuration and change detector.
     *
     * @param config store configuration
     * @param changeDetector detector used by {@code mutate}; must use the configured strategy
     * @throws IllegalArgumentException if an argument is null or the strategies differ
     */
    public InMemoryStateStore(StateStoreConfig config, ChangeDetector changeDetector) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (changeDetector == null) {
            throw new IllegalArgumentException("changeDetector cannot be null");
        }
        if (changeDetector.strategy() != config.comparisonStrategy()) {
            throw new IllegalArgumentException(
                "changeDetector strategy " + changeDetector.strategy()
                    + " does not match configured " + config.comparisonStrategy());
        }
        this.config = config;
        this.changeDetector = changeDetector;
        this.states = new ConcurrentHashMap<>();
        this.currentValueChannels = new ConcurrentHashMap<>();
        this.changeEventChannels = new ConcurrentHashMap<>();
        this.globalLock = new MutationLock();
        this.typeLocks = new ConcurrentHashMap<>();
        this.disposed = new AtomicBoolean(false);
    }

    @Override
    public <T> T get(Class<T> type) {
        requireType(type);
        ensureActive();
        return type.cast(states.computeIfAbsent(type, InMemoryStateStore::instantiate));
    }

    @Override
    public <T> void replace(Class<T> type, T state) {
        requireType(type);
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (!type.isInstance(state)) {
            throw new IllegalArgumentException(
                "state is a " + state.getClass().getName() + ", not a " + type.getName());
        }
        ensureActive();

        states.put(type, state);
        currentValueChannel(type).publish(state);
        log.debug("Replaced state {}", type.getName());
    }

    @Override
    public <T> Optional<StateChange<T>> mutate(Class<T> type, Consumer<? super T> update) {
        requireType(type);
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        ensureActive();

        MutationLock lock = lockFor(type);
        lock.acquire();
        try {
            T state = get(type);
            Snapshot before = changeDetector.snapshot(type, state);
            update.accept(state);
            return publishMutation(type, state, before);
        } finally {
            lock.release();
        }
    }

    @Override
    public <T> CompletableFuture<Optional<StateChange<T>>> mutateAsync(
        Class<T> type, Function<? super T, ? extends CompletionStage<?>> update) {
        requireType(type);
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        ensureActive();

        MutationLock lock = lockFor(type);
        CompletableFuture<Optional<StateChange<T>>> result = new CompletableFuture<>();
        lock.acquireAsync().thenRun(() -> applyAsync(type, update, lock, result));
        return result;
    }

    @Override
    public <T> Observable<T> observeCurrent(Class<T> type) {
        requireType(type);
        ensureActive();
        return currentValueChannel(type).stream();
    }

    @Override
    public <T> Observable<StateChange<T>> observeChanges(Class<T> type) {
        requireType(type);
        ensureActive();
        return changeEventChannel(type).stream();
    }

    @Override
    public boolean contains(Class<?> type) {
        requireType(type);
        ensureActive();
        return states.containsKey(type);
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        currentValueChannels.values().forEach(BroadcastChannel::close);
        changeEventChannels.values().forEach(BroadcastChannel::close);
        int stateCount = states.size();

        currentValueChannels.clear();
        changeEventChannels.clear();
        states.clear();
        typeLocks.clear();
        log.debug("Disposed state store ({} state types)", stateCount);
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Returns the configuration this store was created with.
     *
     * @return store configuration
     */
    public StateStoreConfig config() {
        return config;
    }

    private <T> void applyAsync(Class<T> type, Function<? super T, ? extends CompletionStage<?>> update,
                                MutationLock lock, CompletableFuture<Optional<StateChange<T>>> result) {
        final T state;
        final Snapshot before;
        final CompletionStage<?> stage;
        try {
            state = get(type);
            before = changeDetector.snapshot(type, state);
            stage = update.apply(state);
            if (stage == null) {
                throw new IllegalStateException("update returned a null stage for " + type.getName());
            }
        } catch (RuntimeException e) {
            lock.release();
            result.completeExceptionally(e);
            return;
        }

        stage.whenComplete((ignored, failure) -> {
            Optional<StateChange<T>> change = Optional.empty();
            Throwable error = failure;
            if (error == null) {
                try {
                    change = publishMutation(type, state, before);
                } catch (RuntimeException e) {
                    error = e;
                }
            }
            // release before completing so continuations of the result can mutate again
            lock.release();
            if (error != null) {
                result.completeExceptionally(unwrap(error));
            } else {
                result.complete(change);
            }
        });
    }

    private <T> Optional<StateChange<T>> publishMutation(Class<T> type, T state, Snapshot before) {
        List<PropertyChange> changes = changeDetector.diff(type, before, state);
        currentValueChannel(type).publish(state);
        if (changes.isEmpty()) {
            return Optional.empty();
        }

        StateChange<T> change = new StateChange<>(state, changes);
        changeEventChannel(type).publish(change);
        log.debug("Mutated state {}: {} changed", type.getSimpleName(), changes.size());
        return Optional.of(change);
    }

    @SuppressWarnings("unchecked")
    private <T> BroadcastChannel<T> currentValueChannel(Class<T> type) {
        return (BroadcastChannel<T>) currentValueChannels.computeIfAbsent(type, key -> {
            log.debug("Creating current-value channel for {}", type.getName());
            return BroadcastChannel.currentValue(get(type));
        });
    }

    @SuppressWarnings("unchecked")
    private <T> BroadcastChannel<StateChange<T>> changeEventChannel(Class<T> type) {
        return (BroadcastChannel<StateChange<T>>) changeEventChannels.computeIfAbsent(type, key -> {
            log.debug("Creating change-event channel for {}", type.getName());
            return BroadcastChannel.changeEvents();
        });
    }

    private MutationLock lockFor(Class<?> type) {
        if (config.lockGranularity() == LockGranularity.GLOBAL) {
            return globalLock;
        }
        return typeLocks.computeIfAbsent(type, key -> new MutationLock());
    }

    private static Throwable unwrap(Throwable failure) {
        if (failure instanceof CompletionException && failure.getCause() != null) {
            return failure.getCause();
        }
        return failure;
    }

    private static Object instantiate(Class<?> type) {
        try {
            Constructor<?> constructor = type.getDeclaredConstructor();
            constructor.trySetAccessible();
            Object instance = constructor.newInstance();
            log.debug("Created state {}", type.getName());
            return instance;
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(type.getName() + " has no no-arg constructor", e);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalArgumentException("Cannot construct " + type.getName(), e);
        } catch (InvocationTargetException e) {
            throw new IllegalArgumentException("Constructor of " + type.getName() + " failed", e.getCause());
        }
    }

    private static void requireType(Class<?> type) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    private void ensureActive() {
        if (disposed.get()) {
            throw new IllegalStateException("InMemoryStateStore has been disposed");
        }
    }
}
