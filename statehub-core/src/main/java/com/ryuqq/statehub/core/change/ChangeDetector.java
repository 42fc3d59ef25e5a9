package com.ryuqq.statehub.core.change;

import com.ryuqq.statehub.core.model.PropertyChange;

import java.util.List;

/**
 * Computes which top-level properties of a state instance changed across one mutation.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ChangeDetector detector = ChangeDetector.forStrategy(ComparisonStrategy.STRUCTURAL);
 *
 * Snapshot before = detector.snapshot(UserProfile.class, profile);
 * profile.getHomeAddress().setCity("New York");
 * List&lt;PropertyChange&gt; changes = detector.diff(UserProfile.class, before, profile);
 * // → [PropertyChange{homeAddress, Address{Boston}, Address{New York}}]
 * </pre>
 *
 * <p>Implementations are stateless apart from per-type caches and are safe to share
 * between threads.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public interface ChangeDetector {

    /**
     * Captures the comparison key of every readable property.
     *
     * @param type the state type
     * @param state the live state instance
     * @param <T> state type
     * @return snapshot to pass to {@link #diff(Class, Snapshot, Object)}
     * @throws IllegalArgumentException if type or state is null
     */
    <T> Snapshot snapshot(Class<T> type, T state);

    /**
     * Compares a snapshot with the post-mutation state.
     *
     * @param type the state type
     * @param before snapshot taken before the mutation
     * @param after the live state after the mutation
     * @param <T> state type
     * @return changed properties in declaration order (empty if nothing changed)
     * @throws IllegalArgumentException if an argument is null or the snapshot belongs to another type
     */
    <T> List<PropertyChange> diff(Class<T> type, Snapshot before, T after);

    /**
     * Returns the comparison strategy this detector applies.
     *
     * @return comparison strategy
     */
    ComparisonStrategy strategy();

    /**
     * Creates the default detector for a strategy.
     *
     * @param strategy comparison strategy
     * @return new detector
     * @throws IllegalArgumentException if strategy is null
     */
    static ChangeDetector forStrategy(ComparisonStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        return switch (strategy) {
            case STRUCTURAL -> new StructuralChangeDetector();
            case REFERENCE -> new ReferenceChangeDetector();
        };
    }
}
