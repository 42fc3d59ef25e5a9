package com.ryuqq.statehub.core.change;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Comparison keys of every readable property, captured immediately before a mutation.
 *
 * <p>A snapshot is opaque outside the detector that produced it and lives only for the
 * duration of one mutation. Keys may be null (a null property under reference comparison).</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class Snapshot {

    private final Class<?> stateType;
    private final ComparisonStrategy strategy;
    private final Map<String, Object> keys;

    Snapshot(Class<?> stateType, ComparisonStrategy strategy, Map<String, Object> keys) {
        this.stateType = stateType;
        this.strategy = strategy;
        this.keys = Collections.unmodifiableMap(new LinkedHashMap<>(keys));
    }

    /**
     * Returns the state type this snapshot was taken from.
     *
     * @return state type
     */
    public Class<?> stateType() {
        return stateType;
    }

    /**
     * Returns the strategy that produced the keys.
     *
     * @return comparison strategy
     */
    public ComparisonStrategy strategy() {
        return strategy;
    }

    /**
     * Returns the number of captured properties.
     *
     * @return property count
     */
    public int size() {
        return keys.size();
    }

    Object keyOf(String propertyName) {
        return keys.get(propertyName);
    }

    @Override
    public String toString() {
        return "Snapshot{" + stateType.getSimpleName() + ", " + strategy + ", properties=" + keys.keySet() + '}';
    }
}
