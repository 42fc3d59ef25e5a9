package com.ryuqq.statehub.core.change;

import com.ryuqq.statehub.core.model.PropertyChange;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Property walk shared by both comparison strategies.
 *
 * <p>Subclasses decide what a comparison key is and how an old value is recovered from it.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
abstract class AbstractChangeDetector implements ChangeDetector {

    @Override
    public <T> Snapshot snapshot(Class<T> type, T state) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }

        Map<String, Object> keys = new LinkedHashMap<>();
        for (StateProperty property : StateProperties.of(type)) {
            keys.put(property.name(), comparisonKey(property, property.read(state)));
        }
        return new Snapshot(type, strategy(), keys);
    }

    @Override
    public <T> List<PropertyChange> diff(Class<T> type, Snapshot before, T after) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (before == null) {
            throw new IllegalArgumentException("before cannot be null");
        }
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        if (before.stateType() != type) {
            throw new IllegalArgumentException(
                "snapshot was taken from " + before.stateType().getName() + ", not " + type.getName());
        }

        List<PropertyChange> changes = new ArrayList<>();
        for (StateProperty property : StateProperties.of(type)) {
            Object newValue = property.read(after);
            Object afterKey = comparisonKey(property, newValue);
            Object beforeKey = before.keyOf(property.name());

            if (!sameKey(beforeKey, afterKey)) {
                changes.add(PropertyChange.of(property.name(), restoreOldValue(property, beforeKey), newValue));
            }
        }
        return changes;
    }

    /**
     * Key compared across the mutation.
     *
     * @param property the property being captured
     * @param value its current value (may be null)
     * @return comparison key (may be null)
     */
    protected abstract Object comparisonKey(StateProperty property, Object value);

    /**
     * Recovers the pre-mutation value from its key. Must not throw.
     *
     * @param property the changed property
     * @param key the key captured before the mutation
     * @return best-effort old value (may be null)
     */
    protected abstract Object restoreOldValue(StateProperty property, Object key);

    /**
     * Key equality. Defaults to {@link Objects#equals(Object, Object)}.
     *
     * @param before key captured before the mutation
     * @param after key computed after the mutation
     * @return true if the property is unchanged
     */
    protected boolean sameKey(Object before, Object after) {
        return Objects.equals(before, after);
    }
}
