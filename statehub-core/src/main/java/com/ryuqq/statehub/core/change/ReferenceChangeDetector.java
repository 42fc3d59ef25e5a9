package com.ryuqq.statehub.core.change;

/**
 * Change detector comparing live values with their own {@code equals}.
 *
 * <p>The old value reported for a change is the reference held before the mutation. A nested
 * object edited in place is the same reference before and after, so the edit goes unnoticed.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public final class ReferenceChangeDetector extends AbstractChangeDetector {

    @Override
    protected Object comparisonKey(StateProperty property, Object value) {
        return value;
    }

    @Override
    protected Object restoreOldValue(StateProperty property, Object key) {
        return key;
    }

    @Override
    public ComparisonStrategy strategy() {
        return ComparisonStrategy.REFERENCE;
    }
}
