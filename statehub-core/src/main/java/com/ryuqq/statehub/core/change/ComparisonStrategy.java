package com.ryuqq.statehub.core.change;

/**
 * How a property's before and after values are compared.
 *
 * <p><strong>Strategies:</strong></p>
 * <ul>
 *   <li>{@link #STRUCTURAL}: canonical JSON encoding of the whole reachable value. Detects
 *       in-place edits of nested objects and collections.</li>
 *   <li>{@link #REFERENCE}: native {@code equals}. Misses in-place edits reached through an
 *       unchanged reference; only suitable when state objects are replaced wholesale.</li>
 * </ul>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public enum ComparisonStrategy {

    /**
     * Serialize-then-compare (default).
     */
    STRUCTURAL,

    /**
     * {@link java.util.Objects#equals(Object, Object)} on the live values.
     */
    REFERENCE
}
