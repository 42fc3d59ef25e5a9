/**
 * Change detection package.
 *
 * <p>Decides which top-level properties of a state instance changed across one mutation.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statehub.core.change.ChangeDetector} - snapshot / diff contract</li>
 *   <li>{@link com.ryuqq.statehub.core.change.StructuralChangeDetector} - canonical JSON comparison (default)</li>
 *   <li>{@link com.ryuqq.statehub.core.change.ReferenceChangeDetector} - {@code equals} comparison</li>
 *   <li>{@link com.ryuqq.statehub.core.change.StateProperties} - cached per-type property enumeration</li>
 * </ul>
 *
 * <h2>Scope</h2>
 * <p>Only one level of publicly readable properties is tracked. A change anywhere below a
 * property is attributed to that property.</p>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.core.change;
