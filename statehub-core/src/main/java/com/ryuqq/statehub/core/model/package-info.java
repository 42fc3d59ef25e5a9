/**
 * Change record package.
 *
 * <p>Immutable value types produced by the state store when a mutation changes state:</p>
 *
 * <h2>Records</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statehub.core.model.PropertyChange} - One changed top-level property (name, old, new)</li>
 *   <li>{@link com.ryuqq.statehub.core.model.StateChange} - Post-mutation state plus its ordered property changes</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records with defensive list copies</li>
 *   <li><strong>Validation:</strong> compact constructors reject missing data</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.core.model;
