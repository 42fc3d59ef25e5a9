/**
 * Broadcast channel package.
 *
 * <p>{@link com.ryuqq.statehub.core.channel.BroadcastChannel} is the fan-out primitive behind both the
 * state store (current-value and change-event channels) and the event bus (one channel per event type).</p>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.core.channel;
