/**
 * In-memory implementation of the EventBus SPI.
 *
 * <p>{@link com.ryuqq.statehub.adapter.inmemory.bus.InMemoryEventBus} keys one broadcast channel
 * by exact event class and delivers synchronously on the publishing thread.</p>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.adapter.inmemory.bus;
