/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the two primitives that consumers share state and messages through.
 * Adapter modules provide the concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statehub.core.spi.StateStore} - One instance per state type, serialized mutation, change events</li>
 *   <li>{@link com.ryuqq.statehub.core.spi.EventBus} - Type-keyed publish/subscribe with optional filtering</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., statehub-adapter-inmemory) implement these SPIs and are verified
 * with the abstract contract tests in statehub-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Explicit ownership:</strong> registries belong to one store/bus instance, never to static state</li>
 *   <li><strong>Fail fast after disposal:</strong> a disposed store or bus rejects every operation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.core.spi;
