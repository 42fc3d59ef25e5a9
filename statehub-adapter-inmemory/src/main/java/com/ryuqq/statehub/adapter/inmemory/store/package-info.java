/**
 * In-memory implementation of the StateStore SPI.
 *
 * <p>This package provides {@link com.ryuqq.statehub.adapter.inmemory.store.InMemoryStateStore},
 * its immutable configuration record and the lock granularity option.</p>
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.statehub.adapter.inmemory.store.InMemoryStateStore} - Type-keyed state registry with serialized mutation</li>
 *   <li>{@link com.ryuqq.statehub.adapter.inmemory.store.StateStoreConfig} - Comparison strategy and lock granularity</li>
 *   <li>{@link com.ryuqq.statehub.adapter.inmemory.store.LockGranularity} - GLOBAL or PER_TYPE mutation lock</li>
 * </ul>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>State lives only as long as the store instance</li>
 *   <li>The mutation lock is not reentrant</li>
 * </ul>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.adapter.inmemory.store;
