package com.ryuqq.statehub.adapter.inmemory.store;

import com.ryuqq.statehub.core.spi.StateStore;
import com.ryuqq.statehub.testkit.contract.AbstractStateStoreContractTest;

/**
 * Contract Tests for InMemoryStateStore with per-type mutation locks.
 *
 * <p>The whole contract must hold regardless of lock granularity.</p>
 *
 * @author StateHub Team
 * @since 1.0.0
 */
class PerTypeLockStateStoreContractTest extends AbstractStateStoreContractTest {

    @Override
    protected StateStore createStore() {
        return new InMemoryStateStore(new StateStoreConfig().withLockGranularity(LockGranularity.PER_TYPE));
    }
}
