/**
 * Reusable contract tests for the StateHub SPIs.
 *
 * <p>Adapter modules extend {@link com.ryuqq.statehub.testkit.contract.AbstractStateStoreContractTest}
 * and {@link com.ryuqq.statehub.testkit.contract.AbstractEventBusContractTest} from their own test
 * sources and supply the instance under test. Every scenario then runs against that adapter.</p>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.testkit.contract;
