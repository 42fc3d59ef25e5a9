package com.ryuqq.statehub.testkit.fixture;

/**
 * Second state type, used to check that types are isolated from each other.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class AnotherTestState {

    private boolean enabled;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
