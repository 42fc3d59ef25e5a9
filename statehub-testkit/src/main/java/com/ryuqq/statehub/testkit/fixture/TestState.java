package com.ryuqq.statehub.testkit.fixture;

/**
 * Flat state with one property of each common kind.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class TestState {

    private String name = "";
    private int counter;
    private boolean active;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getCounter() {
        return counter;
    }

    public void setCounter(int counter) {
        this.counter = counter;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }
}
