package com.ryuqq.statehub.testkit.fixture;

/**
 * State type a store cannot create on its own.
 *
 * @author StateHub Team
 * @since 1.0.0
 */
public class NoDefaultConstructorState {

    private final String id;

    public NoDefaultConstructorState(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }
}
