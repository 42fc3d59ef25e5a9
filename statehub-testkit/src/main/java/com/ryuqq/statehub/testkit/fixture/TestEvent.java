package com.ryuqq.statehub.testkit.fixture;

/**
 * Event carrying a message and a number.
 *
 * @param message message text
 * @param value numeric payload
 * @author StateHub Team
 * @since 1.0.0
 */
public record TestEvent(String message, int value) {

    public static TestEvent of(int value) {
        return new TestEvent("event-" + value, value);
    }
}
