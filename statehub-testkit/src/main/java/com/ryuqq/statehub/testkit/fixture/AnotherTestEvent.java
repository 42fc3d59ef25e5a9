package com.ryuqq.statehub.testkit.fixture;

/**
 * Second event type, used to check that types are isolated from each other.
 *
 * @param success outcome flag
 * @author StateHub Team
 * @since 1.0.0
 */
public record AnotherTestEvent(boolean success) {
}
