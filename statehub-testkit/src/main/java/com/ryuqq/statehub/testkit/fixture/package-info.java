/**
 * Shared state and event types for the contract tests.
 *
 * <p>State types are mutable JavaBeans with a public no-arg constructor so that stores can
 * create them and the structural detector can rebuild old values.</p>
 *
 * @since 1.0.0
 * @author StateHub Team
 */
package com.ryuqq.statehub.testkit.fixture;
