/**
 * Test support for scheduler adapters.
 *
 * <p>{@link com.ryuqq.scheduler.testkit.MutableClock} drives time explicitly and
 * {@link com.ryuqq.scheduler.testkit.RecordingEventBroker} captures published events.
 * Both are used by the contract suites in {@code contract}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.testkit;
