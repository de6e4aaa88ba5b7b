/**
 * Contract Test suites for SPI implementations.
 *
 * <p>An adapter module proves conformance by extending
 * {@link com.ryuqq.scheduler.testkit.contract.AbstractDataStoreContractTest} or
 * {@link com.ryuqq.scheduler.testkit.contract.AbstractEventBrokerContractTest}
 * in its own test sources and supplying the instance under test.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.testkit.contract;
