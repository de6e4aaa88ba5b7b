/**
 * In-memory EventBroker adapters.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.adapter.inmemory.bus.LocalEventBroker}:
 *       single-thread dispatch to subscribers in this process</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.inmemory.bus.TransportEventBroker}:
 *       encodes events and relays them through an {@link com.ryuqq.scheduler.core.spi.EventTransport}</li>
 *   <li>{@link com.ryuqq.scheduler.adapter.inmemory.bus.InMemoryEventTransport}:
 *       JVM-local transport for tests</li>
 * </ul>
 *
 * @see com.ryuqq.scheduler.core.spi.EventBroker
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.adapter.inmemory.bus;
