/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.spi.DataStore} - Persistence and lease protocol</li>
 *   <li>{@link com.ryuqq.scheduler.core.spi.EventBroker} - Event fan-out</li>
 *   <li>{@link com.ryuqq.scheduler.core.spi.EventTransport} - Cross-process notification transport</li>
 *   <li>{@link com.ryuqq.scheduler.core.spi.Serializer} - Value encoding</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Pluggability:</strong> In-memory implementations for tests, database backends for production</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.spi;
