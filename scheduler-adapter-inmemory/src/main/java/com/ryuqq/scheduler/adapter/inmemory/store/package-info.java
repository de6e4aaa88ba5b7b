/**
 * In-memory DataStore adapter.
 *
 * <p>{@link com.ryuqq.scheduler.adapter.inmemory.store.InMemoryDataStore} implements the
 * full lease protocol of {@link com.ryuqq.scheduler.core.spi.DataStore} inside one JVM.
 * Several schedulers can share one instance to exercise lease contention in tests.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not shared across processes</li>
 * </ul>
 *
 * @see com.ryuqq.scheduler.core.spi.DataStore
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.adapter.inmemory.store;
