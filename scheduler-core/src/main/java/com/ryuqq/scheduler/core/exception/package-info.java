/**
 * Scheduler error taxonomy.
 *
 * <p>All exceptions extend {@link com.ryuqq.scheduler.core.exception.SchedulerException}
 * (unchecked). Transient backend failures use
 * {@link com.ryuqq.scheduler.core.exception.DataStoreUnavailableException} so runners can retry them.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.exception;
