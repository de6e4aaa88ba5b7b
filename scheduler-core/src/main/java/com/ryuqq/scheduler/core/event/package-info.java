/**
 * Scheduler events published through the {@link com.ryuqq.scheduler.core.spi.EventBroker}.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.event;
