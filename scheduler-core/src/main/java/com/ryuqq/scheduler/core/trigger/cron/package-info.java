/**
 * Cron field parsing and matching used by {@link com.ryuqq.scheduler.core.trigger.CronTrigger}.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.trigger.cron;
