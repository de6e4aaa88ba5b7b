/**
 * Trigger Engine: pure fire time calculation.
 *
 * <p>Every {@link com.ryuqq.scheduler.core.trigger.Trigger} maps a previous fire time to the
 * next one and carries no mutable state, so combinators
 * ({@link com.ryuqq.scheduler.core.trigger.AndTrigger}, {@link com.ryuqq.scheduler.core.trigger.OrTrigger})
 * can re-evaluate their children from any point.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.trigger;
