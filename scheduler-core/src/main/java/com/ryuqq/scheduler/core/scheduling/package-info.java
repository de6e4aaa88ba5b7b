/**
 * Misfire and coalescing calculation for acquired schedules.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.scheduling;
