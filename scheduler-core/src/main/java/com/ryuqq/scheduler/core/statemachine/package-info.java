/**
 * Job and scheduler lifecycle states with their transition rules.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.statemachine;
