/**
 * Execution substrate contracts: how a Job turns into a function call.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.executor;
