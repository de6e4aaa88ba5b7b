/**
 * Core domain model package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.model.TaskId} - Task identifier</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.ScheduleId} - Schedule identifier</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.JobId} - Job identifier (UUID)</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.InstanceId} - Scheduler/worker process identifier (lease owner)</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.CallableRef} - Opaque function reference</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.Payload} - Encoded bytes crossing the DataStore boundary</li>
 * </ul>
 *
 * <h2>Entities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scheduler.core.model.Task} - Executable unit definition</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.Schedule} - Task bound to a Trigger, with lease fields</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.Job} - One execution request</li>
 *   <li>{@link com.ryuqq.scheduler.core.model.JobResult} - Outcome of a finished Job</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Records and final value objects, state changes return copies</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.scheduler.core.model;
