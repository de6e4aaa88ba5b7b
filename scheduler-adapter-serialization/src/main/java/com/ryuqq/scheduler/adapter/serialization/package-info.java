/**
 * Jackson 기반 Serializer 어댑터.
 *
 * <p>Schedule, Job, JobResult, Event, 사용자 인자를 바이트로 인코딩합니다.
 * {@link com.ryuqq.scheduler.adapter.serialization.JsonSerializer}는 사람이 읽을 수 있는 JSON,
 * {@link com.ryuqq.scheduler.adapter.serialization.CborSerializer}는 compact한 CBOR 바이너리를 사용합니다.</p>
 *
 * <p>코어 모듈에는 Jackson 의존성이 없으므로 Trigger 다형성과 값 객체 매핑은
 * {@link com.ryuqq.scheduler.adapter.serialization.SchedulerModule}의 mix-in으로 선언합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.scheduler.adapter.serialization;
