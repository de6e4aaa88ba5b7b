package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.ryuqq.scheduler.core.model.CallableRef;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.Payload;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.trigger.CronTrigger;
import com.ryuqq.scheduler.core.trigger.Trigger;

import java.util.function.Function;

/**
 * 스케줄러 코어 타입용 Jackson 모듈.
 *
 * <p><strong>등록 내용:</strong></p>
 * <ul>
 *   <li>TaskId, ScheduleId, JobId, InstanceId, CallableRef: 문자열 값</li>
 *   <li>Payload: 바이너리 값</li>
 *   <li>Trigger: {@code "type"} 속성 기반 다형성</li>
 *   <li>CronTrigger: 필드 표현식 생성자 매핑</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchedulerModule extends SimpleModule {

    public SchedulerModule() {
        super("SchedulerModule");
        addValueObject(TaskId.class, TaskId::getValue, TaskId::of);
        addValueObject(ScheduleId.class, ScheduleId::getValue, ScheduleId::of);
        addValueObject(JobId.class, JobId::getValue, JobId::of);
        addValueObject(InstanceId.class, InstanceId::getValue, InstanceId::of);
        addValueObject(CallableRef.class, CallableRef::getValue, CallableRef::of);

        addSerializer(Payload.class, new PayloadSerializer());
        addDeserializer(Payload.class, new PayloadDeserializer());

        setMixInAnnotation(Trigger.class, TriggerMixins.TriggerMixin.class);
        setMixInAnnotation(CronTrigger.class, TriggerMixins.CronTriggerMixin.class);
    }

    private <T> void addValueObject(Class<T> type, Function<T, String> extractor, Function<String, T> factory) {
        addSerializer(type, new ValueObjectSerializer<>(type, extractor));
        addDeserializer(type, new ValueObjectDeserializer<>(type, factory));
    }
}
