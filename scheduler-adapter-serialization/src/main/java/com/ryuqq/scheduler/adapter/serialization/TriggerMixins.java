package com.ryuqq.scheduler.adapter.serialization;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.ryuqq.scheduler.core.trigger.AndTrigger;
import com.ryuqq.scheduler.core.trigger.CalendarIntervalTrigger;
import com.ryuqq.scheduler.core.trigger.CronTrigger;
import com.ryuqq.scheduler.core.trigger.DateTrigger;
import com.ryuqq.scheduler.core.trigger.IntervalTrigger;
import com.ryuqq.scheduler.core.trigger.OrTrigger;

import java.time.Instant;
import java.time.ZoneId;

/**
 * 코어 Trigger 타입에 Jackson 어노테이션을 덧씌우는 mix-in 모음.
 *
 * <p>코어 모듈은 외부 의존성이 없으므로 다형성 타입 정보와 생성자 매핑을 여기서 선언합니다.
 * 인코딩된 Trigger는 {@code "type"} 속성으로 변형을 구분합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
final class TriggerMixins {

    private TriggerMixins() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    @JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
    @JsonSubTypes({
        @JsonSubTypes.Type(value = DateTrigger.class, name = "date"),
        @JsonSubTypes.Type(value = IntervalTrigger.class, name = "interval"),
        @JsonSubTypes.Type(value = CalendarIntervalTrigger.class, name = "calendarinterval"),
        @JsonSubTypes.Type(value = CronTrigger.class, name = "cron"),
        @JsonSubTypes.Type(value = AndTrigger.class, name = "and"),
        @JsonSubTypes.Type(value = OrTrigger.class, name = "or")
    })
    interface TriggerMixin {
    }

    abstract static class CronTriggerMixin {

        @JsonCreator
        CronTriggerMixin(@JsonProperty("year") String year,
                         @JsonProperty("month") String month,
                         @JsonProperty("day") String day,
                         @JsonProperty("week") String week,
                         @JsonProperty("dayOfWeek") String dayOfWeek,
                         @JsonProperty("hour") String hour,
                         @JsonProperty("minute") String minute,
                         @JsonProperty("second") String second,
                         @JsonProperty("startTime") Instant startTime,
                         @JsonProperty("endTime") Instant endTime,
                         @JsonProperty("zone") ZoneId zone) {
        }
    }
}
