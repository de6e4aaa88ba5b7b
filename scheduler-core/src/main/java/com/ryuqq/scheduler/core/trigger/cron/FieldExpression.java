package com.ryuqq.scheduler.core.trigger.cron;

import java.time.LocalDateTime;

/**
 * Cron 필드 표현식 하나 (콤마로 구분된 항목 단위).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface FieldExpression {

    /**
     * 값이 이 표현식에 해당하는지 확인.
     *
     * @param value 필드 값
     * @param dateTime 값이 속한 날짜-시각 (달의 길이 등 문맥 계산용)
     * @return 해당하면 true
     */
    boolean matches(int value, LocalDateTime dateTime);
}
