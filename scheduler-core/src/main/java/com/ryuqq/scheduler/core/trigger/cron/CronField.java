package com.ryuqq.scheduler.core.trigger.cron;

import java.time.LocalDateTime;
import java.util.List;
import java.util.OptionalInt;

/**
 * 파싱된 Cron 필드 (표현식 목록의 합집합).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CronField {

    private final CronFieldType type;
    private final String expression;
    private final List<FieldExpression> expressions;

    CronField(CronFieldType type, String expression, List<FieldExpression> expressions) {
        this.type = type;
        this.expression = expression;
        this.expressions = List.copyOf(expressions);
    }

    public CronFieldType getType() {
        return type;
    }

    public String getExpression() {
        return expression;
    }

    public int getValue(LocalDateTime dateTime) {
        return type.valueOf(dateTime);
    }

    public int getMin() {
        return type.getMinValue();
    }

    public int getMax(LocalDateTime dateTime) {
        return type.maxValueAt(dateTime);
    }

    /**
     * 현재 값 이상이면서 표현식에 해당하는 가장 작은 값.
     *
     * @param dateTime 기준 날짜-시각
     * @return 다음 값 (이 단위 안에 없으면 empty)
     */
    public OptionalInt getNextValue(LocalDateTime dateTime) {
        int max = getMax(dateTime);
        for (int value = getValue(dateTime); value <= max; value++) {
            if (matches(value, dateTime)) {
                return OptionalInt.of(value);
            }
        }
        return OptionalInt.empty();
    }

    private boolean matches(int value, LocalDateTime dateTime) {
        for (FieldExpression candidate : expressions) {
            if (candidate.matches(value, dateTime)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return type.getFieldName() + "='" + expression + "'";
    }
}
