package com.ryuqq.scheduler.core.trigger.cron;

import java.time.LocalDateTime;
import java.time.temporal.IsoFields;

/**
 * Cron 필드 종류 (유의미한 순서대로).
 *
 * <p>WEEK와 DAY_OF_WEEK는 날짜에서 파생되는 값이므로 직접 설정할 수 없고
 * (real = false), 값을 올려야 할 때는 DAY를 하루씩 올립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CronFieldType {

    YEAR("year", 1970, 9999, true, "*"),
    MONTH("month", 1, 12, true, "1"),
    DAY("day", 1, 31, true, "1"),
    WEEK("week", 1, 53, false, "*"),
    DAY_OF_WEEK("day_of_week", 0, 6, false, "*"),
    HOUR("hour", 0, 23, true, "0"),
    MINUTE("minute", 0, 59, true, "0"),
    SECOND("second", 0, 59, true, "0");

    private final String fieldName;
    private final int minValue;
    private final int maxValue;
    private final boolean real;
    private final String defaultExpression;

    CronFieldType(String fieldName, int minValue, int maxValue, boolean real, String defaultExpression) {
        this.fieldName = fieldName;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.real = real;
        this.defaultExpression = defaultExpression;
    }

    public String getFieldName() {
        return fieldName;
    }

    public int getMinValue() {
        return minValue;
    }

    /**
     * 달력과 무관한 최대값 (DAY는 31, WEEK는 53).
     *
     * @return 최대값
     */
    public int getMaxValue() {
        return maxValue;
    }

    public boolean isReal() {
        return real;
    }

    /**
     * 이 필드보다 유의미한 필드만 지정되었을 때 사용하는 기본 표현식.
     *
     * @return 기본 표현식
     */
    public String getDefaultExpression() {
        return defaultExpression;
    }

    /**
     * 날짜-시각에서 이 필드의 현재 값 추출.
     *
     * @param dateTime 기준 날짜-시각
     * @return 필드 값 (DAY_OF_WEEK는 월요일=0)
     */
    public int valueOf(LocalDateTime dateTime) {
        return switch (this) {
            case YEAR -> dateTime.getYear();
            case MONTH -> dateTime.getMonthValue();
            case DAY -> dateTime.getDayOfMonth();
            case WEEK -> dateTime.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
            case DAY_OF_WEEK -> dateTime.getDayOfWeek().getValue() - 1;
            case HOUR -> dateTime.getHour();
            case MINUTE -> dateTime.getMinute();
            case SECOND -> dateTime.getSecond();
        };
    }

    /**
     * 해당 날짜 기준 최대값 (달의 길이, 해의 주 수 반영).
     *
     * @param dateTime 기준 날짜-시각
     * @return 최대값
     */
    public int maxValueAt(LocalDateTime dateTime) {
        return switch (this) {
            case DAY -> dateTime.toLocalDate().lengthOfMonth();
            case WEEK -> (int) dateTime.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
            default -> maxValue;
        };
    }
}
