package com.ryuqq.scheduler.core.trigger.cron;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron 필드 표현식 파서.
 *
 * <p><strong>지원 문법:</strong></p>
 * <ul>
 *   <li>{@code *}, {@code *}/n, a, a-b, a-b/n, a/n, 콤마 목록</li>
 *   <li>월 이름 (jan~dec), 요일 이름 (mon~sun, 월요일=0)</li>
 *   <li>day 필드 전용: {@code last}, {@code last fri}, {@code 1st mon} ~ {@code 5th mon}</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CronFieldParser {

    private static final Pattern RANGE = Pattern.compile("^(\\*|[a-z0-9]+)(?:-([a-z0-9]+))?(?:/(\\d+))?$");
    private static final Pattern WEEKDAY_POSITION = Pattern.compile("^(1st|2nd|3rd|4th|5th|last) ([a-z]+)$");

    private static final List<String> MONTH_NAMES = List.of(
        "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"
    );
    private static final List<String> WEEKDAY_NAMES = List.of("mon", "tue", "wed", "thu", "fri", "sat", "sun");
    private static final Map<String, Integer> ORDINALS = Map.of("1st", 1, "2nd", 2, "3rd", 3, "4th", 4, "5th", 5, "last", 0);

    private CronFieldParser() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 필드 표현식 파싱.
     *
     * @param type 필드 종류
     * @param expression 표현식
     * @return 파싱된 CronField
     * @throws IllegalArgumentException 문법 오류 또는 범위를 벗어난 값인 경우
     */
    public static CronField parse(CronFieldType type, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Expression for " + type.getFieldName() + " cannot be null or blank");
        }
        List<FieldExpression> parsed = new ArrayList<>();
        for (String token : expression.split(",")) {
            parsed.add(parseToken(type, token.trim().toLowerCase(Locale.ROOT)));
        }
        return new CronField(type, expression.trim(), parsed);
    }

    private static FieldExpression parseToken(CronFieldType type, String token) {
        if (type == CronFieldType.DAY) {
            if (token.equals("last")) {
                return new LastDayOfMonthExpression();
            }
            Matcher position = WEEKDAY_POSITION.matcher(token);
            if (position.matches()) {
                int weekday = parseName(position.group(2), WEEKDAY_NAMES, type, token);
                return new WeekdayPositionExpression(ORDINALS.get(position.group(1)), DayOfWeek.of(weekday + 1));
            }
        }

        Matcher range = RANGE.matcher(token);
        if (!range.matches()) {
            throw new IllegalArgumentException(
                "Unrecognized expression '" + token + "' for field " + type.getFieldName()
            );
        }

        int step = range.group(3) == null ? 1 : Integer.parseInt(range.group(3));
        if (step <= 0) {
            throw new IllegalArgumentException("Step must be positive in '" + token + "'");
        }

        int first;
        int last;
        if (range.group(1).equals("*")) {
            if (range.group(2) != null) {
                throw new IllegalArgumentException("Wildcard cannot start a range in '" + token + "'");
            }
            first = type.getMinValue();
            last = type.getMaxValue();
        } else {
            first = parseValue(type, range.group(1), token);
            if (range.group(2) != null) {
                last = parseValue(type, range.group(2), token);
            } else {
                last = range.group(3) != null ? type.getMaxValue() : first;
            }
        }

        if (first > last) {
            if (type != CronFieldType.DAY_OF_WEEK) {
                throw new IllegalArgumentException(
                    "Range start cannot be greater than its end in '" + token + "' for field " + type.getFieldName()
                );
            }
            return new RangeExpression(first, last, step, WEEKDAY_NAMES.size());
        }
        return new RangeExpression(first, last, step, 0);
    }

    private static int parseValue(CronFieldType type, String text, String token) {
        int value;
        if (Character.isDigit(text.charAt(0))) {
            try {
                value = Integer.parseInt(text);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid number '" + text + "' in '" + token + "'", e);
            }
        } else if (type == CronFieldType.MONTH) {
            value = parseName(text, MONTH_NAMES, type, token) + 1;
        } else if (type == CronFieldType.DAY_OF_WEEK) {
            value = parseName(text, WEEKDAY_NAMES, type, token);
        } else {
            throw new IllegalArgumentException(
                "Names are not allowed for field " + type.getFieldName() + " in '" + token + "'"
            );
        }

        if (value < type.getMinValue() || value > type.getMaxValue()) {
            throw new IllegalArgumentException(
                "Value " + value + " out of range [" + type.getMinValue() + ", " + type.getMaxValue()
                    + "] for field " + type.getFieldName()
            );
        }
        return value;
    }

    private static int parseName(String name, List<String> names, CronFieldType type, String token) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException(
                "Unknown name '" + name + "' for field " + type.getFieldName() + " in '" + token + "'"
            );
        }
        return index;
    }
}
