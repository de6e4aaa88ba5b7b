package com.ryuqq.scheduler.core.trigger;

import com.ryuqq.scheduler.core.trigger.cron.CronField;
import com.ryuqq.scheduler.core.trigger.cron.CronFieldParser;
import com.ryuqq.scheduler.core.trigger.cron.CronFieldType;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.time.zone.ZoneOffsetTransition;
import java.time.zone.ZoneRules;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Cron 스타일 필드 표현식으로 실행 시각 계산.
 *
 * <p><strong>필드:</strong> year, month, day, week(ISO 주차), day_of_week(월요일=0), hour, minute, second.
 * 지정한 필드 중 가장 덜 유의미한 필드보다 덜 유의미한 필드는 최소값(예: minute=0, second=0)이,
 * 더 유의미한 필드는 {@code *}가 기본값입니다. 예를 들어 {@code hour=9}만 지정하면
 * 매일 09:00:00에 실행됩니다.</p>
 *
 * <p><strong>계산 규칙:</strong></p>
 * <ul>
 *   <li>지정한 시간대의 벽시계 시각 기준으로 필드 단위 올림(carry) 계산</li>
 *   <li>달의 길이와 윤년을 반영하며, 존재하지 않는 날짜(예: 2월 31일)는 건너뜀</li>
 *   <li>서머타임 공백에 걸린 시각은 건너뛰고, 중복 구간은 직전 시각의 오프셋을 우선</li>
 *   <li>day와 day_of_week를 함께 지정하면 두 조건을 모두 만족해야 함</li>
 * </ul>
 *
 * <pre>
 * // 평일 09:30
 * CronTrigger trigger = CronTrigger.of(ZoneId.of("Asia/Seoul"))
 *     .withDayOfWeek("mon-fri")
 *     .withHour("9")
 *     .withMinute("30");
 *
 * // crontab 문법 (0 또는 7 = 일요일)
 * CronTrigger nightly = CronTrigger.fromCrontab("0 2 * * 1-5", ZoneOffset.UTC);
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CronTrigger implements Trigger {

    private static final String[] CRONTAB_WEEKDAYS = {"sun", "mon", "tue", "wed", "thu", "fri", "sat", "sun"};
    private static final int MAX_DST_ADJUSTMENTS = 100;

    private final String year;
    private final String month;
    private final String day;
    private final String week;
    private final String dayOfWeek;
    private final String hour;
    private final String minute;
    private final String second;
    private final Instant startTime;
    private final Instant endTime;
    private final ZoneId zone;
    private final List<CronField> fields;

    /**
     * 생성자.
     *
     * <p>필드 인자가 null이면 "지정하지 않음"을 뜻하며 기본값 규칙이 적용됩니다.</p>
     *
     * @throws IllegalArgumentException 표현식 문법 오류, zone 누락, end가 start보다 이른 경우
     */
    public CronTrigger(String year, String month, String day, String week, String dayOfWeek,
                       String hour, String minute, String second,
                       Instant startTime, Instant endTime, ZoneId zone) {
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
        if (startTime != null && endTime != null && endTime.isBefore(startTime)) {
            throw new IllegalArgumentException(
                "endTime cannot be before startTime (start: " + startTime + ", end: " + endTime + ")"
            );
        }
        this.year = year;
        this.month = month;
        this.day = day;
        this.week = week;
        this.dayOfWeek = dayOfWeek;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
        this.startTime = startTime;
        this.endTime = endTime;
        this.zone = zone;
        this.fields = compile(new String[] {year, month, day, week, dayOfWeek, hour, minute, second});
    }

    /**
     * 필드를 지정하지 않은 CronTrigger (매년 1월 1일 00:00:00).
     *
     * @param zone 시간대
     * @return CronTrigger 인스턴스
     */
    public static CronTrigger of(ZoneId zone) {
        return new CronTrigger(null, null, null, null, null, null, null, null, null, null, zone);
    }

    /**
     * crontab 5필드 표현식(minute hour day month day_of_week)으로 생성.
     *
     * <p>crontab 관례에 따라 요일 숫자는 0과 7이 일요일입니다.</p>
     *
     * @param expression crontab 표현식
     * @param zone 시간대
     * @return CronTrigger 인스턴스
     * @throws IllegalArgumentException 필드 개수가 5개가 아니거나 문법 오류인 경우
     */
    public static CronTrigger fromCrontab(String expression, ZoneId zone) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Crontab expression cannot be null or blank");
        }
        String[] values = expression.trim().split("\\s+");
        if (values.length != 5) {
            throw new IllegalArgumentException(
                "Wrong number of fields in crontab expression; got " + values.length + ", expected 5"
            );
        }
        return new CronTrigger(null, values[3], values[2], null, translateCrontabWeekdays(values[4]),
            values[1], values[0], null, null, null, zone);
    }

    private static String translateCrontabWeekdays(String expression) {
        List<String> tokens = new ArrayList<>();
        for (String token : expression.split(",")) {
            String[] stepParts = token.split("/", 2);
            String[] rangeParts = stepParts[0].split("-", 2);
            StringBuilder translated = new StringBuilder(translateCrontabWeekday(rangeParts[0]));
            if (rangeParts.length == 2) {
                translated.append('-').append(translateCrontabWeekday(rangeParts[1]));
            }
            if (stepParts.length == 2) {
                translated.append('/').append(stepParts[1]);
            }
            tokens.add(translated.toString());
        }
        return String.join(",", tokens);
    }

    private static String translateCrontabWeekday(String value) {
        if (value.length() == 1 && Character.isDigit(value.charAt(0))) {
            int number = value.charAt(0) - '0';
            if (number <= 7) {
                return CRONTAB_WEEKDAYS[number];
            }
        }
        return value.toLowerCase(Locale.ROOT);
    }

    private static List<CronField> compile(String[] given) {
        int lastGiven = -1;
        for (int i = 0; i < given.length; i++) {
            if (given[i] != null) {
                lastGiven = i;
            }
        }

        CronFieldType[] types = CronFieldType.values();
        List<CronField> compiled = new ArrayList<>(types.length);
        for (int i = 0; i < types.length; i++) {
            String expression;
            if (given[i] != null) {
                expression = given[i];
            } else if (i < lastGiven) {
                expression = "*";
            } else {
                expression = types[i].getDefaultExpression();
            }
            compiled.add(CronFieldParser.parse(types[i], expression));
        }
        return List.copyOf(compiled);
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        Instant from;
        if (previousFireTime != null) {
            from = previousFireTime.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        } else {
            from = ceilToSecond(startTime != null ? startTime : now);
        }
        if (startTime != null && from.isBefore(startTime)) {
            from = ceilToSecond(startTime);
        }

        ZoneRules rules = zone.getRules();
        ZoneOffset preferredOffset = rules.getOffset(from);
        LocalDateTime searchFrom = LocalDateTime.ofInstant(from, zone);
        for (int attempt = 0; attempt < MAX_DST_ADJUSTMENTS; attempt++) {
            LocalDateTime match = nextMatch(searchFrom);
            if (match == null) {
                return Optional.empty();
            }

            List<ZoneOffset> offsets = rules.getValidOffsets(match);
            if (offsets.isEmpty()) {
                // 서머타임 공백: 존재하지 않는 벽시계 시각은 건너뜀
                ZoneOffsetTransition gap = rules.getTransition(match);
                searchFrom = gap.getDateTimeAfter();
                continue;
            }

            ZoneOffset offset = offsets.contains(preferredOffset) ? preferredOffset : offsets.get(0);
            Instant candidate = match.toInstant(offset);
            if (candidate.isBefore(from)) {
                searchFrom = match.plusSeconds(1);
                continue;
            }
            if (endTime != null && candidate.isAfter(endTime)) {
                return Optional.empty();
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static Instant ceilToSecond(Instant instant) {
        Instant truncated = instant.truncatedTo(ChronoUnit.SECONDS);
        return truncated.equals(instant) ? instant : truncated.plusSeconds(1);
    }

    /**
     * from 이상인 첫 일치 벽시계 시각.
     *
     * @return 일치 시각 (지원 범위 안에 없으면 null)
     */
    private LocalDateTime nextMatch(LocalDateTime from) {
        LocalDateTime next = from;
        int fieldNum = 0;
        while (fieldNum >= 0 && fieldNum < fields.size()) {
            CronField field = fields.get(fieldNum);
            int currentValue = field.getValue(next);
            OptionalInt nextValue = field.getNextValue(next);

            if (nextValue.isEmpty()) {
                // 이 단위 안에 일치하는 값이 없으면 상위 필드를 올림
                Cursor cursor = incrementFieldValue(next, fieldNum - 1);
                next = cursor.dateTime();
                fieldNum = cursor.fieldNum();
            } else if (nextValue.getAsInt() > currentValue) {
                if (field.getType().isReal()) {
                    next = setFieldValue(next, fieldNum, nextValue.getAsInt());
                    fieldNum++;
                } else {
                    Cursor cursor = incrementFieldValue(next, fieldNum);
                    next = cursor.dateTime();
                    fieldNum = cursor.fieldNum();
                }
            } else {
                fieldNum++;
            }
        }
        return fieldNum >= 0 ? next : null;
    }

    private Cursor incrementFieldValue(LocalDateTime dateTime, int fieldNum) {
        int target = fieldNum;
        while (target >= 0) {
            CronField field = fields.get(target);
            if (field.getType().isReal() && field.getValue(dateTime) < field.getMax(dateTime)) {
                break;
            }
            target--;
        }
        if (target < 0) {
            return new Cursor(null, -1);
        }

        int[] values = new int[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            CronField field = fields.get(i);
            if (i < target) {
                values[i] = field.getValue(dateTime);
            } else if (i == target) {
                values[i] = field.getValue(dateTime) + 1;
            } else {
                values[i] = field.getMin();
            }
        }
        return new Cursor(compose(values), target);
    }

    private LocalDateTime setFieldValue(LocalDateTime dateTime, int fieldNum, int value) {
        int[] values = new int[fields.size()];
        for (int i = 0; i < fields.size(); i++) {
            CronField field = fields.get(i);
            if (i < fieldNum) {
                values[i] = field.getValue(dateTime);
            } else if (i == fieldNum) {
                values[i] = value;
            } else {
                values[i] = field.getMin();
            }
        }
        return compose(values);
    }

    private static LocalDateTime compose(int[] values) {
        return LocalDateTime.of(
            values[CronFieldType.YEAR.ordinal()],
            values[CronFieldType.MONTH.ordinal()],
            values[CronFieldType.DAY.ordinal()],
            values[CronFieldType.HOUR.ordinal()],
            values[CronFieldType.MINUTE.ordinal()],
            values[CronFieldType.SECOND.ordinal()]
        );
    }

    private record Cursor(LocalDateTime dateTime, int fieldNum) {
    }

    public CronTrigger withYear(String year) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withMonth(String month) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withDay(String day) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withWeek(String week) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withDayOfWeek(String dayOfWeek) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withHour(String hour) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withMinute(String minute) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withSecond(String second) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withStartTime(Instant startTime) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public CronTrigger withEndTime(Instant endTime) {
        return new CronTrigger(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    public String getYear() {
        return year;
    }

    public String getMonth() {
        return month;
    }

    public String getDay() {
        return day;
    }

    public String getWeek() {
        return week;
    }

    public String getDayOfWeek() {
        return dayOfWeek;
    }

    public String getHour() {
        return hour;
    }

    public String getMinute() {
        return minute;
    }

    public String getSecond() {
        return second;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public ZoneId getZone() {
        return zone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CronTrigger that = (CronTrigger) o;
        return Objects.equals(year, that.year)
            && Objects.equals(month, that.month)
            && Objects.equals(day, that.day)
            && Objects.equals(week, that.week)
            && Objects.equals(dayOfWeek, that.dayOfWeek)
            && Objects.equals(hour, that.hour)
            && Objects.equals(minute, that.minute)
            && Objects.equals(second, that.second)
            && Objects.equals(startTime, that.startTime)
            && Objects.equals(endTime, that.endTime)
            && zone.equals(that.zone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(year, month, day, week, dayOfWeek, hour, minute, second, startTime, endTime, zone);
    }

    @Override
    public String toString() {
        return "CronTrigger{" + fields + ", zone=" + zone + '}';
    }
}
