package com.ryuqq.scheduler.core.trigger;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * 달력 단위 간격 실행 (매일, 매주, 매월 등).
 *
 * <p>실행 날짜는 {@code startDate + k * (years, months, weeks, days)}이며,
 * 실행 시각은 해당 날짜의 {@code timeOfDay}(지정한 시간대 기준)입니다.</p>
 *
 * <p><strong>달력 규칙:</strong></p>
 * <ul>
 *   <li>존재하지 않는 날짜는 건너뜀 (예: 1월 31일 + 1개월 = 2월 31일 → 건너뛰고 3월 31일)</li>
 *   <li>서머타임 공백에 걸린 시각은 공백 길이만큼 뒤로 이동</li>
 *   <li>서머타임 중복 구간에서는 이른 오프셋 사용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param years 연 단위 간격
 * @param months 월 단위 간격
 * @param weeks 주 단위 간격
 * @param days 일 단위 간격
 * @param timeOfDay 실행 시각 (시:분:초)
 * @param startDate 첫 실행 날짜
 * @param endDate 마지막 허용 날짜 (null이면 무제한)
 * @param zone 시간대
 */
public record CalendarIntervalTrigger(
    int years,
    int months,
    int weeks,
    int days,
    LocalTime timeOfDay,
    LocalDate startDate,
    LocalDate endDate,
    ZoneId zone
) implements Trigger {

    private static final int MAX_SKIPPED_STEPS = 10_000;

    public CalendarIntervalTrigger {
        if (years < 0 || months < 0 || weeks < 0 || days < 0) {
            throw new IllegalArgumentException("Interval components cannot be negative");
        }
        if (years + months + weeks + days == 0) {
            throw new IllegalArgumentException("At least one interval component must be positive");
        }
        if (timeOfDay == null) {
            timeOfDay = LocalTime.MIDNIGHT;
        }
        if (timeOfDay.getNano() != 0) {
            throw new IllegalArgumentException("timeOfDay cannot have fractional seconds (current: " + timeOfDay + ")");
        }
        if (startDate == null) {
            throw new IllegalArgumentException("startDate cannot be null");
        }
        if (endDate != null && endDate.isBefore(startDate)) {
            throw new IllegalArgumentException(
                "endDate cannot be before startDate (start: " + startDate + ", end: " + endDate + ")"
            );
        }
        if (zone == null) {
            throw new IllegalArgumentException("zone cannot be null");
        }
    }

    /**
     * 매일 지정 시각에 실행.
     *
     * @param timeOfDay 실행 시각
     * @param startDate 첫 실행 날짜
     * @param zone 시간대
     * @return CalendarIntervalTrigger 인스턴스
     */
    public static CalendarIntervalTrigger daily(LocalTime timeOfDay, LocalDate startDate, ZoneId zone) {
        return new CalendarIntervalTrigger(0, 0, 0, 1, timeOfDay, startDate, null, zone);
    }

    @Override
    public Optional<Instant> next(Instant previousFireTime, Instant now) {
        long step = previousFireTime == null ? 0 : estimateStep(previousFireTime);
        if (previousFireTime != null) {
            // 추정치가 지나쳤을 수 있으므로 직전 시각 이하가 될 때까지 되돌림
            while (step > 0) {
                Optional<ZonedDateTime> occurrence = occurrence(step);
                if (occurrence.isPresent() && !occurrence.get().toInstant().isAfter(previousFireTime)) {
                    break;
                }
                step--;
            }
        }

        for (int skipped = 0; skipped < MAX_SKIPPED_STEPS; step++) {
            Optional<LocalDate> date = dateAt(step);
            if (date.isEmpty()) {
                skipped++;
                continue;
            }
            if (endDate != null && date.get().isAfter(endDate)) {
                return Optional.empty();
            }
            Instant candidate = ZonedDateTime.of(date.get(), timeOfDay, zone).toInstant();
            if (previousFireTime == null || candidate.isAfter(previousFireTime)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private Optional<ZonedDateTime> occurrence(long step) {
        return dateAt(step).map(date -> ZonedDateTime.of(date, timeOfDay, zone));
    }

    /**
     * k번째 실행 날짜. 연/월 이동 결과가 존재하지 않는 날짜이면 empty.
     */
    private Optional<LocalDate> dateAt(long step) {
        long totalMonths = (years * 12L + months) * step;
        YearMonth target = YearMonth.from(startDate).plusMonths(totalMonths);
        if (startDate.getDayOfMonth() > target.lengthOfMonth()) {
            return Optional.empty();
        }
        LocalDate date = target.atDay(startDate.getDayOfMonth());
        return Optional.of(date.plusDays((weeks * 7L + days) * step));
    }

    private long estimateStep(Instant previousFireTime) {
        LocalDate previousDate = previousFireTime.atZone(zone).toLocalDate();
        long elapsedDays = ChronoUnit.DAYS.between(startDate, previousDate);
        if (elapsedDays <= 0) {
            return 0;
        }
        double daysPerStep = years * 365.2425 + months * 30.436875 + weeks * 7 + days;
        return Math.max(0, (long) (elapsedDays / daysPerStep) - 2);
    }
}
