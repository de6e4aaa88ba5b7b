package com.ryuqq.scheduler.core.model;

import java.util.UUID;

/**
 * Schedule 식별자.
 *
 * <p>사용자가 직접 지정하거나 {@link #generate()}로 UUID 기반 값을 생성합니다.
 * 같은 ID로 다시 등록하면 {@link ConflictPolicy}에 따라 처리됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScheduleId {

    private final String value;

    private ScheduleId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ScheduleId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ScheduleId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * ScheduleId 생성.
     *
     * @param value ScheduleId 값
     * @return ScheduleId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ScheduleId of(String value) {
        return new ScheduleId(value);
    }

    /**
     * 무작위 ScheduleId 생성.
     *
     * @return UUID 기반 ScheduleId
     */
    public static ScheduleId generate() {
        return new ScheduleId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduleId that = (ScheduleId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ScheduleId{" + value + '}';
    }
}
