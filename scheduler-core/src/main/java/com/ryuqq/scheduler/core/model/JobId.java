package com.ryuqq.scheduler.core.model;

import java.util.UUID;

/**
 * Job 식별자 (UUID).
 *
 * <p>Job은 Task 실행 1회를 나타내며, 스케줄러 루프 또는 사용자 요청에 의해 생성됩니다.
 * JobId는 항상 UUID 문자열 표현이어야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobId {

    private final String value;

    private JobId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("JobId cannot be null or blank");
        }
        try {
            UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("JobId must be a UUID (current: " + value + ")", e);
        }
        this.value = value;
    }

    /**
     * JobId 생성.
     *
     * @param value UUID 문자열
     * @return JobId 인스턴스
     * @throws IllegalArgumentException UUID 형식이 아닌 경우
     */
    public static JobId of(String value) {
        return new JobId(value);
    }

    /**
     * 새 JobId 생성.
     *
     * @return 무작위 UUID 기반 JobId
     */
    public static JobId generate() {
        return new JobId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        JobId jobId = (JobId) o;
        return value.equals(jobId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "JobId{" + value + '}';
    }
}
