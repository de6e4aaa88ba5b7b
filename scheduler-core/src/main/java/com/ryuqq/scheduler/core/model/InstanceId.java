package com.ryuqq.scheduler.core.model;

import java.util.UUID;

/**
 * 스케줄러/워커 프로세스 식별자.
 *
 * <p>Schedule 및 Job 리스(lease)의 소유자를 나타냅니다. 같은 백엔드를 공유하는
 * 프로세스들은 서로 다른 InstanceId를 가져야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InstanceId {

    private final String value;

    private InstanceId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("InstanceId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("InstanceId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    public static InstanceId of(String value) {
        return new InstanceId(value);
    }

    /**
     * 무작위 InstanceId 생성.
     *
     * @return "scheduler-" 접두사가 붙은 UUID 기반 InstanceId
     */
    public static InstanceId generate() {
        return new InstanceId("scheduler-" + UUID.randomUUID());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        InstanceId that = (InstanceId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "InstanceId{" + value + '}';
    }
}
