package com.ryuqq.scheduler.core.model;

/**
 * 같은 ID의 Schedule이 이미 존재할 때의 처리 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum ConflictPolicy {

    /**
     * {@link com.ryuqq.scheduler.core.exception.ConflictException} 발생.
     */
    EXCEPTION,

    /**
     * 기존 Schedule을 교체 (멱등 upsert).
     */
    REPLACE,

    /**
     * 기존 Schedule을 유지하고 아무 것도 하지 않음.
     */
    DO_NOTHING
}
