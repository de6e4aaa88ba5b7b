package com.ryuqq.scheduler.core.model;

/**
 * 밀린 실행 시각이 여러 개일 때의 병합 정책.
 *
 * <p>스케줄러가 중단되었거나 늦게 처리되어 현재 시각 이전의 실행 시각이
 * 여러 개 누적된 경우 몇 개의 Job을 만들지 결정합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum CoalescePolicy {

    /**
     * 가장 최근 실행 시각 하나만 Job으로 생성.
     */
    LATEST,

    /**
     * 가장 이른 실행 시각 하나만 Job으로 생성.
     */
    EARLIEST,

    /**
     * 누적된 모든 실행 시각마다 Job 생성 (상한 적용).
     */
    ALL
}
