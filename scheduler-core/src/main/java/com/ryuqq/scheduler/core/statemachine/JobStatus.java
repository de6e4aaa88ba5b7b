package com.ryuqq.scheduler.core.statemachine;

/**
 * Job의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING → RUNNING (워커가 획득)</li>
 *   <li>PENDING → MISSED (시작 마감 시각 경과)</li>
 *   <li>PENDING → CANCELLED (실행 전 취소)</li>
 *   <li>RUNNING → SUCCESS / FAILURE / CANCELLED</li>
 *   <li>RUNNING → MISSED (획득했지만 시작 마감 시각을 이미 넘긴 경우)</li>
 *   <li><strong>종료 상태에서의 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING ──► MISSED
 *    │   └──► CANCELLED
 *    ▼ (획득)
 * RUNNING
 *    ├─► SUCCESS
 *    ├─► FAILURE
 *    ├─► CANCELLED
 *    └─► MISSED
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum JobStatus {

    /**
     * 실행 대기 중.
     */
    PENDING,

    /**
     * 워커가 획득하여 실행 중.
     */
    RUNNING,

    /**
     * 정상 완료.
     */
    SUCCESS,

    /**
     * 실행 실패 (예외, 타임아웃, 워커 유실 포함).
     */
    FAILURE,

    /**
     * 유예 시간(misfire grace time) 안에 시작하지 못함.
     */
    MISSED,

    /**
     * 협조적 취소.
     */
    CANCELLED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCESS, FAILURE, MISSED, CANCELLED인 경우 true
     */
    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
