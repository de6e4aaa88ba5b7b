package com.ryuqq.scheduler.application.runtime;

/**
 * 스케줄러 백그라운드 루프의 한 사이클.
 *
 * <p>스케줄 처리 루프, 워커 디스패치 루프, 정리(cleanup) 루프가 모두 이 인터페이스를
 * 구현합니다. 루프 스레드는 {@link #pump()}를 반복 호출하고, 사이클 사이의 대기와
 * 이벤트 기반 깨우기는 호출자({@code DefaultScheduler})가 담당합니다.</p>
 *
 * <p><strong>사이클 흐름 (스케줄 처리 예시):</strong></p>
 * <pre>
 * pump()
 *   1. DataStore에서 도래한 Schedule 획득 (리스 부여)
 *   2. 각 Schedule마다:
 *      a. Trigger로 now 이전의 실행 시각 수집
 *      b. coalesce 적용, misfire 판정
 *      c. Job 추가 (PENDING 또는 MISSED)
 *   3. nextFireTime/lastFireTime과 함께 리스 반납
 * </pre>
 *
 * <p><strong>예외 처리:</strong></p>
 * <ul>
 *   <li>개별 Schedule/Job 오류는 내부에서 로깅 후 격리</li>
 *   <li>던져진 예외는 인프라 장애(DataStore 불가 등)를 뜻하며 호출자가 스케줄러를 중지</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * while (running) {
 *     runtime.pump();
 *     waitForWakeUp(pollInterval);
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * 한 사이클 실행.
     *
     * <p>한 배치를 처리하면 반환합니다 (대상이 없으면 즉시 반환).
     * 연속 호출은 호출자 책임입니다.</p>
     *
     * @throws RuntimeException 인프라 장애로 사이클을 진행할 수 없는 경우
     */
    void pump();
}
