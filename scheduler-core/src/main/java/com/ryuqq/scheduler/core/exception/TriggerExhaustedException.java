package com.ryuqq.scheduler.core.exception;

/**
 * Trigger가 더 이상 실행 시각을 계산할 수 없음.
 *
 * <p>스케줄러 루프는 이 예외를 받으면 해당 Schedule을 종료된 것으로 처리합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TriggerExhaustedException extends SchedulerException {

    public TriggerExhaustedException(String message) {
        super(message);
    }
}
