package com.ryuqq.scheduler.core.exception;

/**
 * Job 실행 또는 결과 대기가 제한 시간을 넘김.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobTimeoutException extends SchedulerException {

    public JobTimeoutException(String message) {
        super(message);
    }
}
