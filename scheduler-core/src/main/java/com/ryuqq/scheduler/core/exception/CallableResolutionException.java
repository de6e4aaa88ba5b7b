package com.ryuqq.scheduler.core.exception;

/**
 * 함수 참조를 실행 가능한 함수로 해석할 수 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CallableResolutionException extends SchedulerException {

    public CallableResolutionException(String message) {
        super(message);
    }

    public CallableResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
