package com.ryuqq.scheduler.core.exception;

/**
 * 스케줄러 예외 계층의 최상위 타입.
 *
 * <p>모든 스케줄러 예외는 unchecked 예외입니다. 인자 검증 실패는
 * {@link IllegalArgumentException}, 잘못된 상태 전이는 {@link IllegalStateException}을
 * 그대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message) {
        super(message);
    }

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
