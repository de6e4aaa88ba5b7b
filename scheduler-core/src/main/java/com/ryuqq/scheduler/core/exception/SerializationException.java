package com.ryuqq.scheduler.core.exception;

/**
 * 값을 인코딩하거나 디코딩할 수 없음.
 *
 * <p>Schedule/Job 추가 시 발생하면 호출자에게 그대로 전달되고,
 * 워커에서 발생하면 해당 Job만 FAILURE로 종료됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SerializationException extends SchedulerException {

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
