package com.ryuqq.scheduler.core.exception;

/**
 * 같은 ID의 엔티티가 이미 존재하여 추가할 수 없음.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @see com.ryuqq.scheduler.core.model.ConflictPolicy#EXCEPTION
 */
public class ConflictException extends SchedulerException {

    public ConflictException(String message) {
        super(message);
    }
}
