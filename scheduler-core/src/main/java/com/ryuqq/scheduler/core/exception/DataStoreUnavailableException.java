package com.ryuqq.scheduler.core.exception;

/**
 * 백엔드 일시 장애 (재시도 가능).
 *
 * <p>DataStore 구현은 연결 끊김, 타임아웃 등 일시적 장애를 이 예외로 감싸야 합니다.
 * 러너는 지수 백오프로 재시도하고, 재시도 한도를 넘기면 루프를 중단합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DataStoreUnavailableException extends SchedulerException {

    public DataStoreUnavailableException(String message) {
        super(message);
    }

    public DataStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
