package com.ryuqq.scheduler.core.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * 실패한 Job의 오류 설명.
 *
 * <p>예외 객체 자체는 프로세스 경계를 넘을 수 없으므로
 * 예외 타입, 메시지, 스택 트레이스 텍스트만 보존합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param exceptionType 예외 클래스 이름
 * @param message 예외 메시지 (null 가능)
 * @param stackTrace 스택 트레이스 텍스트 (null 가능)
 */
public record JobError(String exceptionType, String message, String stackTrace) {

    public JobError {
        if (exceptionType == null || exceptionType.isBlank()) {
            throw new IllegalArgumentException("exceptionType cannot be null or blank");
        }
    }

    /**
     * 예외로부터 생성.
     *
     * @param throwable 원인 예외
     * @return JobError 인스턴스
     */
    public static JobError from(Throwable throwable) {
        if (throwable == null) {
            throw new IllegalArgumentException("throwable cannot be null");
        }
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return new JobError(throwable.getClass().getName(), throwable.getMessage(), writer.toString());
    }

    /**
     * 스택 트레이스 없이 생성.
     *
     * @param exceptionType 오류 유형
     * @param message 메시지
     * @return JobError 인스턴스
     */
    public static JobError of(String exceptionType, String message) {
        return new JobError(exceptionType, message, null);
    }
}
