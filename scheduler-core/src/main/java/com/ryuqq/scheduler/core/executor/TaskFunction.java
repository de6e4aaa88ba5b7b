package com.ryuqq.scheduler.core.executor;

/**
 * Task가 실행하는 함수.
 *
 * <p>반환값은 Serializer로 인코딩되어 Job 결과에 저장됩니다.
 * 던진 예외는 Job의 FAILURE 결과로 기록됩니다. 자동 재시도는 없습니다.</p>
 *
 * <p>장시간 실행되는 함수는 스레드 인터럽트를 확인하여 취소와 타임아웃에 협조해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TaskFunction {

    /**
     * 함수 실행.
     *
     * @param context 실행 문맥
     * @return 반환값 (null 가능)
     * @throws Exception 실행 실패 시
     */
    Object call(JobContext context) throws Exception;
}
