package com.ryuqq.scheduler.core.executor;

import java.util.concurrent.CompletableFuture;

/**
 * Job 실행 기반 SPI (스레드 풀, 프로세스 풀 등).
 *
 * <p>Task는 {@link com.ryuqq.scheduler.core.model.Task#executor()} 이름으로 실행기를 선택합니다.</p>
 *
 * <p><strong>결과 규약:</strong></p>
 * <ul>
 *   <li>정상 완료: 함수의 반환값으로 완료</li>
 *   <li>함수 예외: 해당 예외로 예외 완료</li>
 *   <li>실행 시간 초과: {@link com.ryuqq.scheduler.core.exception.JobTimeoutException}으로 예외 완료,
 *       실행 단위에는 인터럽트 신호만 보냄</li>
 *   <li>반환된 future를 취소하면 실행 단위에 인터럽트를 전달 (협조적 취소)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobExecutor {

    /**
     * 실행기 이름.
     *
     * @return Task가 참조하는 이름
     */
    String name();

    void start();

    /**
     * 실행기 중지.
     *
     * @param graceful true이면 실행 중인 함수가 끝나기를 기다림
     */
    void shutdown(boolean graceful);

    /**
     * 함수 실행 제출.
     *
     * @param context 실행 문맥
     * @param function 실행할 함수
     * @return 실행 결과 future
     */
    CompletableFuture<Object> execute(JobContext context, TaskFunction function);
}
