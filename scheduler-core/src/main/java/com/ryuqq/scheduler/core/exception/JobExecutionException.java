package com.ryuqq.scheduler.core.exception;

import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.JobResult;

/**
 * 동기 실행 요청한 Job이 성공하지 못함.
 *
 * <p>원래 예외는 다른 프로세스에서 발생했을 수 있으므로 {@link JobResult}에 담긴
 * 오류 설명으로만 전달됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class JobExecutionException extends SchedulerException {

    private final JobResult result;

    public JobExecutionException(JobResult result) {
        super(describe(result));
        this.result = result;
    }

    private static String describe(JobResult result) {
        String message = "Job " + result.jobId().getValue() + " finished with status " + result.status();
        if (result.error() != null) {
            message += ": " + result.error().exceptionType() + " - " + result.error().message();
        }
        return message;
    }

    public JobId getJobId() {
        return result.jobId();
    }

    public JobResult getResult() {
        return result;
    }
}
