package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.JobTimeoutException;
import com.ryuqq.scheduler.core.executor.JobContext;
import com.ryuqq.scheduler.core.executor.JobExecutor;
import com.ryuqq.scheduler.core.executor.TaskFunction;
import com.ryuqq.scheduler.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 고정 크기 스레드 풀 기반 JobExecutor.
 *
 * <p><strong>취소와 타임아웃:</strong></p>
 * <ul>
 *   <li>반환한 future를 취소하면 실행 스레드를 인터럽트</li>
 *   <li>제한 시간이 지나면 future를 {@link JobTimeoutException}으로 완료하고 실행 스레드를 인터럽트</li>
 *   <li>인터럽트를 무시하는 함수는 끝까지 실행되지만 결과는 버려짐</li>
 * </ul>
 *
 * <p>종료는 QueueWorkerRunner와 같이 graceful이면 최대 60초 대기 후 강제 종료합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ThreadPoolJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(ThreadPoolJobExecutor.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 60;

    private final String name;
    private final int poolSize;
    private final Duration timeout;

    private volatile ExecutorService workers;
    private volatile ScheduledExecutorService timer;

    /**
     * 기본 이름("threadpool")으로 생성.
     *
     * @param poolSize 스레드 수
     * @param timeout 실행 제한 시간 (null이면 제한 없음)
     */
    public ThreadPoolJobExecutor(int poolSize, Duration timeout) {
        this(Task.DEFAULT_EXECUTOR, poolSize, timeout);
    }

    public ThreadPoolJobExecutor(String name, int poolSize, Duration timeout) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive (current: " + poolSize + ")");
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        this.name = name;
        this.poolSize = poolSize;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public synchronized void start() {
        if (workers != null) {
            throw new IllegalStateException("Executor " + name + " is already started");
        }
        workers = Executors.newFixedThreadPool(poolSize, namedThreads("scheduler-" + name + "-"));
        timer = Executors.newSingleThreadScheduledExecutor(namedThreads("scheduler-" + name + "-timeout-"));
    }

    @Override
    public synchronized void shutdown(boolean graceful) {
        ExecutorService pool = workers;
        if (pool == null) {
            return;
        }
        workers = null;
        timer.shutdownNow();

        if (!graceful) {
            pool.shutdownNow();
            return;
        }
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Executor {} did not terminate within {}s, interrupting running jobs",
                    name, SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public CompletableFuture<Object> execute(JobContext context, TaskFunction function) {
        ExecutorService pool = workers;
        ScheduledExecutorService timeoutTimer = timer;
        if (pool == null) {
            throw new IllegalStateException("Executor " + name + " is not running");
        }

        CompletableFuture<Object> result = new CompletableFuture<>();
        Future<?> running = pool.submit(() -> {
            try {
                result.complete(function.call(context));
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                running.cancel(true);
            }
        });

        if (timeout != null) {
            ScheduledFuture<?> timeoutTask = timeoutTimer.schedule(() -> {
                if (result.completeExceptionally(new JobTimeoutException(
                    "Job " + context.jobId().getValue() + " exceeded timeout of " + timeout))) {
                    running.cancel(true);
                }
            }, timeout.toMillis(), TimeUnit.MILLISECONDS);
            result.whenComplete((value, error) -> timeoutTask.cancel(false));
        }
        return result;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
