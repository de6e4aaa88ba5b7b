package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.JobTimeoutException;
import com.ryuqq.scheduler.core.executor.JobContext;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.TaskId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ThreadPoolJobExecutor 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ThreadPoolJobExecutorTest {

    private ThreadPoolJobExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown(false);
        }
    }

    private static JobContext context() {
        return new JobContext(JobId.generate(), TaskId.of("report"), null, null, JobArguments.of("monthly"));
    }

    @Test
    void 함수의_반환값으로_완료됨() throws Exception {
        // given
        executor = new ThreadPoolJobExecutor(2, null);
        executor.start();

        // when
        CompletableFuture<Object> future = executor.execute(context(),
            ctx -> "report-" + ctx.arguments().positionalAt(0));

        // then
        assertThat(future.get(2, TimeUnit.SECONDS)).isEqualTo("report-monthly");
        assertThat(executor.name()).isEqualTo("threadpool");
    }

    @Test
    void 함수가_던진_예외로_예외_완료됨() {
        // given
        executor = new ThreadPoolJobExecutor(2, null);
        executor.start();

        // when
        CompletableFuture<Object> future = executor.execute(context(), ctx -> {
            throw new IllegalArgumentException("bad input");
        });

        // then
        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void 제한_시간을_넘기면_JobTimeoutException으로_완료되고_실행_스레드를_인터럽트함() throws Exception {
        // given
        executor = new ThreadPoolJobExecutor(1, Duration.ofMillis(100));
        executor.start();
        CountDownLatch interrupted = new CountDownLatch(1);

        // when
        CompletableFuture<Object> future = executor.execute(context(), ctx -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        });

        // then
        assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(JobTimeoutException.class);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void future를_취소하면_실행_스레드를_인터럽트함() throws Exception {
        // given
        executor = new ThreadPoolJobExecutor(1, null);
        executor.start();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        CompletableFuture<Object> future = executor.execute(context(), ctx -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return null;
        });
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();

        // when
        future.cancel(true);

        // then
        assertThat(future.isCancelled()).isTrue();
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void 시작_전이나_종료_후에는_실행을_거부함() {
        // given
        executor = new ThreadPoolJobExecutor(1, null);

        // when & then
        assertThatThrownBy(() -> executor.execute(context(), ctx -> null))
            .isInstanceOf(IllegalStateException.class);

        executor.start();
        executor.shutdown(true);
        assertThatThrownBy(() -> executor.execute(context(), ctx -> null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 두_번_시작하면_예외() {
        // given
        executor = new ThreadPoolJobExecutor(1, null);
        executor.start();

        // when & then
        assertThatThrownBy(() -> executor.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void 잘못된_설정은_거부함() {
        assertThatThrownBy(() -> new ThreadPoolJobExecutor(" ", 1, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThreadPoolJobExecutor(0, null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ThreadPoolJobExecutor(1, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
