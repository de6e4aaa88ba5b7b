package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.ConflictException;
import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.model.CallableRef;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.InstanceId;
import com.ryuqq.scheduler.core.model.Schedule;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.DataStore;
import com.ryuqq.scheduler.core.trigger.DateTrigger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * RetryingDataStore 유닛 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>DataStoreUnavailableException은 백오프 후 재시도</li>
 *   <li>재시도 소진 시 마지막 예외 전파</li>
 *   <li>업무 예외는 재시도하지 않음</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class RetryingDataStoreTest {

    private static final InstanceId SCHEDULER = InstanceId.of("scheduler-a");

    @Mock
    private DataStore delegate;

    private final List<Long> sleeps = new ArrayList<>();
    private RetryingDataStore dataStore;

    @BeforeEach
    void setUp() {
        DataStoreRetryConfig config = new DataStoreRetryConfig(3, 100, 1000, 0.0);
        dataStore = new RetryingDataStore(delegate, config, sleeps::add);
    }

    // ============================================================
    // 1. 일시적 장애 재시도
    // ============================================================

    @Test
    void 일시적_장애는_백오프_후_재시도하여_성공함() {
        // given
        Task task = Task.of(TaskId.of("report"), CallableRef.of("registry:report"));
        when(delegate.getTasks())
            .thenThrow(new DataStoreUnavailableException("connection reset"))
            .thenReturn(List.of(task));

        // when
        List<Task> tasks = dataStore.getTasks();

        // then
        assertThat(tasks).containsExactly(task);
        verify(delegate, times(2)).getTasks();
        assertThat(sleeps).containsExactly(100L);
    }

    @Test
    void 반환값이_없는_연산도_재시도함() {
        // given
        doThrow(new DataStoreUnavailableException("timeout"))
            .doNothing()
            .when(delegate).releaseSchedules(any(), any());

        // when
        dataStore.releaseSchedules(SCHEDULER, List.of());

        // then
        verify(delegate, times(2)).releaseSchedules(SCHEDULER, List.of());
    }

    @Test
    void 재시도를_소진하면_마지막_예외를_전파함() {
        // given
        DataStoreUnavailableException failure = new DataStoreUnavailableException("database down");
        when(delegate.acquireSchedules(any(), any(), anyInt())).thenThrow(failure);

        // when & then
        assertThatThrownBy(() -> dataStore.acquireSchedules(SCHEDULER, Duration.ofSeconds(30), 10))
            .isSameAs(failure);
        verify(delegate, times(3)).acquireSchedules(SCHEDULER, Duration.ofSeconds(30), 10);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    // ============================================================
    // 2. 재시도 대상이 아닌 경우
    // ============================================================

    @Test
    void 업무_예외는_재시도하지_않음() {
        // given
        Schedule schedule = Schedule.of(ScheduleId.of("s1"), TaskId.of("report"),
            new DateTrigger(Instant.parse("2026-01-01T00:00:00Z")), Instant.parse("2026-01-01T00:00:00Z"));
        doThrow(new ConflictException("Schedule already exists: s1"))
            .when(delegate).addSchedule(schedule, ConflictPolicy.EXCEPTION);

        // when & then
        assertThatThrownBy(() -> dataStore.addSchedule(schedule, ConflictPolicy.EXCEPTION))
            .isInstanceOf(ConflictException.class);
        verify(delegate, times(1)).addSchedule(schedule, ConflictPolicy.EXCEPTION);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void noRetry_설정은_한_번만_시도함() {
        // given
        dataStore = new RetryingDataStore(delegate, DataStoreRetryConfig.noRetry(), sleeps::add);
        doThrow(new DataStoreUnavailableException("down")).when(delegate).cleanup();

        // when & then
        assertThatThrownBy(() -> dataStore.cleanup()).isInstanceOf(DataStoreUnavailableException.class);
        verify(delegate, times(1)).cleanup();
    }

    @Test
    void 대기_중_인터럽트되면_재시도를_멈추고_플래그를_복원함() {
        // given
        dataStore = new RetryingDataStore(delegate, new DataStoreRetryConfig(), millis -> {
            throw new InterruptedException("stop");
        });
        when(delegate.getNextScheduleRunTime()).thenThrow(new DataStoreUnavailableException("down"));

        try {
            // when & then
            assertThatThrownBy(() -> dataStore.getNextScheduleRunTime())
                .isInstanceOf(DataStoreUnavailableException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            verify(delegate, times(1)).getNextScheduleRunTime();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void 생성자_의존성_검증() {
        assertThatThrownBy(() -> new RetryingDataStore(null, new DataStoreRetryConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("delegate");
        assertThatThrownBy(() -> new RetryingDataStore(delegate, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }
}
