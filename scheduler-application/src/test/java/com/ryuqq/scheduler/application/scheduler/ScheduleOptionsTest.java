package com.ryuqq.scheduler.application.scheduler;

import com.ryuqq.scheduler.core.model.CoalescePolicy;
import com.ryuqq.scheduler.core.model.ConflictPolicy;
import com.ryuqq.scheduler.core.model.JobArguments;
import com.ryuqq.scheduler.core.model.ScheduleId;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScheduleOptions 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ScheduleOptionsTest {

    @Test
    void 기본값이_적용됨() {
        // when
        ScheduleOptions options = new ScheduleOptions();

        // then
        assertThat(options.id()).isNull();
        assertThat(options.args()).isEqualTo(JobArguments.none());
        assertThat(options.coalesce()).isEqualTo(CoalescePolicy.LATEST);
        assertThat(options.misfireGraceTime()).isNull();
        assertThat(options.paused()).isFalse();
        assertThat(options.jobResultExpirationTime()).isEqualTo(Duration.ZERO);
        assertThat(options.conflictPolicy()).isEqualTo(ConflictPolicy.EXCEPTION);
    }

    @Test
    void withX는_해당_필드만_변경함() {
        // given
        ScheduleOptions base = new ScheduleOptions();

        // when
        ScheduleOptions changed = base
            .withId(ScheduleId.of("nightly"))
            .withCoalesce(CoalescePolicy.ALL)
            .withConflictPolicy(ConflictPolicy.REPLACE)
            .withPaused(true);

        // then
        assertThat(changed.id()).isEqualTo(ScheduleId.of("nightly"));
        assertThat(changed.coalesce()).isEqualTo(CoalescePolicy.ALL);
        assertThat(changed.conflictPolicy()).isEqualTo(ConflictPolicy.REPLACE);
        assertThat(changed.paused()).isTrue();
        assertThat(base.id()).isNull();
    }

    @Test
    void null_args는_빈_인자로_대체됨() {
        ScheduleOptions options = new ScheduleOptions().withArgs(null);

        assertThat(options.args()).isEqualTo(JobArguments.none());
    }

    @Test
    void 음수_misfireGraceTime은_거부됨() {
        assertThatThrownBy(() -> new ScheduleOptions().withMisfireGraceTime(Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("misfireGraceTime");
    }

    @Test
    void 음수_결과_보관_기간은_거부됨() {
        assertThatThrownBy(() -> new ScheduleOptions().withJobResultExpirationTime(Duration.ofMinutes(-1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jobResultExpirationTime");
    }

    @Test
    void null_정책은_거부됨() {
        assertThatThrownBy(() -> new ScheduleOptions().withCoalesce(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScheduleOptions().withConflictPolicy(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
