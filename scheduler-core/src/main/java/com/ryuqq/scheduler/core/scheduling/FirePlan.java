package com.ryuqq.scheduler.core.scheduling;

import java.time.Instant;
import java.util.List;

/**
 * Schedule 하나를 처리한 계산 결과.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param occurrences 생성할 Job 목록 (병합 정책 적용 후)
 * @param nextFireTime 현재 시각 이후의 다음 실행 시각 (null이면 종료)
 * @param lastFireTime 이번에 처리한 마지막 실행 시각
 * @param truncated 따라잡기 상한을 넘어 오래된 실행 시각을 버렸으면 true
 */
public record FirePlan(List<FireOccurrence> occurrences, Instant nextFireTime, Instant lastFireTime, boolean truncated) {

    public FirePlan {
        occurrences = occurrences == null ? List.of() : List.copyOf(occurrences);
    }

    public boolean finished() {
        return nextFireTime == null;
    }
}
