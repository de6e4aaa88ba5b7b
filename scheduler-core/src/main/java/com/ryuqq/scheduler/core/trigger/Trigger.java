package com.ryuqq.scheduler.core.trigger;

import java.time.Instant;
import java.util.Optional;

/**
 * 실행 시각 규칙.
 *
 * <p>Trigger는 순수 함수입니다. 내부 상태를 갖지 않으며, 같은 입력에 대해
 * 항상 같은 결과를 반환합니다. 따라서 같은 Trigger를 여러 스케줄러 프로세스가
 * 동시에 평가해도 안전합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>previousFireTime이 null이면 첫 실행 시각을 반환</li>
 *   <li>그렇지 않으면 previousFireTime보다 엄격하게 뒤인 첫 실행 시각을 반환 (단조 증가)</li>
 *   <li>더 이상 실행 시각이 없으면 {@link Optional#empty()}</li>
 *   <li>now는 기준점이 없는 Trigger의 첫 실행 시각 계산에만 사용</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 변형을 컴파일 타임에 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Trigger
    permits DateTrigger, IntervalTrigger, CalendarIntervalTrigger, CronTrigger, AndTrigger, OrTrigger {

    /**
     * 다음 실행 시각 계산.
     *
     * @param previousFireTime 직전 실행 시각 (첫 호출이면 null)
     * @param now 현재 시각 (null 불가)
     * @return 다음 실행 시각 (없으면 empty)
     * @throws com.ryuqq.scheduler.core.exception.TriggerExhaustedException 계산을 포기한 경우
     */
    Optional<Instant> next(Instant previousFireTime, Instant now);
}
