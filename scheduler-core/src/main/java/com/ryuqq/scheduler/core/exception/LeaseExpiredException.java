package com.ryuqq.scheduler.core.exception;

import java.util.List;

/**
 * 리스를 더 이상 소유하지 않아 쓰기가 적용되지 않음.
 *
 * <p>리스가 만료되어 다른 인스턴스가 가져간 Schedule/Job에 대한 반납 또는
 * 연장 요청 시 발생합니다. 나머지 요청은 이미 적용된 상태이며,
 * {@link #getLostIds()}는 적용되지 않은 항목의 식별자 값을 담습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LeaseExpiredException extends SchedulerException {

    private final List<String> lostIds;

    public LeaseExpiredException(String message, List<String> lostIds) {
        super(message + " " + lostIds);
        this.lostIds = List.copyOf(lostIds);
    }

    /**
     * 리스를 잃은 항목의 식별자 값.
     *
     * @return 식별자 문자열 목록 (불변)
     */
    public List<String> getLostIds() {
        return lostIds;
    }
}
