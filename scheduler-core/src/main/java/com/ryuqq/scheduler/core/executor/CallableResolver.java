package com.ryuqq.scheduler.core.executor;

import com.ryuqq.scheduler.core.model.CallableRef;

/**
 * 함수 참조 해석 SPI.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface CallableResolver {

    /**
     * 함수 참조를 실행 가능한 함수로 해석.
     *
     * @param ref 함수 참조
     * @return 실행 가능한 함수
     * @throws com.ryuqq.scheduler.core.exception.CallableResolutionException 해석할 수 없는 경우
     */
    TaskFunction resolve(CallableRef ref);
}
