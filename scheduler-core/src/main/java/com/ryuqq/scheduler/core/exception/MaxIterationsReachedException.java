package com.ryuqq.scheduler.core.exception;

/**
 * 결합 Trigger가 반복 상한 안에 공통 실행 시각을 찾지 못함.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class MaxIterationsReachedException extends TriggerExhaustedException {

    private final int maxIterations;

    public MaxIterationsReachedException(int maxIterations) {
        super("No common fire time found within " + maxIterations + " iterations");
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
