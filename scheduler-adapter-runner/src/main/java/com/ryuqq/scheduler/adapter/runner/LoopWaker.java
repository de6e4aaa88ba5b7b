package com.ryuqq.scheduler.adapter.runner;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 루프 스레드 대기/깨우기.
 *
 * <p>대기 전에 온 wake()도 잃어버리지 않도록 플래그를 함께 둡니다.</p>
 */
final class LoopWaker {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition signal = lock.newCondition();
    private boolean woken;

    void wake() {
        lock.lock();
        try {
            woken = true;
            signal.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * wake() 호출 또는 시간 경과까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return wake()로 깨어났으면 true
     * @throws InterruptedException 대기 중 인터럽트
     */
    boolean await(Duration timeout) throws InterruptedException {
        lock.lock();
        try {
            long nanos = timeout.toNanos();
            while (!woken && nanos > 0) {
                nanos = signal.awaitNanos(nanos);
            }
            boolean result = woken;
            woken = false;
            return result;
        } finally {
            lock.unlock();
        }
    }

    boolean await(long timeoutMs) throws InterruptedException {
        return await(Duration.ofMillis(timeoutMs));
    }
}
