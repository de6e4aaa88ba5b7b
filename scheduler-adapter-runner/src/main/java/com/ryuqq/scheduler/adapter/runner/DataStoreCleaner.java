package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.application.runtime.Runtime;
import com.ryuqq.scheduler.core.spi.DataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DataStore 정리 Runtime.
 *
 * <p>만료된 Job 결과를 지우고, 워커가 사라져 리스가 끊긴 RUNNING Job을 FAILURE로 회수합니다.
 * 여러 인스턴스가 동시에 실행해도 안전합니다.</p>
 *
 * <p>정리 실패는 스케줄러를 멈추지 않습니다. 로그만 남기고 다음 주기에 다시 시도합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DataStoreCleaner implements Runtime {

    private static final Logger log = LoggerFactory.getLogger(DataStoreCleaner.class);

    private final DataStore dataStore;

    public DataStoreCleaner(DataStore dataStore) {
        if (dataStore == null) {
            throw new IllegalArgumentException("dataStore cannot be null");
        }
        this.dataStore = dataStore;
    }

    @Override
    public void pump() {
        log.debug("DataStore cleanup started");
        try {
            dataStore.cleanup();
            log.debug("DataStore cleanup completed");
        } catch (Exception e) {
            log.error("Failed to clean up DataStore", e);
        }
    }
}
