package com.ryuqq.scheduler.adapter.runner;

import com.ryuqq.scheduler.core.exception.DataStoreUnavailableException;
import com.ryuqq.scheduler.core.spi.DataStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

/**
 * DataStoreCleaner 유닛 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class DataStoreCleanerTest {

    @Mock
    private DataStore dataStore;

    @Test
    void pump_DataStore_정리를_요청함() {
        // given
        DataStoreCleaner cleaner = new DataStoreCleaner(dataStore);

        // when
        cleaner.pump();

        // then
        verify(dataStore).cleanup();
    }

    @Test
    void pump_정리_실패는_전파하지_않음() {
        // given
        DataStoreCleaner cleaner = new DataStoreCleaner(dataStore);
        doThrow(new DataStoreUnavailableException("database down")).when(dataStore).cleanup();

        // when & then
        assertThatCode(cleaner::pump).doesNotThrowAnyException();
        verify(dataStore).cleanup();
    }

    @Test
    void 생성자_null_검증() {
        assertThatThrownBy(() -> new DataStoreCleaner(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("dataStore");
    }
}
