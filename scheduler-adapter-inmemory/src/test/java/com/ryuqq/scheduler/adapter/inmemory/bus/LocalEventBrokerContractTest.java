package com.ryuqq.scheduler.adapter.inmemory.bus;

import com.ryuqq.scheduler.core.event.TaskAdded;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.Subscription;
import com.ryuqq.scheduler.testkit.contract.AbstractEventBrokerContractTest;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Tests for {@link LocalEventBroker}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class LocalEventBrokerContractTest extends AbstractEventBrokerContractTest {

    @Override
    protected EventBroker createEventBroker() {
        return new LocalEventBroker();
    }

    @Test
    void publish_AfterStop_Dropped() {
        // Given
        AtomicInteger received = new AtomicInteger();
        eventBroker.subscribe(event -> received.incrementAndGet(), Set.of());
        eventBroker.stop();

        // When
        eventBroker.publish(new TaskAdded(NOW, TaskId.of("late")));

        // Then
        assertEquals(0, received.get());
        assertFalse(((LocalEventBroker) eventBroker).isRunning());
    }

    @Test
    void start_Twice_ThrowsException() {
        assertThrows(IllegalStateException.class, () -> eventBroker.start());
    }

    @Test
    void stop_KeepsRegistrations_UnsubscribeRemovesThem() {
        // Given
        LocalEventBroker broker = (LocalEventBroker) eventBroker;
        Subscription subscription = broker.subscribe(event -> { }, Set.of());

        // When
        broker.stop();

        // Then
        assertEquals(1, broker.subscriberCount());
        subscription.unsubscribe();
        assertEquals(0, broker.subscriberCount());
    }
}
