package com.ryuqq.scheduler.adapter.inmemory.bus;

import com.ryuqq.scheduler.adapter.serialization.CborSerializer;
import com.ryuqq.scheduler.adapter.serialization.JsonSerializer;
import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.adapter.inmemory.store.InMemoryDataStore;
import com.ryuqq.scheduler.core.event.JobReleased;
import com.ryuqq.scheduler.core.model.CallableRef;
import com.ryuqq.scheduler.core.model.JobId;
import com.ryuqq.scheduler.core.model.ScheduleId;
import com.ryuqq.scheduler.core.model.Task;
import com.ryuqq.scheduler.core.model.TaskId;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.EventTransport;
import com.ryuqq.scheduler.core.spi.Subscription;
import com.ryuqq.scheduler.core.statemachine.JobStatus;
import com.ryuqq.scheduler.testkit.contract.AbstractEventBrokerContractTest;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Tests for {@link TransportEventBroker} over {@link InMemoryEventTransport}.
 *
 * <p>Additional tests cover cross-broker delivery, which stands in for delivery
 * between scheduler processes sharing one transport.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class TransportEventBrokerContractTest extends AbstractEventBrokerContractTest {

    private final InMemoryEventTransport transport = new InMemoryEventTransport();

    @Override
    protected EventBroker createEventBroker() {
        return new TransportEventBroker(transport, new CborSerializer());
    }

    @Test
    void publish_DeliveredToOtherBrokerOnSameTransport() throws InterruptedException {
        // Given
        TransportEventBroker other = new TransportEventBroker(transport, new CborSerializer());
        other.start();
        BlockingQueue<Event> receivedByOther = new LinkedBlockingQueue<>();
        other.subscribe(receivedByOther::add, Set.of());

        JobReleased event = new JobReleased(NOW, JobId.generate(), TaskId.of("report"),
                ScheduleId.of("daily"), JobStatus.SUCCESS, NOW);

        try {
            // When
            eventBroker.publish(event);

            // Then
            assertEquals(event, receivedByOther.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        } finally {
            other.stop();
        }
    }

    @Test
    void undecodableNotification_DroppedWithoutBreakingDelivery() throws InterruptedException {
        // Given
        BlockingQueue<Event> received = new LinkedBlockingQueue<>();
        eventBroker.subscribe(received::add, Set.of());

        // When
        transport.publish("job_completed", "garbage".getBytes(StandardCharsets.UTF_8));
        transport.publish("no_such_topic", new byte[0]);
        JobReleased valid = new JobReleased(NOW, JobId.generate(), TaskId.of("report"), null, JobStatus.FAILURE, null);
        eventBroker.publish(valid);

        // Then
        assertEquals(valid, received.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
    }

    @Test
    void stop_UnsubscribesFromTransport() {
        // When
        eventBroker.stop();

        // Then
        assertEquals(0, transport.subscriberCount());
    }

    @Test
    void jsonSerializer_AlsoSupported() throws InterruptedException {
        // Given
        TransportEventBroker jsonBroker = new TransportEventBroker(new InMemoryEventTransport(), new JsonSerializer());
        jsonBroker.start();
        BlockingQueue<Event> received = new LinkedBlockingQueue<>();
        jsonBroker.subscribe(received::add, Set.of());
        JobReleased event = new JobReleased(NOW, JobId.generate(), TaskId.of("report"), null, JobStatus.MISSED, NOW);

        try {
            // When
            jsonBroker.publish(event);

            // Then
            assertEquals(event, received.poll(DELIVERY_TIMEOUT_MS, TimeUnit.MILLISECONDS));
        } finally {
            jsonBroker.stop();
        }
    }

    @Test
    void publish_TransportFailure_LoggedAndDropped() {
        // Given
        TransportEventBroker broken = new TransportEventBroker(new FailingTransport(), new CborSerializer());
        broken.start();
        JobReleased event = new JobReleased(NOW, JobId.generate(), TaskId.of("report"), null, JobStatus.SUCCESS, NOW);

        try {
            // When & Then
            assertDoesNotThrow(() -> broken.publish(event));
        } finally {
            broken.stop();
        }
    }

    @Test
    void dataStoreWrite_SucceedsWhenTransportFails() {
        // Given
        TransportEventBroker broken = new TransportEventBroker(new FailingTransport(), new CborSerializer());
        broken.start();
        InMemoryDataStore dataStore = new InMemoryDataStore();
        dataStore.start(broken);

        try {
            // When
            assertDoesNotThrow(() -> dataStore.addTask(Task.of(TaskId.of("report"), CallableRef.of("registry:report"))));

            // Then
            assertTrue(dataStore.getTask(TaskId.of("report")).isPresent());
        } finally {
            dataStore.stop();
            broken.stop();
        }
    }

    /**
     * Transport whose publish always fails, as when the connection to the message broker is lost.
     */
    private static final class FailingTransport implements EventTransport {

        private final InMemoryEventTransport delegate = new InMemoryEventTransport();

        @Override
        public void publish(String topic, byte[] payload) {
            throw new IllegalStateException("connection reset");
        }

        @Override
        public Subscription subscribe(BiConsumer<String, byte[]> listener) {
            return delegate.subscribe(listener);
        }
    }
}
