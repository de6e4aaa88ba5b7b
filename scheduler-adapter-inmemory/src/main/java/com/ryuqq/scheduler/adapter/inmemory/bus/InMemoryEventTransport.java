package com.ryuqq.scheduler.adapter.inmemory.bus;

import com.ryuqq.scheduler.core.spi.EventTransport;
import com.ryuqq.scheduler.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * In-memory {@link EventTransport} shared by brokers in the same JVM.
 *
 * <p>Stands in for an external pub/sub channel in tests: each notification is
 * delivered synchronously to every subscriber, including the publisher.
 * A failing subscriber is logged and does not stop delivery to the others.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventTransport implements EventTransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventTransport.class);

    private final List<BiConsumer<String, byte[]>> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(String topic, byte[] payload) {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic cannot be null or blank");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        for (BiConsumer<String, byte[]> subscriber : subscribers) {
            try {
                subscriber.accept(topic, payload.clone());
            } catch (RuntimeException e) {
                log.error("Transport subscriber failed for topic {}", topic, e);
            }
        }
    }

    @Override
    public Subscription subscribe(BiConsumer<String, byte[]> callback) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        subscribers.add(callback);
        return () -> subscribers.remove(callback);
    }

    public int subscriberCount() {
        return subscribers.size();
    }
}
