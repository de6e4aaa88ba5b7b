package com.ryuqq.scheduler.adapter.inmemory.bus;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.exception.SerializationException;
import com.ryuqq.scheduler.core.spi.EventTransport;
import com.ryuqq.scheduler.core.spi.Serializer;
import com.ryuqq.scheduler.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LocalEventBroker} that fans events out through an {@link EventTransport}.
 *
 * <p>Every published event is encoded with the {@link Serializer} and sent on the
 * transport under its topic name. Notifications received from the transport
 * (including this instance's own) are decoded and delivered to local subscribers,
 * so each process sees each event once per transport delivery.</p>
 *
 * <p>Notifications that cannot be decoded (unknown topic, corrupt payload) are
 * logged and dropped; they never stop the receiving thread. Likewise an event that
 * cannot be encoded or sent is logged and dropped, so the publisher (typically a
 * DataStore that has already committed its write) never sees the failure.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class TransportEventBroker extends LocalEventBroker {

    private static final Logger log = LoggerFactory.getLogger(TransportEventBroker.class);

    private final EventTransport transport;
    private final Serializer serializer;
    private volatile Subscription transportSubscription;

    public TransportEventBroker(EventTransport transport, Serializer serializer) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        this.transport = transport;
        this.serializer = serializer;
    }

    @Override
    public void start() {
        super.start();
        transportSubscription = transport.subscribe(this::onNotification);
    }

    @Override
    public void stop() {
        Subscription subscription = transportSubscription;
        if (subscription != null) {
            subscription.unsubscribe();
            transportSubscription = null;
        }
        super.stop();
    }

    @Override
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        if (!isRunning()) {
            log.debug("Dropping {} published while broker is stopped", event.topic().getValue());
            return;
        }
        try {
            transport.publish(event.topic().getValue(), serializer.serialize(event));
        } catch (RuntimeException e) {
            log.error("Failed to publish {} to transport, event dropped", event.topic().getValue(), e);
        }
    }

    private void onNotification(String topic, byte[] payload) {
        Event event;
        try {
            EventTopic eventTopic = EventTopic.fromValue(topic);
            event = serializer.deserialize(payload, eventTopic.getEventType());
        } catch (IllegalArgumentException | SerializationException e) {
            log.warn("Dropping undecodable notification on topic {}", topic, e);
            return;
        }
        publishLocal(event);
    }
}
