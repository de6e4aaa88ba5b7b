package com.ryuqq.scheduler.testkit;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.Subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * EventBroker that records every published event and delivers synchronously.
 *
 * <p>Used to assert which events a DataStore emits. Subscribers are called on the
 * publishing thread, so assertions can run right after the DataStore call returns.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingEventBroker implements EventBroker {

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    @Override
    public void start() {
    }

    @Override
    public void stop() {
        registrations.clear();
    }

    @Override
    public void publish(Event event) {
        publishLocal(event);
    }

    @Override
    public void publishLocal(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
        for (Registration registration : registrations) {
            if (!registration.accepts(event)) {
                continue;
            }
            // one-shot registrations fire only for the caller that removed them
            if (!registration.oneShot || registrations.remove(registration)) {
                registration.callback.accept(event);
            }
        }
    }

    @Override
    public Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics, boolean oneShot) {
        Registration registration = new Registration(callback, Set.copyOf(topics), oneShot);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Returns all recorded events in publication order.
     *
     * @return snapshot of recorded events
     */
    public List<Event> getEvents() {
        return new ArrayList<>(events);
    }

    /**
     * Returns recorded events of the given type.
     *
     * @param type event class
     * @param <E> event type
     * @return matching events in publication order
     */
    public <E extends Event> List<E> getEvents(Class<E> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .collect(Collectors.toList());
    }

    public void clear() {
        events.clear();
    }

    private static final class Registration {

        private final Consumer<? super Event> callback;
        private final Set<EventTopic> topics;
        private final boolean oneShot;

        Registration(Consumer<? super Event> callback, Set<EventTopic> topics, boolean oneShot) {
            this.callback = callback;
            this.topics = topics;
            this.oneShot = oneShot;
        }

        boolean accepts(Event event) {
            return topics.isEmpty() || topics.contains(event.topic());
        }
    }
}
