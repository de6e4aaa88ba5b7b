package com.ryuqq.scheduler.adapter.inmemory.bus;

import com.ryuqq.scheduler.core.event.Event;
import com.ryuqq.scheduler.core.event.EventTopic;
import com.ryuqq.scheduler.core.spi.EventBroker;
import com.ryuqq.scheduler.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * In-process implementation of {@link EventBroker} SPI.
 *
 * <p>Events are handed to a single dispatch thread, so publishers never run subscriber
 * code and events are delivered in publication order. A subscriber that throws is
 * logged and skipped; the remaining subscribers still receive the event.</p>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <ul>
 *   <li>{@link #start()} creates the dispatch thread</li>
 *   <li>{@link #stop()} delivers already queued events, then stops the thread</li>
 *   <li>Events published while stopped are dropped</li>
 *   <li>Subscriptions survive stop/start; only {@link Subscription#unsubscribe()} removes them</li>
 * </ul>
 *
 * <p>Subclasses add cross-process delivery by overriding {@link #publish(Event)}
 * and calling {@link #publishLocal(Event)} for events received from outside.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LocalEventBroker implements EventBroker {

    private static final Logger log = LoggerFactory.getLogger(LocalEventBroker.class);

    private static final long STOP_TIMEOUT_SECONDS = 5L;

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ExecutorService dispatcher;

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("EventBroker is already running");
        }
        dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "scheduler-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        log.debug("{} started", getClass().getSimpleName());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        ExecutorService executor = dispatcher;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Event dispatcher did not terminate in {} seconds, forcing shutdown", STOP_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.debug("{} stopped", getClass().getSimpleName());
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
        ExecutorService executor = dispatcher;
        if (!running.get() || executor == null) {
            log.debug("Dropping {} published while broker is stopped", event.topic().getValue());
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.debug("Dropping {} published during shutdown", event.topic().getValue());
        }
    }

    @Override
    public Subscription subscribe(Consumer<? super Event> callback, Set<EventTopic> topics, boolean oneShot) {
        if (callback == null) {
            throw new IllegalArgumentException("callback cannot be null");
        }
        if (topics == null) {
            throw new IllegalArgumentException("topics cannot be null");
        }
        Registration registration = new Registration(callback, Set.copyOf(topics), oneShot);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Returns whether the broker accepts events.
     *
     * @return true between start and stop
     */
    public boolean isRunning() {
        return running.get();
    }

    public int subscriberCount() {
        return registrations.size();
    }

    private void deliver(Event event) {
        for (Registration registration : registrations) {
            if (!registration.accepts(event)) {
                continue;
            }
            if (registration.oneShot && !registrations.remove(registration)) {
                continue;
            }
            try {
                registration.callback.accept(event);
            } catch (Exception e) {
                log.error("Event subscriber failed for {}", event.topic().getValue(), e);
            }
        }
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
