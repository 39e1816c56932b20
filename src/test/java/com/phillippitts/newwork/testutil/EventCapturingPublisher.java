package com.phillippitts.newwork.testutil;

import com.phillippitts.newwork.domain.BackendState;
import com.phillippitts.newwork.domain.HealthStatus;
import com.phillippitts.newwork.service.backend.event.BackendHealthEvent;
import org.springframework.context.ApplicationEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Test double for ApplicationEventPublisher that captures events for verification.
 *
 * <p>Thread-safe implementation using CopyOnWriteArrayList for concurrent test scenarios.
 * An optional forwarder delivers events synchronously, standing in for {@code @EventListener}
 * wiring.
 */
public class EventCapturingPublisher implements ApplicationEventPublisher {
    final List<Object> events = new CopyOnWriteArrayList<>();
    private volatile Consumer<Object> forwarder = e -> { };

    @Override
    public void publishEvent(ApplicationEvent event) {
        publishEvent((Object) event);
    }

    @Override
    public void publishEvent(Object event) {
        events.add(event);
        forwarder.accept(event);
    }

    public void forwardTo(Consumer<Object> forwarder) {
        this.forwarder = forwarder;
    }

    public List<Object> events() {
        return List.copyOf(events);
    }

    public <T> List<T> eventsOfType(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    /**
     * Backend states in emission order.
     */
    public List<BackendState> states() {
        return eventsOfType(BackendHealthEvent.class).stream()
                .map(BackendHealthEvent::status)
                .map(HealthStatus::state)
                .toList();
    }

    /**
     * Clears all captured events (useful for multi-iteration tests).
     */
    public void clear() {
        events.clear();
    }
}
