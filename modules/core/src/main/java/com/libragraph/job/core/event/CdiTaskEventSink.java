package com.libragraph.job.core.event;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;

/**
 * Fires every {@link TaskEvent} as a synchronous CDI event so that beans can
 * {@code @Observes} a specific event type.
 */
@ApplicationScoped
public class CdiTaskEventSink implements TaskEventSink {

    @Inject
    Event<TaskEvent> events;

    @Override
    public void emit(TaskEvent event) {
        events.fire(event);
    }
}
