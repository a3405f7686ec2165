package com.libragraph.job.core.event;

import org.jboss.logging.Logger;

import java.util.List;

/**
 * Fans each event out to several sinks. A failing sink does not stop delivery
 * to the ones after it.
 */
public class CompositeTaskEventSink implements TaskEventSink {

    private static final Logger log = Logger.getLogger(CompositeTaskEventSink.class);

    private final List<TaskEventSink> sinks;

    public CompositeTaskEventSink(List<TaskEventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public void emit(TaskEvent event) {
        for (TaskEventSink sink : sinks) {
            try {
                sink.emit(event);
            } catch (RuntimeException e) {
                log.warnf(e, "Event sink %s rejected %s for %s[%s]",
                        sink.getClass().getSimpleName(), event.getClass().getSimpleName(),
                        event.path(), event.uuid());
            }
        }
    }
}
