package com.libragraph.job.core.event;

import java.util.List;

/**
 * Receiver of {@link TaskEvent}s. Sinks are called synchronously on the
 * executing thread; an exception thrown here is logged and otherwise ignored
 * by the executor.
 */
@FunctionalInterface
public interface TaskEventSink {

    TaskEventSink NOOP = event -> { };

    void emit(TaskEvent event);

    static TaskEventSink composite(TaskEventSink... sinks) {
        return new CompositeTaskEventSink(List.of(sinks));
    }
}
