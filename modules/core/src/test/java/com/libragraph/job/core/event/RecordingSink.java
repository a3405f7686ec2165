package com.libragraph.job.core.event;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Collects emitted events for assertions. */
public class RecordingSink implements TaskEventSink {

    private final List<TaskEvent> events = new ArrayList<>();

    @Override
    public void emit(TaskEvent event) {
        events.add(event);
    }

    public List<TaskEvent> events() {
        return events;
    }

    /**
     * Compact trace such as {@code [start, PENDING->RUNNING, run-end(ok), RUNNING->SUCCESS, end(SUCCESS)]}.
     */
    public List<String> trace() {
        return events.stream().map(RecordingSink::describe).collect(Collectors.toList());
    }

    public <E extends TaskEvent> List<E> eventsOf(Class<E> type) {
        return events.stream().filter(type::isInstance).map(type::cast).collect(Collectors.toList());
    }

    private static String describe(TaskEvent event) {
        if (event instanceof TaskEvent.Started) {
            return "start";
        } else if (event instanceof TaskEvent.StatusChanged changed) {
            return changed.from() + "->" + changed.to();
        } else if (event instanceof TaskEvent.RunEnded ended) {
            return ended.success() ? "run-end(ok)" : "run-end(fail)";
        } else if (event instanceof TaskEvent.ExecutionEnded ended) {
            return "end(" + ended.status() + ")";
        }
        return event.toString();
    }
}
