package com.libragraph.job.core.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.job.core.event.CdiTaskEventSink;
import com.libragraph.job.core.event.CompositeTaskEventSink;
import com.libragraph.job.core.event.LoggingTaskEventSink;
import com.libragraph.job.core.event.TaskEventSink;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.ArrayList;
import java.util.List;

@ApplicationScoped
public class TaskExecutorProducer {

    @Inject
    CdiTaskEventSink cdiSink;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "job.events.log.enabled", defaultValue = "true")
    boolean logEvents;

    @Produces
    @Singleton
    public TaskExecutor taskExecutor() {
        List<TaskEventSink> sinks = new ArrayList<>();
        if (logEvents) {
            sinks.add(new LoggingTaskEventSink());
        }
        sinks.add(cdiSink);
        return new TaskExecutor(new CompositeTaskEventSink(sinks), objectMapper);
    }
}
