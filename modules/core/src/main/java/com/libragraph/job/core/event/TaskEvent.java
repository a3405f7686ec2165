package com.libragraph.job.core.event;

import com.libragraph.job.core.task.TaskResult;
import com.libragraph.job.types.TaskStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Lifecycle event emitted by the executor, in protocol order, for one task instance.
 */
public sealed interface TaskEvent {

    String path();

    UUID uuid();

    Instant timestamp();

    record Started(String path, UUID uuid, Instant timestamp) implements TaskEvent {}

    record StatusChanged(
            String path,
            UUID uuid,
            TaskStatus from,
            TaskStatus to,
            Instant timestamp
    ) implements TaskEvent {}

    record RunEnded(
            String path,
            UUID uuid,
            boolean success,
            String summary,
            Instant timestamp
    ) implements TaskEvent {}

    record ExecutionEnded(
            String path,
            UUID uuid,
            TaskStatus status,
            TaskResult result,
            Instant timestamp
    ) implements TaskEvent {}
}
