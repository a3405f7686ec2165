package com.libragraph.job.core.task;

import java.util.List;

/**
 * Logic of a task type, driven by {@link TaskExecutor}.
 * <p>
 * Only {@link #path()} and {@link #run} are mandatory. The hooks default to
 * passing the result through unchanged. Every stage receives the current
 * result and returns the next one wrapped in a {@link TaskOutcome}; throwing
 * is allowed and is treated as {@link TaskOutcome#fail(Throwable)}.
 * <p>
 * Implementations may be {@code @ApplicationScoped} CDI beans, in which case
 * {@link TaskRegistry} makes them addressable by path.
 */
public interface JobTask {

    String path();

    /** Parameter names that must be supplied, checked in this order before anything runs. */
    default List<String> requiredParams() {
        return List.of();
    }

    TaskOutcome run(TaskResult result, TaskContext ctx);

    default TaskOutcome postInit(TaskResult result, TaskContext ctx) {
        return TaskOutcome.complete(result);
    }

    default TaskOutcome preRun(TaskResult result, TaskContext ctx) {
        return TaskOutcome.complete(result);
    }

    default TaskOutcome postRun(TaskResult result, TaskContext ctx) {
        return TaskOutcome.complete(result);
    }

    default TaskOutcome onSuccess(TaskResult result, TaskContext ctx) {
        return TaskOutcome.complete(result);
    }

    /**
     * Called once the instance has failed. A returned result is merged into
     * the failure result; it cannot clear the failure.
     */
    default TaskOutcome onError(TaskError error, TaskResult result, TaskContext ctx) {
        return TaskOutcome.complete(result);
    }
}
