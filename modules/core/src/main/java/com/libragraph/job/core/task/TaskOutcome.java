package com.libragraph.job.core.task;

/**
 * What a task stage hands back to the executor: an updated result, or an error.
 */
public sealed interface TaskOutcome {

    record Complete(TaskResult result) implements TaskOutcome {}

    record Failed(TaskError error) implements TaskOutcome {}

    static TaskOutcome complete(TaskResult result) {
        return new Complete(result);
    }

    static TaskOutcome fail(TaskError error) {
        return new Failed(error);
    }

    static TaskOutcome fail(Throwable t) {
        return new Failed(TaskError.from(t));
    }
}
