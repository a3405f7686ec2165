package com.libragraph.job.core.task;

import com.libragraph.job.types.TaskStatus;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Read-only identity and state of a task instance.
 */
public interface TaskInfo {

    UUID uuid();

    /** Type path of the task, e.g. {@code demo.hello}. */
    String path();

    TaskStatus status();

    Map<String, Object> params();

    Map<String, Object> metadata();

    TaskResult result();

    default Optional<Object> searchResult(String key) {
        return result().retvalue(key);
    }

    /** Returns an empty result carrying this instance's uuid. */
    default TaskResult newResult() {
        return TaskResult.empty(uuid());
    }
}
