package com.libragraph.job.core.task;

import com.libragraph.job.types.TaskStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of a {@link JobTask}.
 * <p>
 * Identity (uuid and task path), parameters and metadata are fixed at
 * construction. Status and result are changed only by {@link TaskExecutor},
 * and status only moves forward (see {@link TaskStatus#canTransitionTo}).
 * Instances are single-use and not thread-safe.
 */
public final class TaskInstance implements TaskInfo {

    private final UUID uuid;
    private final JobTask task;
    private final String path;
    private final Map<String, Object> params;
    private final Map<String, Object> metadata;

    private TaskStatus status = TaskStatus.PENDING;
    private TaskResult result;

    private TaskInstance(Builder builder) {
        this.task = Objects.requireNonNull(builder.task, "task cannot be null");
        this.path = Objects.requireNonNull(task.path(), "task path cannot be null");
        this.uuid = builder.uuid != null ? builder.uuid : UUID.randomUUID();
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(builder.params));
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.result = builder.result != null
                ? builder.result.withUuid(uuid)
                : TaskResult.empty(uuid);
    }

    public static TaskInstance of(JobTask task, Map<String, ?> params) {
        return builder(task).params(params).build();
    }

    public static Builder builder(JobTask task) {
        return new Builder(task);
    }

    public JobTask task() {
        return task;
    }

    public List<String> requiredParams() {
        return task.requiredParams();
    }

    @Override
    public UUID uuid() {
        return uuid;
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public TaskStatus status() {
        return status;
    }

    @Override
    public Map<String, Object> params() {
        return params;
    }

    @Override
    public Map<String, Object> metadata() {
        return metadata;
    }

    @Override
    public TaskResult result() {
        return result;
    }

    /** Returns {@code path[uuid]}, the prefix used in log lines. */
    public String label() {
        return path() + "[" + uuid + "]";
    }

    // -- Mutation, reserved for TaskExecutor --

    TaskStatus transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal status transition for " + label() + ": " + status + " -> " + next);
        }
        TaskStatus previous = status;
        status = next;
        return previous;
    }

    void applyResult(TaskResult next) {
        result = Objects.requireNonNull(next, "result cannot be null").withUuid(uuid);
    }

    @Override
    public String toString() {
        return label() + " " + status;
    }

    public static final class Builder {

        private final JobTask task;
        private UUID uuid;
        private final Map<String, Object> params = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();
        private TaskResult result;

        private Builder(JobTask task) {
            this.task = task;
        }

        public Builder uuid(UUID uuid) {
            this.uuid = uuid;
            return this;
        }

        public Builder params(Map<String, ?> values) {
            if (values != null) params.putAll(values);
            return this;
        }

        public Builder param(String name, Object value) {
            params.put(name, value);
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) metadata.putAll(values);
            return this;
        }

        /** Initial result; its uuid is replaced by the instance uuid. */
        public Builder result(TaskResult initial) {
            this.result = initial;
            return this;
        }

        public TaskInstance build() {
            return new TaskInstance(this);
        }
    }
}
