package com.libragraph.job.api;

import com.libragraph.job.core.task.TaskInstance;
import com.libragraph.job.core.task.TaskResult;
import com.libragraph.job.types.TaskStatus;

import java.util.UUID;

public record ExecutionResponse(
        UUID uuid,
        String path,
        TaskStatus status,
        TaskResult result
) {
    static ExecutionResponse of(TaskInstance instance) {
        return new ExecutionResponse(instance.uuid(), instance.path(),
                instance.status(), instance.result());
    }
}
