package com.libragraph.job.core.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.job.types.TaskStatus;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

class DefaultTaskContext implements TaskContext {

    private final TaskInstance instance;
    private final ObjectMapper objectMapper;

    DefaultTaskContext(TaskInstance instance, ObjectMapper objectMapper) {
        this.instance = instance;
        this.objectMapper = objectMapper;
    }

    @Override
    public UUID uuid() {
        return instance.uuid();
    }

    @Override
    public String path() {
        return instance.path();
    }

    @Override
    public TaskStatus status() {
        return instance.status();
    }

    @Override
    public Map<String, Object> params() {
        return instance.params();
    }

    @Override
    public Map<String, Object> metadata() {
        return instance.metadata();
    }

    @Override
    public TaskResult result() {
        return instance.result();
    }

    @Override
    public Optional<Object> param(String name) {
        return Optional.ofNullable(instance.params().get(name));
    }

    @Override
    public <P> P params(Class<P> type) {
        return convert(instance.params(), type);
    }

    @Override
    public <M> M metadata(Class<M> type) {
        return convert(instance.metadata(), type);
    }

    private <T> T convert(Map<String, Object> values, Class<T> type) {
        try {
            return objectMapper.convertValue(values, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Failed to convert " + values.keySet() + " to " + type.getSimpleName(), e);
        }
    }
}
