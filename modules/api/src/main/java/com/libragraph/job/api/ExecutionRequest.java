package com.libragraph.job.api;

import java.util.Map;

/**
 * Body of {@code POST /api/tasks/{path}}. Both maps are optional.
 */
public record ExecutionRequest(
        Map<String, Object> params,
        Map<String, Object> metadata
) {
    public ExecutionRequest {
        params = params == null ? Map.of() : params;
        metadata = metadata == null ? Map.of() : metadata;
    }
}
