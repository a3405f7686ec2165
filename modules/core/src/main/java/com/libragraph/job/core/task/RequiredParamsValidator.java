package com.libragraph.job.core.task;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks declared required parameter names against the supplied parameters.
 * A name counts as supplied when it maps to a non-null value.
 */
public final class RequiredParamsValidator {

    private RequiredParamsValidator() {
    }

    /**
     * @return empty when every required name is present, otherwise a
     *         {@link TaskError#MISSING_PARAMETER} error for the first missing
     *         name in declaration order
     */
    public static Optional<TaskError> validate(List<String> required, Map<String, ?> params) {
        if (required == null || required.isEmpty()) {
            return Optional.empty();
        }
        for (String name : required) {
            if (params == null || params.get(name) == null) {
                return Optional.of(TaskError.missingParameter(name));
            }
        }
        return Optional.empty();
    }
}
