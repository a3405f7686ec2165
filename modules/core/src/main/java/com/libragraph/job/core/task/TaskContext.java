package com.libragraph.job.core.task;

import java.util.Optional;

/**
 * View of the executing instance handed to {@link JobTask} stages.
 */
public interface TaskContext extends TaskInfo {

    Optional<Object> param(String name);

    /**
     * Converts the parameter map into {@code type}.
     *
     * @throws IllegalArgumentException if the parameters do not fit {@code type}
     */
    <P> P params(Class<P> type);

    /**
     * Converts the metadata map into {@code type}.
     *
     * @throws IllegalArgumentException if the metadata does not fit {@code type}
     */
    <M> M metadata(Class<M> type);
}
