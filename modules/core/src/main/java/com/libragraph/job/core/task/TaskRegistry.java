package com.libragraph.job.core.task;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Indexes every {@link JobTask} bean by its {@link JobTask#path()}.
 */
@ApplicationScoped
public class TaskRegistry {

    private static final Logger log = Logger.getLogger(TaskRegistry.class);

    @Inject
    Instance<JobTask> tasks;

    private final Map<String, JobTask> registry = new TreeMap<>();

    @PostConstruct
    void init() {
        for (JobTask task : tasks) {
            register(task);
        }
        log.infof("TaskRegistry initialized with %d task types", registry.size());
    }

    void register(JobTask task) {
        String path = task.path();
        if (path == null || path.isBlank()) {
            throw new IllegalStateException(
                    "Task " + task.getClass().getName() + " declares no path");
        }
        JobTask existing = registry.putIfAbsent(path, task);
        if (existing != null) {
            throw new IllegalStateException(
                    "Duplicate task path '" + path + "': " +
                            existing.getClass().getName() + " and " + task.getClass().getName());
        }
        log.infof("Registered task type: %s → %s", path, task.getClass().getSimpleName());
    }

    public Optional<JobTask> lookup(String path) {
        return Optional.ofNullable(registry.get(path));
    }

    /** Registered tasks, ordered by path. */
    public Collection<JobTask> all() {
        return Collections.unmodifiableCollection(registry.values());
    }

    public int size() {
        return registry.size();
    }
}
