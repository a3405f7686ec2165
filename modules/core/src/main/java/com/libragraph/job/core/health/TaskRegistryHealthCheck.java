package com.libragraph.job.core.health;

import com.libragraph.job.core.task.TaskRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

@Readiness
@ApplicationScoped
public class TaskRegistryHealthCheck implements HealthCheck {

    @Inject
    TaskRegistry taskRegistry;

    @Override
    public HealthCheckResponse call() {
        int size = taskRegistry.size();
        return HealthCheckResponse.named("task-registry")
                .status(size > 0)
                .withData("taskTypes", size)
                .build();
    }
}
