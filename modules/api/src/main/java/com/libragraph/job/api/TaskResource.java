package com.libragraph.job.api;

import com.libragraph.job.core.task.JobTask;
import com.libragraph.job.core.task.TaskExecutor;
import com.libragraph.job.core.task.TaskInstance;
import com.libragraph.job.core.task.TaskRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Runs registered task types over HTTP. Execution is synchronous: the
 * response carries the terminal status and result, with HTTP 200 for both
 * successful and failed executions.
 */
@Path("/api/tasks")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class TaskResource {

    private static final Logger log = Logger.getLogger(TaskResource.class);

    @Inject
    TaskRegistry taskRegistry;

    @Inject
    TaskExecutor taskExecutor;

    @GET
    public List<TaskTypeInfo> list() {
        return taskRegistry.all().stream()
                .map(t -> new TaskTypeInfo(t.path(), List.copyOf(t.requiredParams())))
                .toList();
    }

    @POST
    @Path("/{path}")
    public ExecutionResponse execute(@PathParam("path") String path, ExecutionRequest request) {
        JobTask task = taskRegistry.lookup(path)
                .orElseThrow(() -> new NotFoundException("Unknown task type: " + path));
        ExecutionRequest body = request != null ? request : new ExecutionRequest(null, null);

        TaskInstance instance = TaskInstance.builder(task)
                .params(body.params())
                .metadata(body.metadata())
                .build();
        log.debugf("Executing %s with params %s", instance.label(), body.params().keySet());

        taskExecutor.execute(instance);
        return ExecutionResponse.of(instance);
    }
}
