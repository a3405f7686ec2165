package com.libragraph.job.app.task;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.libragraph.job.core.task.JobTask;
import com.libragraph.job.core.task.TaskContext;
import com.libragraph.job.core.task.TaskOutcome;
import com.libragraph.job.core.task.TaskResult;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Optional;

/**
 * Greets {@code user} from the current host.
 * <p>
 * The host name comes from {@code job.hostname} when set, otherwise from the
 * local address, falling back to {@code localhost}.
 */
@ApplicationScoped
public class HelloTask implements JobTask {

    public static final String PATH = "demo.hello";

    private static final Logger log = Logger.getLogger(HelloTask.class);

    @ConfigProperty(name = "job.hostname")
    Optional<String> hostname;

    @Override
    public String path() {
        return PATH;
    }

    @Override
    public List<String> requiredParams() {
        return List.of("user");
    }

    @Override
    public TaskOutcome run(TaskResult result, TaskContext ctx) {
        HelloParams params = ctx.params(HelloParams.class);
        return TaskOutcome.complete(
                result.withStdout("Hello " + params.user() + " from " + host()));
    }

    String host() {
        return hostname
                .filter(h -> !h.isBlank())
                .orElseGet(HelloTask::localHostName);
    }

    private static String localHostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debugf("Cannot resolve local host name, using localhost: %s", e.getMessage());
            return "localhost";
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HelloParams(String user) {}
}
