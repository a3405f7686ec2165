package com.libragraph.job.core.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.job.core.event.LoggingTaskEventSink;
import com.libragraph.job.core.event.TaskEvent;
import com.libragraph.job.core.event.TaskEventSink;
import com.libragraph.job.types.TaskStatus;
import org.jboss.logging.Logger;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Drives one {@link TaskInstance} through its lifecycle:
 * <ol>
 *   <li>required parameter check; a missing name fails the instance
 *       ({@code PENDING -> FAILED}) before any task code runs</li>
 *   <li>{@code postInit} and {@code preRun} hooks</li>
 *   <li>{@code PENDING -> RUNNING}, then {@code run} exactly once</li>
 *   <li>{@code postRun} and {@code onSuccess} hooks</li>
 *   <li>{@code RUNNING -> SUCCESS}, or {@code -> FAILED} with the
 *       {@code onError} hook if any stage failed</li>
 * </ol>
 * Events go to the {@link TaskEventSink} in that order. {@link #execute}
 * never throws for task failures: every failure ends as a {@code FAILED}
 * instance whose result carries a non-zero retcode.
 * <p>
 * The executor holds no per-task state and may be shared; a given instance
 * must be executed from one thread, once.
 */
public class TaskExecutor {

    private static final Logger log = Logger.getLogger(TaskExecutor.class);

    private final TaskEventSink sink;
    private final ObjectMapper objectMapper;

    public TaskExecutor() {
        this(new LoggingTaskEventSink());
    }

    public TaskExecutor(TaskEventSink sink) {
        this(sink, new ObjectMapper());
    }

    public TaskExecutor(TaskEventSink sink, ObjectMapper objectMapper) {
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public TaskResult execute(TaskInstance task) {
        return execute(task, null);
    }

    /**
     * Executes {@code task}, first merging {@code initial} (if any) into its result.
     * <p>
     * An instance that is no longer {@code PENDING} is not run again: its
     * current result is returned and no event is emitted.
     */
    public TaskResult execute(TaskInstance task, TaskResult initial) {
        Objects.requireNonNull(task, "task cannot be null");
        if (task.status() != TaskStatus.PENDING) {
            log.warnf("%s - already executed (status %s), not running again",
                    task.label(), task.status());
            return task.result();
        }

        TaskContext ctx = new DefaultTaskContext(task, objectMapper);
        try {
            emit(new TaskEvent.Started(task.path(), task.uuid(), Instant.now()));
            return runLifecycle(task, ctx, initial);
        } catch (RuntimeException e) {
            log.errorf(e, "%s - executor failure", task.label());
            if (task.status().isTerminal()) {
                return task.result();
            }
            return finishFailed(task, ctx, TaskError.from(e));
        }
    }

    private TaskResult runLifecycle(TaskInstance task, TaskContext ctx, TaskResult initial) {
        JobTask job = task.task();

        if (initial != null) {
            task.applyResult(task.result().merge(initial));
        }

        Optional<TaskError> invalid = RequiredParamsValidator.validate(job.requiredParams(), task.params());
        if (invalid.isPresent()) {
            log.debugf("%s - CheckRequiredParams => %s", task.label(), invalid.get());
            return finishFailed(task, ctx, invalid.get());
        }

        Optional<TaskError> error = stage(task, "PostInit", r -> job.postInit(r, ctx));
        if (error.isEmpty()) {
            error = stage(task, "PreRun", r -> job.preRun(r, ctx));
        }
        if (error.isPresent()) {
            return finishFailed(task, ctx, error.get());
        }

        changeStatus(task, TaskStatus.RUNNING);
        log.infof("%s - Run-Start", task.label());
        error = stage(task, "Run", r -> job.run(r, ctx));
        emit(new TaskEvent.RunEnded(task.path(), task.uuid(), error.isEmpty(),
                error.map(TaskError::toString).orElseGet(() -> task.result().toString()),
                Instant.now()));

        if (error.isEmpty()) {
            error = stage(task, "PostRun", r -> job.postRun(r, ctx));
        }
        if (error.isEmpty()) {
            error = stage(task, "OnSuccess", r -> job.onSuccess(r, ctx));
        }
        if (error.isPresent()) {
            return finishFailed(task, ctx, error.get());
        }

        changeStatus(task, TaskStatus.SUCCESS);
        emit(new TaskEvent.ExecutionEnded(task.path(), task.uuid(),
                TaskStatus.SUCCESS, task.result(), Instant.now()));
        return task.result();
    }

    /**
     * Runs one stage against the current result. A completed stage replaces
     * the instance result; a completed stage with a non-zero retcode counts as
     * a failure.
     */
    private Optional<TaskError> stage(TaskInstance task, String action,
                                      Function<TaskResult, TaskOutcome> body) {
        log.debugf("%s - %s-Start", task.label(), action);
        TaskOutcome outcome = invoke(action, task.result(), body);

        Optional<TaskError> error;
        if (outcome instanceof TaskOutcome.Complete complete) {
            task.applyResult(complete.result());
            int retcode = complete.result().retcode();
            error = retcode == 0
                    ? Optional.empty()
                    : Optional.of(new TaskError(TaskError.RUN_ERROR, retcode,
                    complete.result().stderr() != null
                            ? complete.result().stderr()
                            : action + " returned retcode " + retcode));
        } else {
            error = Optional.of(((TaskOutcome.Failed) outcome).error());
        }

        log.debugf("%s - %s-End => %s", task.label(), action,
                error.map(TaskError::toString).orElseGet(() -> task.result().toString()));
        return error;
    }

    private TaskOutcome invoke(String action, TaskResult input, Function<TaskResult, TaskOutcome> body) {
        TaskOutcome outcome;
        try {
            outcome = body.apply(input);
        } catch (Exception | StackOverflowError | AssertionError e) {
            log.debugf(e, "%s threw", action);
            return TaskOutcome.fail(e);
        }
        if (outcome instanceof TaskOutcome.Complete complete && complete.result() != null) {
            return outcome;
        }
        if (outcome instanceof TaskOutcome.Failed failed && failed.error() != null) {
            return outcome;
        }
        return TaskOutcome.fail(TaskError.unexpected(action + " returned no outcome"));
    }

    private TaskResult finishFailed(TaskInstance task, TaskContext ctx, TaskError error) {
        task.applyResult(task.result().merge(TaskResult.from(task.uuid(), error)));
        if (!task.status().isTerminal()) {
            changeStatus(task, TaskStatus.FAILED);
        }

        log.debugf("%s - OnError-Start", task.label());
        TaskOutcome hook = invoke("OnError", task.result(), r -> task.task().onError(error, r, ctx));
        if (hook instanceof TaskOutcome.Complete complete) {
            task.applyResult(task.result().merge(complete.result()));
        } else {
            log.warnf("%s - OnError hook failed: %s", task.label(),
                    ((TaskOutcome.Failed) hook).error());
        }
        log.debugf("%s - OnError-End => %s", task.label(), task.result());

        emit(new TaskEvent.ExecutionEnded(task.path(), task.uuid(),
                TaskStatus.FAILED, task.result(), Instant.now()));
        return task.result();
    }

    private void changeStatus(TaskInstance task, TaskStatus next) {
        TaskStatus previous = task.transitionTo(next);
        emit(new TaskEvent.StatusChanged(task.path(), task.uuid(), previous, next, Instant.now()));
    }

    private void emit(TaskEvent event) {
        try {
            sink.emit(event);
        } catch (RuntimeException e) {
            log.warnf(e, "Event sink failed on %s for %s[%s]",
                    event.getClass().getSimpleName(), event.path(), event.uuid());
        }
    }
}
