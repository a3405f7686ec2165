package com.libragraph.job.core.event;

import com.libragraph.job.types.TaskStatus;
import org.jboss.logging.Logger;

/**
 * Writes lifecycle events as log lines prefixed with {@code path[uuid]}.
 * Start and end at INFO, status changes at DEBUG, failed executions at ERROR.
 */
public class LoggingTaskEventSink implements TaskEventSink {

    private static final Logger log = Logger.getLogger(LoggingTaskEventSink.class);

    @Override
    public void emit(TaskEvent event) {
        String label = event.path() + "[" + event.uuid() + "]";

        if (event instanceof TaskEvent.Started) {
            log.infof("%s - TaskExecution-Start", label);
        } else if (event instanceof TaskEvent.StatusChanged changed) {
            log.debugf("%s - SetStatus: status updated '%s' -> '%s'",
                    label, changed.from(), changed.to());
        } else if (event instanceof TaskEvent.RunEnded ended) {
            log.infof("%s - Run-End => %s", label, ended.summary());
        } else if (event instanceof TaskEvent.ExecutionEnded ended) {
            if (ended.status() == TaskStatus.FAILED) {
                log.errorf("%s - TaskExecution-End => %s", label, ended.result());
            } else {
                log.infof("%s - TaskExecution-End => %s", label, ended.result());
            }
        }
    }
}
