package com.libragraph.job.core.event;

import com.libragraph.job.core.task.TaskResult;
import com.libragraph.job.types.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

class CompositeTaskEventSinkTest {

    private static final TaskEvent STARTED =
            new TaskEvent.Started("demo.hello", UUID.randomUUID(), Instant.now());

    @Test
    void deliversToEverySinkInOrder() {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();

        TaskEventSink.composite(first, second).emit(STARTED);

        assertThat(first.events()).containsExactly(STARTED);
        assertThat(second.events()).containsExactly(STARTED);
    }

    @Test
    void failingSinkDoesNotStopOthers() {
        RecordingSink after = new RecordingSink();
        TaskEventSink broken = event -> {
            throw new IllegalStateException("down");
        };

        CompositeTaskEventSink sink = new CompositeTaskEventSink(List.of(broken, after));

        assertThatCode(() -> sink.emit(STARTED)).doesNotThrowAnyException();
        assertThat(after.events()).containsExactly(STARTED);
    }

    @Test
    void loggingSinkAcceptsEveryEventType() {
        LoggingTaskEventSink sink = new LoggingTaskEventSink();
        UUID uuid = UUID.randomUUID();

        assertThatCode(() -> {
            sink.emit(STARTED);
            sink.emit(new TaskEvent.StatusChanged("demo.hello", uuid,
                    TaskStatus.PENDING,
                    TaskStatus.RUNNING, Instant.now()));
            sink.emit(new TaskEvent.RunEnded("demo.hello", uuid, true, "Ok(0, stdout: hi)", Instant.now()));
            sink.emit(new TaskEvent.ExecutionEnded("demo.hello", uuid,
                    TaskStatus.FAILED,
                    TaskResult.empty(uuid).withRetcode(500), Instant.now()));
        }).doesNotThrowAnyException();
    }
}
