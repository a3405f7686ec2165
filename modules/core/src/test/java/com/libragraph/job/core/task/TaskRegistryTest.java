package com.libragraph.job.core.task;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TaskRegistryTest {

    private static ScriptedTask task(String path) {
        return new ScriptedTask(path, List.of(), (r, ctx) -> TaskOutcome.complete(r));
    }

    @Test
    void registersByPath() {
        TaskRegistry registry = new TaskRegistry();
        ScriptedTask hello = task("demo.hello");

        registry.register(hello);

        assertThat(registry.lookup("demo.hello")).containsSame(hello);
        assertThat(registry.lookup("demo.other")).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void listsTasksOrderedByPath() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(task("b.second"));
        registry.register(task("a.first"));

        assertThat(registry.all()).extracting(JobTask::path).containsExactly("a.first", "b.second");
    }

    @Test
    void rejectsDuplicatePath() {
        TaskRegistry registry = new TaskRegistry();
        registry.register(task("demo.hello"));

        assertThatIllegalStateException()
                .isThrownBy(() -> registry.register(task("demo.hello")))
                .withMessageContaining("Duplicate task path 'demo.hello'");
    }

    @Test
    void rejectsBlankPath() {
        TaskRegistry registry = new TaskRegistry();

        assertThatIllegalStateException()
                .isThrownBy(() -> registry.register(task(" ")))
                .withMessageContaining("declares no path");
    }
}
