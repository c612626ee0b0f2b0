package io.taskrunr.config;

import io.taskrunr.task.InMemoryTaskRegistry;
import io.taskrunr.task.ScheduledTaskExecutor;
import io.taskrunr.task.TaskRecord;
import io.taskrunr.task.TaskStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    private final SchedulerConfig config = new SchedulerConfig();

    @Test
    void defaultExecutorShouldMarkTaskFailed() throws Exception {
        InMemoryTaskRegistry registry = config.taskRegistry();
        TaskRecord task = registry.register(new TaskRecord("t1", "Report"));

        ScheduledTaskExecutor executor = config.scheduledTaskExecutor(registry);
        executor.execute("t1");

        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals("no task executor configured", task.getError());
    }

    @Test
    void defaultExecutorShouldIgnoreUnknownTasks() {
        ScheduledTaskExecutor executor = config.scheduledTaskExecutor(config.taskRegistry());
        assertDoesNotThrow(() -> executor.execute("missing"));
    }
}
