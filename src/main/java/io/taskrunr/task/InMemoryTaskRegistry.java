package io.taskrunr.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe task registry backed by a concurrent map.
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskRegistry.class);

    private final Map<String, TaskRecord> tasks = new ConcurrentHashMap<>();

    /**
     * Registers a task, replacing any task with the same id.
     */
    public TaskRecord register(TaskRecord task) {
        tasks.put(task.getId(), task);
        log.debug("Task registered: {}", task.getId());
        return task;
    }

    /**
     * Removes a task. The caller is responsible for cancelling its schedule.
     */
    public void remove(String taskId) {
        if (tasks.remove(taskId) != null) {
            log.debug("Task removed: {}", taskId);
        }
    }

    @Override
    public boolean exists(String taskId) {
        return taskId != null && tasks.containsKey(taskId);
    }

    @Override
    public TaskRecord get(String taskId) {
        return taskId == null ? null : tasks.get(taskId);
    }

    public List<TaskRecord> list() {
        return List.copyOf(tasks.values());
    }
}
