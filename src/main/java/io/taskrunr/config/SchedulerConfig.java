package io.taskrunr.config;

import io.taskrunr.task.InMemoryTaskRegistry;
import io.taskrunr.task.ScheduledTaskExecutor;
import io.taskrunr.task.TaskRecord;
import io.taskrunr.task.TaskRegistry;
import io.taskrunr.task.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default collaborators of the task scheduler. A host application replaces them by
 * declaring its own {@link TaskRegistry} and {@link ScheduledTaskExecutor} beans.
 */
@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulerConfig.class);

    @Bean
    @ConditionalOnMissingBean(TaskRegistry.class)
    public InMemoryTaskRegistry taskRegistry() {
        return new InMemoryTaskRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduledTaskExecutor scheduledTaskExecutor(TaskRegistry taskRegistry) {
        log.warn("No ScheduledTaskExecutor bean defined, scheduled runs will be marked failed");
        return taskId -> {
            TaskRecord task = taskRegistry.get(taskId);
            if (task != null) {
                task.setError("no task executor configured");
                task.setStatus(TaskStatus.FAILED);
            }
        };
    }
}
