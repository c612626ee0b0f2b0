package io.taskrunr.config;

import org.jobrunr.jobs.mappers.JobMapper;
import org.jobrunr.storage.InMemoryStorageProvider;
import org.jobrunr.storage.StorageProvider;
import org.jobrunr.utils.mapper.jackson.JacksonJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JobRunr configuration. Jobs are kept in memory: the schedule store is the durable
 * record and the task scheduler re-registers its jobs on every start.
 * The jobrunr-spring-boot-3-starter builds the JobScheduler and background server on top.
 */
@Configuration
public class JobRunrConfig {

    private static final Logger log = LoggerFactory.getLogger(JobRunrConfig.class);

    @Bean
    public StorageProvider storageProvider() {
        var storageProvider = new InMemoryStorageProvider();
        storageProvider.setJobMapper(new JobMapper(new JacksonJsonMapper()));
        log.info("JobRunr in-memory storage configured");
        return storageProvider;
    }
}
