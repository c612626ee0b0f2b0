package io.taskrunr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * TaskRunr: persistent cron, interval and one-shot task scheduling on top of JobRunr.
 */
@SpringBootApplication
public class TaskRunrApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskRunrApplication.class, args);
    }
}
