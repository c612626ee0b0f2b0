package io.taskrunr.scheduler;

/**
 * Receives scheduler lifecycle events. Called on the thread that caused the event.
 */
@FunctionalInterface
public interface SchedulerListener {

    void onEvent(SchedulerEvent event);
}
