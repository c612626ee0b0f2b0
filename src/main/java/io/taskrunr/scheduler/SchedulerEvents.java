package io.taskrunr.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener list shared by the scheduling and execution sides.
 *
 * <p>Thread-safe: listeners can be added and removed while events are being delivered.
 * A failing listener is logged and skipped; delivery to the others continues.</p>
 */
@Component
public class SchedulerEvents {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEvents.class);

    private final List<SchedulerListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(SchedulerListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SchedulerListener listener) {
        listeners.remove(listener);
    }

    public void notifyListeners(SchedulerEvent event) {
        for (SchedulerListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                log.error("Error in listener for {} event of task {}", event.type(), event.taskId(), e);
            }
        }
    }

    public int size() {
        return listeners.size();
    }
}
