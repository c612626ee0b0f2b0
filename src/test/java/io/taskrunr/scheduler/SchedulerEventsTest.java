package io.taskrunr.scheduler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.taskrunr.scheduler.SchedulerEvent.ScheduleRemoved;
import io.taskrunr.scheduler.SchedulerEvent.ScheduleUpdated;
import io.taskrunr.scheduler.SchedulerEvent.TaskErrored;
import io.taskrunr.scheduler.SchedulerEvent.TaskFinished;
import io.taskrunr.scheduler.SchedulerEvent.TaskStarted;
import io.taskrunr.trigger.ScheduleType;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerEventsTest {

    private static final Instant START = Instant.parse("2025-01-01T10:00:00Z");
    private static final Instant END = Instant.parse("2025-01-01T10:00:05Z");

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    @Test
    void failingListenerShouldNotBlockOthers() {
        var events = new SchedulerEvents();
        List<SchedulerEvent> received = new ArrayList<>();
        events.addListener(event -> {
            throw new IllegalStateException("listener broke");
        });
        events.addListener(received::add);

        assertDoesNotThrow(() -> events.notifyListeners(new ScheduleRemoved("t1")));
        assertEquals(1, received.size());
    }

    @Test
    void removedListenerShouldNoLongerReceiveEvents() {
        var events = new SchedulerEvents();
        List<SchedulerEvent> received = new ArrayList<>();
        SchedulerListener listener = received::add;
        events.addListener(listener);
        events.removeListener(listener);

        events.notifyListeners(new ScheduleRemoved("t1"));

        assertTrue(received.isEmpty());
        assertEquals(0, events.size());
    }

    @Test
    void eventsShouldCarryTheirType() {
        assertEquals("schedule_update", new ScheduleUpdated("t1", null).type());
        assertEquals("schedule_removed", new ScheduleRemoved("t1").type());
        assertEquals("task_started", new TaskStarted("t1", START).type());
        assertEquals("task_finished", new TaskFinished("t1", "completed", START, END, null).type());
        assertEquals("task_error", new TaskErrored("t1", "boom", START, END).type());
    }

    @Test
    void taskFinishedShouldSerializeWithContractFieldNames() {
        JsonNode json = mapper.valueToTree(new TaskFinished("t1", "failed", START, END, "boom"));

        assertEquals("task_finished", json.get("type").asText());
        assertEquals("t1", json.get("task_id").asText());
        assertEquals("failed", json.get("status").asText());
        assertEquals("2025-01-01T10:00:00Z", json.get("start_time").asText());
        assertEquals("2025-01-01T10:00:05Z", json.get("end_time").asText());
        assertEquals("boom", json.get("error").asText());
    }

    @Test
    void scheduleUpdateShouldNestScheduleDetails() {
        var info = new ScheduleInfo("t1", "task-t1-abc", ScheduleType.INTERVAL, "every 10s",
                "Every 10 seconds", END, Map.of("type", "interval", "seconds", 10L));

        JsonNode json = mapper.valueToTree(new ScheduleUpdated("t1", info));

        assertEquals("schedule_update", json.get("type").asText());
        assertEquals("t1", json.get("task_id").asText());
        JsonNode schedule = json.get("schedule");
        assertEquals("task-t1-abc", schedule.get("job_id").asText());
        assertEquals("interval", schedule.get("schedule_type").asText());
        assertEquals("every 10s", schedule.get("schedule_value").asText());
        assertEquals("Every 10 seconds", schedule.get("human_readable").asText());
        assertEquals("2025-01-01T10:00:05Z", schedule.get("next_run_time").asText());
        assertEquals(10, schedule.get("trigger").get("seconds").asInt());
    }

    @Test
    void taskErrorShouldSerializeErrorAndTimes() {
        JsonNode json = mapper.valueToTree(new TaskErrored("t1", "executor crashed", START, END));

        assertEquals("task_error", json.get("type").asText());
        assertEquals("executor crashed", json.get("error").asText());
        assertEquals("2025-01-01T10:00:05Z", json.get("end_time").asText());
    }
}
