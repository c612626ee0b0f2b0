package io.taskrunr.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskrunr.trigger.ScheduleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * One-shot importer for the old {@code scheduled_tasks.json} schedule file.
 *
 * <p>The file maps task ids to {@code {job_id, next_run_time, trigger}} where the trigger is
 * one of:</p>
 * <pre>
 * {"type": "cron", "minute": "0", "hour": "9", "day": "*", "month": "*", "day_of_week": "1-5"}
 * {"type": "interval", "seconds": 3600}
 * {"type": "date", "run_date": "2025-06-01T00:00:00"}
 * </pre>
 * Task ids already in the store are skipped. After a successful import the file is renamed
 * to {@code scheduled_tasks.json.migrated}; on failure it is left in place for the next start.
 */
class LegacyScheduleMigrator {

    private static final Logger log = LoggerFactory.getLogger(LegacyScheduleMigrator.class);

    static final String MIGRATED_SUFFIX = ".migrated";
    static final String UNKNOWN_VALUE = "unknown";

    private static final List<String> CRON_FIELDS = List.of("minute", "hour", "day", "month", "day_of_week");

    private final ScheduleStore store;
    private final ObjectMapper objectMapper;

    LegacyScheduleMigrator(ScheduleStore store, ObjectMapper objectMapper) {
        this.store = store;
        this.objectMapper = objectMapper;
    }

    /**
     * Imports the legacy file if it exists.
     *
     * @return number of schedules inserted
     */
    int migrate(Path legacyFile) {
        if (!Files.exists(legacyFile)) {
            return 0;
        }

        try {
            JsonNode root = objectMapper.readTree(legacyFile.toFile());
            if (root == null || !root.isObject() || root.isEmpty()) {
                log.debug("Legacy schedule file {} is empty, nothing to migrate", legacyFile);
                return 0;
            }

            List<Schedule> schedules = new ArrayList<>();
            Instant now = Instant.now();
            Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
            while (entries.hasNext()) {
                var entry = entries.next();
                schedules.add(toSchedule(entry.getKey(), entry.getValue(), now));
            }

            int inserted = store.insertMissing(schedules);

            Path migrated = legacyFile.resolveSibling(legacyFile.getFileName() + MIGRATED_SUFFIX);
            Files.move(legacyFile, migrated, StandardCopyOption.REPLACE_EXISTING);

            log.info("Migrated {} of {} legacy schedules from {}", inserted, schedules.size(), legacyFile);
            return inserted;
        } catch (IOException | PersistenceException e) {
            log.error("Error migrating legacy schedules from {}", legacyFile, e);
            return 0;
        }
    }

    private Schedule toSchedule(String taskId, JsonNode entry, Instant now) {
        JsonNode trigger = entry.path("trigger");
        String type = trigger.path("type").asText(UNKNOWN_VALUE);
        String nextRun = entry.path("next_run_time").asText(null);

        return new Schedule(
                taskId,
                entry.path("job_id").asText(""),
                ScheduleType.fromString(type),
                toScheduleValue(trigger),
                now,
                nextRun == null ? null : ScheduleStore.parseLenient(nextRun));
    }

    /**
     * Rebuilds a schedule spec from a legacy trigger. Shapes that cannot be rebuilt map to {@code "unknown"}.
     */
    static String toScheduleValue(JsonNode trigger) {
        return switch (ScheduleType.fromString(trigger.path("type").asText())) {
            case CRON -> cronValue(trigger);
            case INTERVAL -> intervalValue(trigger.path("seconds").asLong(0));
            case DATE -> {
                String runDate = trigger.path("run_date").asText("");
                yield runDate.isBlank() ? UNKNOWN_VALUE : "at:" + runDate;
            }
            case UNKNOWN -> UNKNOWN_VALUE;
        };
    }

    private static String cronValue(JsonNode trigger) {
        List<String> parts = new ArrayList<>();
        for (String field : CRON_FIELDS) {
            JsonNode value = trigger.get(field);
            if (value != null && !value.isNull()) {
                parts.add(value.asText());
            }
        }
        return parts.size() == CRON_FIELDS.size() ? "cron:" + String.join(" ", parts) : UNKNOWN_VALUE;
    }

    /**
     * Uses the largest unit that fits, dropping any remainder.
     */
    static String intervalValue(long seconds) {
        if (seconds <= 0) return UNKNOWN_VALUE;
        if (seconds < 60) return "every " + seconds + "s";
        if (seconds < 3600) return "every " + (seconds / 60) + "m";
        if (seconds < 86400) return "every " + (seconds / 3600) + "h";
        return "every " + (seconds / 86400) + "d";
    }
}
