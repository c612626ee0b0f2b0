package io.taskrunr.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taskrunr.config.SchedulerProperties;
import io.taskrunr.trigger.ScheduleType;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed store for active schedules and task run history.
 *
 * <p>Schema:</p>
 * <ul>
 *   <li>{@code schedules}: one row per task id, upserted on every (re)schedule</li>
 *   <li>{@code task_runs}: append-only run history, indexed by task id and start time</li>
 * </ul>
 *
 * <p>Every operation opens its own connection and commits on its own. Failures are logged
 * and rethrown as {@link PersistenceException}.</p>
 */
@Component
public class ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    /** Fixed-width UTC format so that text comparison in SQL follows time order. */
    static final DateTimeFormatter TIMESTAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'")
            .withZone(ZoneOffset.UTC);

    private final Path databaseFile;
    private final Path legacyFile;
    private final ObjectMapper objectMapper;
    private final DataSource dataSource;

    @Autowired
    public ScheduleStore(SchedulerProperties properties, ObjectMapper objectMapper) {
        this(properties.databaseFile(), properties.legacyFile(), objectMapper);
    }

    public ScheduleStore(Path databaseFile, Path legacyFile, ObjectMapper objectMapper) {
        this.databaseFile = databaseFile;
        this.legacyFile = legacyFile;
        this.objectMapper = objectMapper;

        Path dir = databaseFile.toAbsolutePath().getParent();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            log.error("Failed to create scheduler persistence directory: {}", dir, e);
        }

        var config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setBusyTimeout(5000);
        var ds = new SQLiteDataSource(config);
        ds.setUrl("jdbc:sqlite:" + databaseFile);
        this.dataSource = ds;
    }

    @PostConstruct
    public void init() {
        try (var conn = dataSource.getConnection()) {
            createSchema(conn);
        } catch (SQLException e) {
            log.error("Failed to initialize scheduler database at {}", databaseFile, e);
            throw new PersistenceException("Scheduler store initialization failed", e);
        }
        new LegacyScheduleMigrator(this, objectMapper).migrate(legacyFile);
        log.info("ScheduleStore initialized at: {}", databaseFile);
    }

    private void createSchema(Connection conn) throws SQLException {
        try (var stmt = conn.createStatement()) {
            stmt.execute("""
                CREATE TABLE IF NOT EXISTS schedules (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    task_id TEXT NOT NULL,
                    job_id TEXT NOT NULL,
                    schedule_type TEXT NOT NULL,
                    schedule_value TEXT NOT NULL,
                    created_at TEXT NOT NULL,
                    next_run_time TEXT,
                    UNIQUE(task_id)
                )
                """);

            stmt.execute("""
                CREATE TABLE IF NOT EXISTS task_runs (
                    id INTEGER PRIMARY KEY AUTOINCREMENT,
                    task_id TEXT NOT NULL,
                    status TEXT NOT NULL,
                    start_time TEXT NOT NULL,
                    end_time TEXT,
                    error TEXT
                )
                """);

            stmt.execute("""
                CREATE INDEX IF NOT EXISTS idx_task_runs_task_start ON task_runs(task_id, start_time)
                """);
        }
    }

    /**
     * Inserts or replaces the schedule of a task.
     */
    public void saveSchedule(String taskId, String jobId, ScheduleType type, String value, Instant nextRunTime) {
        String sql = """
            INSERT INTO schedules (task_id, job_id, schedule_type, schedule_value, created_at, next_run_time)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT(task_id) DO UPDATE SET
                job_id = excluded.job_id,
                schedule_type = excluded.schedule_type,
                schedule_value = excluded.schedule_value,
                created_at = excluded.created_at,
                next_run_time = excluded.next_run_time
            """;

        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, taskId);
            stmt.setString(2, jobId);
            stmt.setString(3, type.value());
            stmt.setString(4, value);
            stmt.setString(5, format(Instant.now()));
            setTimestamp(stmt, 6, nextRunTime);
            stmt.executeUpdate();
            log.debug("Saved schedule for task {}", taskId);
        } catch (SQLException e) {
            throw failure("Failed to save schedule for task " + taskId, e);
        }
    }

    /**
     * Updates the stored next run time of a task's schedule. No-op if the task has no schedule.
     */
    public void updateNextRunTime(String taskId, Instant nextRunTime) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("UPDATE schedules SET next_run_time = ? WHERE task_id = ?")) {
            setTimestamp(stmt, 1, nextRunTime);
            stmt.setString(2, taskId);
            stmt.executeUpdate();
        } catch (SQLException e) {
            throw failure("Failed to update next run time for task " + taskId, e);
        }
    }

    /**
     * Deletes the schedule of a task.
     *
     * @return true if a row was removed, false if the task had no schedule
     */
    public boolean deleteSchedule(String taskId) {
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("DELETE FROM schedules WHERE task_id = ?")) {
            stmt.setString(1, taskId);
            int deleted = stmt.executeUpdate();
            log.debug("Deleted schedule for task {} ({} rows)", taskId, deleted);
            return deleted > 0;
        } catch (SQLException e) {
            throw failure("Failed to delete schedule for task " + taskId, e);
        }
    }

    public Optional<Schedule> getSchedule(String taskId) {
        String sql = """
            SELECT task_id, job_id, schedule_type, schedule_value, created_at, next_run_time
            FROM schedules WHERE task_id = ?
            """;
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, taskId);
            try (var rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(toSchedule(rs));
                }
            }
        } catch (SQLException e) {
            throw failure("Failed to get schedule for task " + taskId, e);
        }
        return Optional.empty();
    }

    public List<Schedule> getAllSchedules() {
        List<Schedule> schedules = new ArrayList<>();
        String sql = """
            SELECT task_id, job_id, schedule_type, schedule_value, created_at, next_run_time
            FROM schedules ORDER BY id
            """;
        try (var conn = dataSource.getConnection();
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery(sql)) {
            while (rs.next()) {
                schedules.add(toSchedule(rs));
            }
        } catch (SQLException e) {
            throw failure("Failed to get all schedules", e);
        }
        return schedules;
    }

    /**
     * Appends one run record.
     */
    public void logTaskRun(String taskId, RunStatus status, Instant startTime, Instant endTime, String error) {
        String sql = "INSERT INTO task_runs (task_id, status, start_time, end_time, error) VALUES (?, ?, ?, ?, ?)";
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, taskId);
            stmt.setString(2, status.value());
            stmt.setString(3, format(startTime));
            setTimestamp(stmt, 4, endTime);
            stmt.setString(5, error);
            stmt.executeUpdate();
            log.debug("Logged {} run for task {}", status.value(), taskId);
        } catch (SQLException e) {
            throw failure("Failed to log task run for task " + taskId, e);
        }
    }

    /**
     * Returns the most recent runs of a task, newest first.
     */
    public List<TaskRun> getTaskRuns(String taskId, int limit) {
        List<TaskRun> runs = new ArrayList<>();
        String sql = """
            SELECT id, task_id, status, start_time, end_time, error
            FROM task_runs
            WHERE task_id = ?
            ORDER BY start_time DESC, id DESC
            LIMIT ?
            """;
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, taskId);
            stmt.setInt(2, limit);
            try (var rs = stmt.executeQuery()) {
                while (rs.next()) {
                    runs.add(new TaskRun(
                            rs.getLong("id"),
                            rs.getString("task_id"),
                            RunStatus.fromString(rs.getString("status")),
                            parse(rs.getString("start_time")),
                            parse(rs.getString("end_time")),
                            rs.getString("error")));
                }
            }
        } catch (SQLException e) {
            throw failure("Failed to get task runs for task " + taskId, e);
        }
        return runs;
    }

    /**
     * Deletes run history whose start time is older than the retention window.
     *
     * @return number of rows deleted
     */
    public int cleanupOldRuns(int retentionDays) {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        try (var conn = dataSource.getConnection();
             var stmt = conn.prepareStatement("DELETE FROM task_runs WHERE start_time < ?")) {
            stmt.setString(1, format(cutoff));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("Cleaned up {} task runs older than {} days", deleted, retentionDays);
            }
            return deleted;
        } catch (SQLException e) {
            throw failure("Failed to clean up old task runs", e);
        }
    }

    public int countTaskRuns() {
        try (var conn = dataSource.getConnection();
             var stmt = conn.createStatement();
             var rs = stmt.executeQuery("SELECT COUNT(*) FROM task_runs")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw failure("Failed to count task runs", e);
        }
    }

    /**
     * Inserts schedules whose task id is not stored yet, all in one transaction.
     *
     * @return number of rows inserted
     */
    int insertMissing(List<Schedule> schedules) {
        String exists = "SELECT COUNT(*) FROM schedules WHERE task_id = ?";
        String insert = """
            INSERT INTO schedules (task_id, job_id, schedule_type, schedule_value, created_at, next_run_time)
            VALUES (?, ?, ?, ?, ?, ?)
            """;
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            int inserted = 0;
            try (var check = conn.prepareStatement(exists);
                 var stmt = conn.prepareStatement(insert)) {
                for (Schedule schedule : schedules) {
                    check.setString(1, schedule.taskId());
                    try (var rs = check.executeQuery()) {
                        if (rs.next() && rs.getInt(1) > 0) {
                            log.debug("Schedule for task {} already present, skipping", schedule.taskId());
                            continue;
                        }
                    }
                    stmt.setString(1, schedule.taskId());
                    stmt.setString(2, schedule.jobId());
                    stmt.setString(3, schedule.scheduleType().value());
                    stmt.setString(4, schedule.scheduleValue());
                    stmt.setString(5, format(schedule.createdAt()));
                    setTimestamp(stmt, 6, schedule.nextRunTime());
                    stmt.executeUpdate();
                    inserted++;
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
            return inserted;
        } catch (SQLException e) {
            throw failure("Failed to import schedules", e);
        }
    }

    static String format(Instant instant) {
        return instant == null ? null : TIMESTAMP.format(instant);
    }

    static Instant parse(String text) {
        if (text == null) return null;
        try {
            return Instant.from(TIMESTAMP.parse(text));
        } catch (DateTimeParseException e) {
            return parseLenient(text);
        }
    }

    /**
     * Reads ISO-8601 timestamps written by other tools, with or without an offset.
     * Timestamps without an offset are taken as UTC.
     *
     * @return the instant, or null if the text is not a timestamp
     */
    static Instant parseLenient(String text) {
        String iso = text.trim().replace(' ', 'T');
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(iso, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Unreadable timestamp '{}', treating as absent", text);
            return null;
        }
    }

    private static void setTimestamp(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.VARCHAR);
        } else {
            stmt.setString(index, format(instant));
        }
    }

    private static Schedule toSchedule(ResultSet rs) throws SQLException {
        return new Schedule(
                rs.getString("task_id"),
                rs.getString("job_id"),
                ScheduleType.fromString(rs.getString("schedule_type")),
                rs.getString("schedule_value"),
                parse(rs.getString("created_at")),
                parse(rs.getString("next_run_time")));
    }

    private static PersistenceException failure(String message, SQLException e) {
        log.error(message, e);
        return new PersistenceException(message, e);
    }
}
