package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.backend.RelationalConnection;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.exception.BackendOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL / MySQL store.
 * <p>
 * Each record is kept as a JSON payload next to the columns the queries filter on.
 * Leasing selects the oldest due row with {@code FOR UPDATE SKIP LOCKED} and flips it
 * to RUNNING in the same transaction, so concurrent workers never lease the same job.
 */
@Slf4j
public class JdbcJobStore implements JobStore {

    private final RelationalConnection connection;
    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final JsonCodec codec;
    private final String jobsTable;
    private final String schedulesTable;

    public JdbcJobStore(RelationalConnection connection, JsonCodec codec) {
        this.connection = connection;
        this.jdbc = connection.getJdbcTemplate();
        this.tx = connection.getTransactionTemplate();
        this.codec = codec;
        this.jobsTable = connection.qualify("jq_jobs");
        this.schedulesTable = connection.qualify("jq_schedules");
    }

    @Override
    public BackendType getType() {
        return connection.getType();
    }

    @Override
    public BackendCapabilities capabilities() {
        return BackendCapabilities.full();
    }

    @Override
    public void initialize() {
        execute("initialize", () -> {
            var postgres = connection.getType() == BackendType.POSTGRESQL;
            var timestamp = postgres ? "TIMESTAMPTZ" : "DATETIME(6)";
            var text = postgres ? "TEXT" : "LONGTEXT";
            var sequence = postgres ? "BIGSERIAL" : "BIGINT NOT NULL AUTO_INCREMENT UNIQUE";

            jdbc.execute("CREATE TABLE IF NOT EXISTS " + jobsTable + " ("
                    + "id VARCHAR(128) NOT NULL PRIMARY KEY, "
                    + "seq " + sequence + ", "
                    + "queue_name VARCHAR(128) NOT NULL, "
                    + "status VARCHAR(16) NOT NULL, "
                    + "scheduled_for " + timestamp + " NULL, "
                    + "leased_until " + timestamp + " NULL, "
                    + "expires_at " + timestamp + " NULL, "
                    + "payload " + text + " NOT NULL)");
            jdbc.execute("CREATE TABLE IF NOT EXISTS " + schedulesTable + " ("
                    + "id VARCHAR(255) NOT NULL PRIMARY KEY, "
                    + "status VARCHAR(16) NOT NULL, "
                    + "paused BOOLEAN NOT NULL, "
                    + "next_fire_time " + timestamp + " NULL, "
                    + "payload " + text + " NOT NULL)");
            jdbc.execute("CREATE TABLE IF NOT EXISTS " + connection.qualify("shedlock") + " ("
                    + "name VARCHAR(64) NOT NULL PRIMARY KEY, "
                    + "lock_until " + (postgres ? "TIMESTAMP" : "TIMESTAMP(3)") + " NOT NULL, "
                    + "locked_at " + (postgres ? "TIMESTAMP" : "TIMESTAMP(3)") + " NOT NULL, "
                    + "locked_by VARCHAR(255) NOT NULL)");
            log.info("Job queue tables ready in {}", connection.getJdbcUrl());
            return null;
        });
    }

    @Override
    public Job enqueue(Job job) {
        return execute("enqueue", () -> {
            jdbc.update("INSERT INTO " + jobsTable + " (id, queue_name, status, scheduled_for, leased_until, expires_at, payload) "
                            + "VALUES (?, ?, ?, ?, ?, ?, ?)",
                    job.getId(), job.getQueue(), job.getStatus().name(), ts(job.getScheduledFor()),
                    ts(job.getLeasedUntil()), ts(job.getExpiresAt()), codec.write(job));
            var seq = jdbc.queryForObject("SELECT seq FROM " + jobsTable + " WHERE id = ?", Long.class, job.getId());
            var stored = job.copy();
            stored.setSequence(seq != null ? seq : 0L);
            return stored;
        });
    }

    @Override
    public void update(Job job) {
        execute("update", () -> jdbc.update("UPDATE " + jobsTable
                        + " SET queue_name = ?, status = ?, scheduled_for = ?, leased_until = ?, expires_at = ?, payload = ? WHERE id = ?",
                job.getQueue(), job.getStatus().name(), ts(job.getScheduledFor()), ts(job.getLeasedUntil()),
                ts(job.getExpiresAt()), codec.write(job), job.getId()));
    }

    @Override
    public boolean finish(Job job) {
        return execute("finish", () -> jdbc.update("UPDATE " + jobsTable
                        + " SET status = ?, leased_until = ?, expires_at = ?, payload = ? WHERE id = ? AND status = ?",
                job.getStatus().name(), ts(job.getLeasedUntil()), ts(job.getExpiresAt()), codec.write(job),
                job.getId(), JobStatus.RUNNING.name()) == 1);
    }

    @Override
    public Optional<Job> findJob(String id) {
        return execute("findJob", () -> jdbc.query("SELECT seq, payload FROM " + jobsTable + " WHERE id = ?",
                (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), id).stream().findFirst());
    }

    @Override
    public List<Job> findJobs(String queue) {
        return execute("findJobs", () -> queue == null
                ? jdbc.query("SELECT seq, payload FROM " + jobsTable + " ORDER BY seq",
                (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")))
                : jdbc.query("SELECT seq, payload FROM " + jobsTable + " WHERE queue_name = ? ORDER BY seq",
                (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), queue));
    }

    @Override
    public List<String> jobIds() {
        return execute("jobIds", () -> jdbc.queryForList("SELECT id FROM " + jobsTable + " ORDER BY seq", String.class));
    }

    @Override
    public Optional<Job> lease(Collection<String> queues, String workerId, Instant now, Instant leaseUntil) {
        if (queues.isEmpty()) {
            return Optional.empty();
        }
        var placeholders = String.join(", ", Collections.nCopies(queues.size(), "?"));
        var select = "SELECT seq, payload FROM " + jobsTable
                + " WHERE status = ? AND queue_name IN (" + placeholders + ")"
                + " AND (scheduled_for IS NULL OR scheduled_for <= ?)"
                + " ORDER BY seq LIMIT 1 FOR UPDATE SKIP LOCKED";

        var params = new Object[queues.size() + 2];
        params[0] = JobStatus.PENDING.name();
        var i = 1;
        for (var queue : queues) {
            params[i++] = queue;
        }
        params[i] = ts(now);

        return execute("lease", () -> tx.execute(status -> {
            var candidates = jdbc.query(select, (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), params);
            if (candidates.isEmpty()) {
                return Optional.<Job>empty();
            }
            var job = candidates.get(0);
            job.markRunning(workerId, now, leaseUntil);
            jdbc.update("UPDATE " + jobsTable + " SET status = ?, leased_until = ?, payload = ? WHERE id = ?",
                    job.getStatus().name(), ts(leaseUntil), codec.write(job), job.getId());
            return Optional.of(job);
        }));
    }

    @Override
    public Optional<Job> cancelJob(String id, Instant now) {
        return execute("cancelJob", () -> tx.execute(status -> {
            var rows = jdbc.query("SELECT seq, payload FROM " + jobsTable + " WHERE id = ? FOR UPDATE",
                    (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), id);
            if (rows.isEmpty() || rows.get(0).getStatus().isTerminal()) {
                return Optional.<Job>empty();
            }
            var job = rows.get(0);
            job.markCancelled(now);
            update(job);
            return Optional.of(job);
        }));
    }

    @Override
    public boolean deleteJob(String id) {
        return execute("deleteJob", () -> jdbc.update("DELETE FROM " + jobsTable + " WHERE id = ?", id) > 0);
    }

    @Override
    public int purgeExpiredResults(Instant now) {
        return execute("purgeExpiredResults", () -> jdbc.update("DELETE FROM " + jobsTable
                        + " WHERE status IN (?, ?, ?) AND expires_at IS NOT NULL AND expires_at <= ?",
                JobStatus.SUCCEEDED.name(), JobStatus.FAILED.name(), JobStatus.CANCELLED.name(), ts(now)));
    }

    @Override
    public List<Job> findExpiredLeases(Instant now) {
        return execute("findExpiredLeases", () -> jdbc.query("SELECT seq, payload FROM " + jobsTable
                        + " WHERE status = ? AND leased_until < ? ORDER BY seq",
                (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), JobStatus.RUNNING.name(), ts(now)));
    }

    @Override
    public boolean renewLease(String id, String workerId, Instant leaseUntil) {
        return execute("renewLease", () -> tx.execute(status -> {
            var rows = jdbc.query("SELECT seq, payload FROM " + jobsTable + " WHERE id = ? FOR UPDATE",
                    (rs, n) -> readJob(rs.getLong("seq"), rs.getString("payload")), id);
            if (rows.isEmpty() || rows.get(0).getStatus() != JobStatus.RUNNING || !workerId.equals(rows.get(0).getWorkerId())) {
                return false;
            }
            var job = rows.get(0);
            job.setLeasedUntil(leaseUntil);
            return jdbc.update("UPDATE " + jobsTable + " SET leased_until = ?, payload = ? WHERE id = ? AND status = ?",
                    ts(leaseUntil), codec.write(job), id, JobStatus.RUNNING.name()) == 1;
        }));
    }

    @Override
    public boolean replaceSchedule(Schedule expected, Schedule updated) {
        return execute("replaceSchedule", () -> tx.execute(status -> {
            var rows = jdbc.query("SELECT payload FROM " + schedulesTable + " WHERE id = ? FOR UPDATE",
                    (rs, n) -> codec.read(rs.getString("payload"), Schedule.class), expected.getId());
            if (rows.isEmpty() || !rows.get(0).hasSameStateAs(expected)) {
                return false;
            }
            return jdbc.update("UPDATE " + schedulesTable + " SET status = ?, paused = ?, next_fire_time = ?, payload = ? WHERE id = ?",
                    updated.getStatus().name(), updated.isPaused(), ts(updated.getNextFireTime()), codec.write(updated),
                    updated.getId()) == 1;
        }));
    }

    @Override
    public void saveSchedule(Schedule schedule) {
        execute("saveSchedule", () -> tx.execute(status -> {
            var updated = jdbc.update("UPDATE " + schedulesTable
                            + " SET status = ?, paused = ?, next_fire_time = ?, payload = ? WHERE id = ?",
                    schedule.getStatus().name(), schedule.isPaused(), ts(schedule.getNextFireTime()),
                    codec.write(schedule), schedule.getId());
            if (updated == 0) {
                jdbc.update("INSERT INTO " + schedulesTable + " (id, status, paused, next_fire_time, payload) VALUES (?, ?, ?, ?, ?)",
                        schedule.getId(), schedule.getStatus().name(), schedule.isPaused(), ts(schedule.getNextFireTime()),
                        codec.write(schedule));
            }
            return null;
        }));
    }

    @Override
    public Optional<Schedule> findSchedule(String id) {
        return execute("findSchedule", () -> jdbc.query("SELECT payload FROM " + schedulesTable + " WHERE id = ?",
                (rs, n) -> codec.read(rs.getString("payload"), Schedule.class), id).stream().findFirst());
    }

    @Override
    public List<Schedule> findSchedules() {
        return execute("findSchedules", () -> jdbc.query("SELECT payload FROM " + schedulesTable + " ORDER BY id",
                (rs, n) -> codec.read(rs.getString("payload"), Schedule.class)));
    }

    @Override
    public List<String> scheduleIds() {
        return execute("scheduleIds", () -> jdbc.queryForList("SELECT id FROM " + schedulesTable + " ORDER BY id", String.class));
    }

    @Override
    public boolean deleteSchedule(String id) {
        return execute("deleteSchedule", () -> jdbc.update("DELETE FROM " + schedulesTable + " WHERE id = ?", id) > 0);
    }

    @Override
    public List<Schedule> findDueSchedules(Instant now) {
        return execute("findDueSchedules", () -> jdbc.query("SELECT payload FROM " + schedulesTable
                        + " WHERE status = ? AND paused = ? AND next_fire_time <= ? ORDER BY next_fire_time",
                (rs, n) -> codec.read(rs.getString("payload"), Schedule.class),
                ScheduleStatus.ACTIVE.name(), false, ts(now)));
    }

    private Job readJob(long seq, String payload) {
        var job = codec.read(payload, Job.class);
        job.setSequence(seq);
        return job;
    }

    private static Timestamp ts(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new BackendOperationException(operation, e);
        }
    }
}
