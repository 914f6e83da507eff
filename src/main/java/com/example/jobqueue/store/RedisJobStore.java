package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.backend.BrokerConnection;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.exception.BackendOperationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisListCommands.Direction;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Redis store following the broker model.
 * <p>
 * Keys:
 * <ul>
 *     <li>{@code jobqueue:job:{id}} job JSON, given a TTL once a result with retention is recorded</li>
 *     <li>{@code jobqueue:queue:{name}} list of ready job ids, FIFO</li>
 *     <li>{@code jobqueue:delayed:{name}} sorted set of future job ids scored by due time</li>
 *     <li>{@code jobqueue:processing} list of ids taken off a queue whose lease is not settled yet</li>
 *     <li>{@code jobqueue:running} sorted set of leased job ids scored by lease end</li>
 *     <li>{@code jobqueue:jobs} sorted set of all job ids scored by submission sequence</li>
 *     <li>{@code jobqueue:schedules} hash of schedule id to schedule JSON</li>
 * </ul>
 * Leasing promotes due delayed ids into the ready list ({@code ZREM} decides the single
 * winner), then moves the head id into the processing list with {@code LMOVE} so a
 * worker dying before the lease is written cannot lose it. Read-modify-write updates
 * use WATCH/MULTI.
 */
@Slf4j
public class RedisJobStore implements JobStore {

    static final String PREFIX = "jobqueue:";
    static final String JOB_INDEX = PREFIX + "jobs";
    static final String RUNNING = PREFIX + "running";
    static final String PROCESSING = PREFIX + "processing";
    static final String SCHEDULES = PREFIX + "schedules";
    static final String SEQUENCE = PREFIX + "seq";

    private static final int MAX_CAS_ATTEMPTS = 10;

    private final StringRedisTemplate redis;
    private final JsonCodec codec;

    public RedisJobStore(BrokerConnection connection, JsonCodec codec) {
        this(connection.getRedisTemplate(), codec);
    }

    RedisJobStore(StringRedisTemplate redis, JsonCodec codec) {
        this.redis = redis;
        this.codec = codec;
    }

    @Override
    public BackendType getType() {
        return BackendType.REDIS;
    }

    @Override
    public BackendCapabilities capabilities() {
        return BackendCapabilities.builder().nativeResultExpiry(true).build();
    }

    @Override
    public Job enqueue(Job job) {
        return execute("enqueue", () -> {
            var stored = job.copy();
            var seq = redis.opsForValue().increment(SEQUENCE);
            stored.setSequence(seq != null ? seq : 0L);
            redis.opsForValue().set(jobKey(stored.getId()), codec.write(stored));
            redis.opsForZSet().add(JOB_INDEX, stored.getId(), stored.getSequence());
            if (stored.getScheduledFor() == null) {
                redis.opsForList().rightPush(queueKey(stored.getQueue()), stored.getId());
            } else {
                redis.opsForZSet().add(delayedKey(stored.getQueue()), stored.getId(), stored.getScheduledFor().toEpochMilli());
            }
            return stored;
        });
    }

    @Override
    public void update(Job job) {
        execute("update", () -> {
            write(job);
            return null;
        });
    }

    @Override
    public boolean finish(Job job) {
        return execute("finish", () -> compareAndSet(job.getId(), current ->
                current.getStatus() == JobStatus.RUNNING ? Optional.of(job) : Optional.empty()).isPresent());
    }

    @Override
    public Optional<Job> findJob(String id) {
        return execute("findJob", () -> Optional.ofNullable(redis.opsForValue().get(jobKey(id))).map(this::readJob));
    }

    @Override
    public List<Job> findJobs(String queue) {
        return execute("findJobs", () -> jobIds().stream()
                .map(id -> redis.opsForValue().get(jobKey(id)))
                .filter(Objects::nonNull)
                .map(this::readJob)
                .filter(job -> queue == null || queue.equals(job.getQueue()))
                .toList());
    }

    @Override
    public List<String> jobIds() {
        return execute("jobIds", () -> {
            var ids = redis.opsForZSet().range(JOB_INDEX, 0, -1);
            return ids == null ? List.<String>of() : List.copyOf(ids);
        });
    }

    @Override
    public Optional<Job> lease(Collection<String> queues, String workerId, Instant now, Instant leaseUntil) {
        return execute("lease", () -> {
            for (var queue : queues) {
                promoteDelayed(queue, now);
                String id;
                while ((id = redis.opsForList().move(queueKey(queue), Direction.LEFT, PROCESSING, Direction.RIGHT)) != null) {
                    // Left in the processing list if this fails, maintenance puts it back
                    var leased = compareAndSet(id, current -> {
                        if (current.getStatus() != JobStatus.PENDING) {
                            return Optional.empty();
                        }
                        current.markRunning(workerId, now, leaseUntil);
                        return Optional.of(current);
                    });
                    redis.opsForList().remove(PROCESSING, 1, id);
                    if (leased.isPresent()) {
                        redis.opsForZSet().add(RUNNING, id, leaseUntil.toEpochMilli());
                        return leased;
                    }
                    log.debug("Skipping job {} popped from {}: no longer pending", id, queue);
                }
            }
            return Optional.<Job>empty();
        });
    }

    @Override
    public Optional<Job> cancelJob(String id, Instant now) {
        return execute("cancelJob", () -> {
            var cancelled = compareAndSet(id, current -> {
                if (current.getStatus().isTerminal()) {
                    return Optional.empty();
                }
                current.markCancelled(now);
                return Optional.of(current);
            });
            cancelled.ifPresent(job -> {
                redis.opsForList().remove(queueKey(job.getQueue()), 0, id);
                redis.opsForZSet().remove(delayedKey(job.getQueue()), id);
                redis.opsForZSet().remove(RUNNING, id);
            });
            return cancelled;
        });
    }

    @Override
    public boolean deleteJob(String id) {
        return execute("deleteJob", () -> {
            var existing = findJob(id);
            existing.ifPresent(job -> {
                redis.opsForList().remove(queueKey(job.getQueue()), 0, id);
                redis.opsForZSet().remove(delayedKey(job.getQueue()), id);
            });
            redis.opsForZSet().remove(RUNNING, id);
            var removedFromIndex = redis.opsForZSet().remove(JOB_INDEX, id);
            var deleted = Boolean.TRUE.equals(redis.delete(jobKey(id)));
            return deleted || (removedFromIndex != null && removedFromIndex > 0);
        });
    }

    @Override
    public int purgeExpiredResults(Instant now) {
        // Key TTLs remove the records; drop index entries that point at nothing
        return execute("purgeExpiredResults", () -> {
            var removed = 0;
            for (var id : jobIds()) {
                if (!Boolean.TRUE.equals(redis.hasKey(jobKey(id)))) {
                    redis.opsForZSet().remove(JOB_INDEX, id);
                    removed++;
                }
            }
            return removed;
        });
    }

    @Override
    public List<Job> findExpiredLeases(Instant now) {
        return execute("findExpiredLeases", () -> {
            var ids = redis.opsForZSet().rangeByScore(RUNNING, 0, now.toEpochMilli() - 1);
            if (ids == null) {
                return List.<Job>of();
            }
            return ids.stream()
                    .map(this::findJob)
                    .flatMap(Optional::stream)
                    .filter(job -> job.isLeaseExpired(now))
                    .toList();
        });
    }

    @Override
    public int recoverStrandedJobs() {
        return execute("recoverStrandedJobs", () -> {
            var ids = redis.opsForList().range(PROCESSING, 0, -1);
            if (ids == null) {
                return 0;
            }
            var restored = 0;
            for (var id : ids) {
                var job = findJob(id);
                // A worker still between LMOVE and its lease write only sees a duplicate id it skips
                if (job.isPresent() && job.get().getStatus() == JobStatus.PENDING) {
                    redis.opsForList().leftPush(queueKey(job.get().getQueue()), id);
                    restored++;
                }
                redis.opsForList().remove(PROCESSING, 1, id);
            }
            return restored;
        });
    }

    @Override
    public boolean renewLease(String id, String workerId, Instant leaseUntil) {
        return execute("renewLease", () -> {
            var renewed = compareAndSet(id, current -> {
                if (current.getStatus() != JobStatus.RUNNING || !workerId.equals(current.getWorkerId())) {
                    return Optional.empty();
                }
                current.setLeasedUntil(leaseUntil);
                return Optional.of(current);
            });
            renewed.ifPresent(job -> redis.opsForZSet().add(RUNNING, id, leaseUntil.toEpochMilli()));
            return renewed.isPresent();
        });
    }

    @Override
    public boolean replaceSchedule(Schedule expected, Schedule updated) {
        return execute("replaceSchedule", () -> {
            for (var attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
                var outcome = redis.execute(new SessionCallback<Boolean>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> Boolean execute(RedisOperations<K, V> operations) throws DataAccessException {
                        var ops = (RedisOperations<String, String>) operations;
                        ops.watch(SCHEDULES);
                        var json = ops.<String, String>opsForHash().get(SCHEDULES, expected.getId());
                        if (json == null || !codec.read(json, Schedule.class).hasSameStateAs(expected)) {
                            ops.unwatch();
                            return false;
                        }
                        ops.multi();
                        ops.opsForHash().put(SCHEDULES, updated.getId(), codec.write(updated));
                        var results = ops.exec();
                        return results == null || results.isEmpty() ? null : true;
                    }
                });
                if (outcome != null) {
                    return outcome;
                }
                log.debug("Concurrent update of schedules, retrying ({}/{})", attempt + 1, MAX_CAS_ATTEMPTS);
            }
            throw new BackendOperationException("replace schedule " + expected.getId(), "too much contention on " + SCHEDULES);
        });
    }

    @Override
    public void saveSchedule(Schedule schedule) {
        execute("saveSchedule", () -> {
            redis.opsForHash().put(SCHEDULES, schedule.getId(), codec.write(schedule));
            return null;
        });
    }

    @Override
    public Optional<Schedule> findSchedule(String id) {
        return execute("findSchedule", () -> Optional.ofNullable(redis.<String, String>opsForHash().get(SCHEDULES, id))
                .map(json -> codec.read(json, Schedule.class)));
    }

    @Override
    public List<Schedule> findSchedules() {
        return execute("findSchedules", () -> redis.<String, String>opsForHash().values(SCHEDULES).stream()
                .map(json -> codec.read(json, Schedule.class))
                .sorted((a, b) -> a.getId().compareTo(b.getId()))
                .toList());
    }

    @Override
    public List<String> scheduleIds() {
        return execute("scheduleIds", () -> redis.<String, String>opsForHash().keys(SCHEDULES).stream().sorted().toList());
    }

    @Override
    public boolean deleteSchedule(String id) {
        return execute("deleteSchedule", () -> {
            var removed = redis.opsForHash().delete(SCHEDULES, id);
            return removed != null && removed > 0;
        });
    }

    @Override
    public List<Schedule> findDueSchedules(Instant now) {
        return execute("findDueSchedules", () -> findSchedules().stream().filter(s -> s.isDue(now)).toList());
    }

    private void promoteDelayed(String queue, Instant now) {
        var due = redis.opsForZSet().rangeByScore(delayedKey(queue), 0, now.toEpochMilli());
        if (due == null) {
            return;
        }
        for (var id : due) {
            var removed = redis.opsForZSet().remove(delayedKey(queue), id);
            if (removed != null && removed > 0) {
                redis.opsForList().rightPush(queueKey(queue), id);
            }
        }
    }

    private void write(Job job) {
        var key = jobKey(job.getId());
        var json = codec.write(job);
        var ttl = ttlOf(job);
        if (ttl != null) {
            redis.opsForValue().set(key, json, ttl);
        } else {
            redis.opsForValue().set(key, json);
        }
        if (job.getStatus().isTerminal()) {
            redis.opsForZSet().remove(RUNNING, job.getId());
        }
    }

    /**
     * Apply {@code mutation} to the stored job under WATCH and write the result in a
     * MULTI block, retrying when another client changed the key in between.
     */
    private Optional<Job> compareAndSet(String id, Function<Job, Optional<Job>> mutation) {
        var key = jobKey(id);
        for (var attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            var outcome = redis.execute(new SessionCallback<CasOutcome>() {
                @Override
                @SuppressWarnings("unchecked")
                public <K, V> CasOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
                    var ops = (RedisOperations<String, String>) operations;
                    ops.watch(key);
                    var json = ops.opsForValue().get(key);
                    if (json == null) {
                        ops.unwatch();
                        return CasOutcome.NOT_APPLIED;
                    }
                    var next = mutation.apply(readJob(json));
                    if (next.isEmpty()) {
                        ops.unwatch();
                        return CasOutcome.NOT_APPLIED;
                    }
                    var job = next.get();
                    var ttl = ttlOf(job);
                    ops.multi();
                    if (ttl != null) {
                        ops.opsForValue().set(key, codec.write(job), ttl);
                    } else {
                        ops.opsForValue().set(key, codec.write(job));
                    }
                    var results = ops.exec();
                    return results == null || results.isEmpty() ? CasOutcome.CONFLICT : new CasOutcome(job);
                }
            });
            if (outcome == null || outcome == CasOutcome.NOT_APPLIED) {
                return Optional.empty();
            }
            if (outcome != CasOutcome.CONFLICT) {
                if (outcome.job().getStatus().isTerminal()) {
                    redis.opsForZSet().remove(RUNNING, id);
                }
                return Optional.of(outcome.job());
            }
            log.debug("Concurrent update of job {}, retrying ({}/{})", id, attempt + 1, MAX_CAS_ATTEMPTS);
        }
        throw new BackendOperationException("update job " + id, "too much contention on " + key);
    }

    private Duration ttlOf(Job job) {
        if (job.getStatus() == JobStatus.SUCCEEDED && job.getResultTtl() != null) {
            return job.getResultTtl().isZero() || job.getResultTtl().isNegative() ? Duration.ofMillis(1) : job.getResultTtl();
        }
        return null;
    }

    private Job readJob(String json) {
        return codec.read(json, Job.class);
    }

    private static String jobKey(String id) {
        return PREFIX + "job:" + id;
    }

    private static String queueKey(String queue) {
        return PREFIX + "queue:" + queue;
    }

    private static String delayedKey(String queue) {
        return PREFIX + "delayed:" + queue;
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException e) {
            throw new BackendOperationException(operation, e);
        }
    }

    private static final class CasOutcome {

        static final CasOutcome NOT_APPLIED = new CasOutcome(null);
        static final CasOutcome CONFLICT = new CasOutcome(null);

        private final Job job;

        CasOutcome(Job job) {
            this.job = job;
        }

        Job job() {
            return job;
        }
    }
}
