package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.backend.DocumentConnection;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.exception.BackendOperationException;
import com.mongodb.MongoException;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * MongoDB store. Documents carry the full record as a JSON payload plus the fields
 * queries filter on. Leasing and cancelling use {@code findAndModify} so only one
 * caller wins; finished results expire through a TTL index on {@code expiresAt}.
 */
@Slf4j
public class MongoJobStore implements JobStore {

    static final String JOBS = "jq_jobs";
    static final String SCHEDULES = "jq_schedules";
    static final String COUNTERS = "jq_counters";

    private final MongoTemplate mongo;
    private final JsonCodec codec;

    public MongoJobStore(DocumentConnection connection, JsonCodec codec) {
        this(connection.getMongoTemplate(), codec);
    }

    MongoJobStore(MongoTemplate mongo, JsonCodec codec) {
        this.mongo = mongo;
        this.codec = codec;
    }

    @Override
    public BackendType getType() {
        return BackendType.MONGODB;
    }

    @Override
    public BackendCapabilities capabilities() {
        return BackendCapabilities.builder().nativeResultExpiry(true).build();
    }

    @Override
    public void initialize() {
        execute("initialize", () -> {
            var jobIndexes = mongo.indexOps(JOBS);
            jobIndexes.ensureIndex(new Index().on("status", Sort.Direction.ASC).on("queue", Sort.Direction.ASC)
                    .on("seq", Sort.Direction.ASC).named("lease_order"));
            jobIndexes.ensureIndex(new Index().on("expiresAt", Sort.Direction.ASC).expire(0).named("result_ttl"));
            mongo.indexOps(SCHEDULES).ensureIndex(new Index().on("status", Sort.Direction.ASC)
                    .on("nextFireTime", Sort.Direction.ASC).named("due_schedules"));
            log.info("Job queue collections ready in database {}", mongo.getDb().getName());
            return null;
        });
    }

    @Override
    public Job enqueue(Job job) {
        return execute("enqueue", () -> {
            var stored = job.copy();
            stored.setSequence(nextSequence());
            mongo.insert(toDocument(stored), JOBS);
            return stored;
        });
    }

    @Override
    public void update(Job job) {
        execute("update", () -> mongo.getCollection(JOBS).replaceOne(new Document("_id", job.getId()), toDocument(job)));
    }

    @Override
    public boolean finish(Job job) {
        return execute("finish", () -> mongo.getCollection(JOBS)
                .replaceOne(new Document("_id", job.getId()).append("status", JobStatus.RUNNING.name()), toDocument(job))
                .getMatchedCount() == 1);
    }

    @Override
    public Optional<Job> findJob(String id) {
        return execute("findJob", () -> Optional.ofNullable(mongo.findById(id, Document.class, JOBS)).map(this::toJob));
    }

    @Override
    public List<Job> findJobs(String queue) {
        var query = queue == null ? new Query() : Query.query(Criteria.where("queue").is(queue));
        query.with(Sort.by("seq"));
        return execute("findJobs", () -> mongo.find(query, Document.class, JOBS).stream().map(this::toJob).toList());
    }

    @Override
    public List<String> jobIds() {
        var query = new Query().with(Sort.by("seq"));
        query.fields().include("_id");
        return execute("jobIds", () -> mongo.find(query, Document.class, JOBS).stream().map(d -> d.getString("_id")).toList());
    }

    @Override
    public Optional<Job> lease(Collection<String> queues, String workerId, Instant now, Instant leaseUntil) {
        var query = Query.query(Criteria.where("status").is(JobStatus.PENDING.name())
                        .and("queue").in(queues)
                        .orOperator(Criteria.where("scheduledFor").is(null), Criteria.where("scheduledFor").lte(Date.from(now))))
                .with(Sort.by("seq"));
        var update = Update.update("status", JobStatus.RUNNING.name())
                .set("workerId", workerId)
                .set("leasedUntil", Date.from(leaseUntil));

        return execute("lease", () -> {
            var claimed = mongo.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), Document.class, JOBS);
            if (claimed == null) {
                return Optional.<Job>empty();
            }
            var job = toJob(claimed);
            job.markRunning(workerId, now, leaseUntil);
            // No match when a cancel landed between the claim and this write
            var written = mongo.getCollection(JOBS).replaceOne(leaseFilter(job.getId(), workerId, leaseUntil), toDocument(job));
            if (written.getMatchedCount() == 0) {
                log.debug("Job {} changed right after worker {} claimed it, dropping the lease", job.getId(), workerId);
                return Optional.<Job>empty();
            }
            return Optional.of(job);
        });
    }

    @Override
    public Optional<Job> cancelJob(String id, Instant now) {
        var query = Query.query(Criteria.where("_id").is(id)
                .and("status").in(JobStatus.PENDING.name(), JobStatus.RUNNING.name()));
        var update = Update.update("status", JobStatus.CANCELLED.name()).unset("leasedUntil");

        return execute("cancelJob", () -> {
            var cancelled = mongo.findAndModify(query, update, FindAndModifyOptions.options().returnNew(true), Document.class, JOBS);
            if (cancelled == null) {
                return Optional.<Job>empty();
            }
            var job = toJob(cancelled);
            job.markCancelled(now);
            var filter = new Document("_id", id).append("status", JobStatus.CANCELLED.name());
            if (mongo.getCollection(JOBS).replaceOne(filter, toDocument(job)).getMatchedCount() == 0) {
                log.debug("Job {} was removed or requeued while being cancelled", id);
                return Optional.<Job>empty();
            }
            return Optional.of(job);
        });
    }

    @Override
    public boolean renewLease(String id, String workerId, Instant leaseUntil) {
        return execute("renewLease", () -> {
            var document = mongo.findById(id, Document.class, JOBS);
            if (document == null) {
                return false;
            }
            var job = toJob(document);
            if (job.getStatus() != JobStatus.RUNNING || !workerId.equals(job.getWorkerId())) {
                return false;
            }
            var previous = job.getLeasedUntil();
            job.setLeasedUntil(leaseUntil);
            return mongo.getCollection(JOBS).replaceOne(leaseFilter(id, workerId, previous), toDocument(job))
                    .getMatchedCount() == 1;
        });
    }

    @Override
    public boolean deleteJob(String id) {
        return execute("deleteJob", () -> mongo.getCollection(JOBS).deleteOne(new Document("_id", id)).getDeletedCount() > 0);
    }

    @Override
    public int purgeExpiredResults(Instant now) {
        // The TTL index removes these in the background; this catches up between its runs
        var query = Query.query(Criteria.where("expiresAt").lte(Date.from(now))
                .and("status").in(JobStatus.SUCCEEDED.name(), JobStatus.FAILED.name(), JobStatus.CANCELLED.name()));
        return execute("purgeExpiredResults", () -> (int) mongo.remove(query, JOBS).getDeletedCount());
    }

    @Override
    public List<Job> findExpiredLeases(Instant now) {
        var query = Query.query(Criteria.where("status").is(JobStatus.RUNNING.name()).and("leasedUntil").lt(Date.from(now)))
                .with(Sort.by("seq"));
        return execute("findExpiredLeases", () -> mongo.find(query, Document.class, JOBS).stream().map(this::toJob).toList());
    }

    @Override
    public void saveSchedule(Schedule schedule) {
        execute("saveSchedule", () -> mongo.save(toDocument(schedule), SCHEDULES));
    }

    @Override
    public boolean replaceSchedule(Schedule expected, Schedule updated) {
        var filter = new Document("_id", expected.getId())
                .append("status", expected.getStatus().name())
                .append("paused", expected.isPaused())
                .append("nextFireTime", date(expected.getNextFireTime()))
                .append("updatedAt", date(expected.getUpdatedAt()));
        return execute("replaceSchedule", () -> mongo.getCollection(SCHEDULES).replaceOne(filter, toDocument(updated))
                .getMatchedCount() == 1);
    }

    @Override
    public Optional<Schedule> findSchedule(String id) {
        return execute("findSchedule", () -> Optional.ofNullable(mongo.findById(id, Document.class, SCHEDULES)).map(this::toSchedule));
    }

    @Override
    public List<Schedule> findSchedules() {
        return execute("findSchedules", () -> mongo.find(new Query().with(Sort.by("_id")), Document.class, SCHEDULES)
                .stream().map(this::toSchedule).toList());
    }

    @Override
    public List<String> scheduleIds() {
        var query = new Query().with(Sort.by("_id"));
        query.fields().include("_id");
        return execute("scheduleIds", () -> mongo.find(query, Document.class, SCHEDULES).stream().map(d -> d.getString("_id")).toList());
    }

    @Override
    public boolean deleteSchedule(String id) {
        return execute("deleteSchedule", () -> mongo.getCollection(SCHEDULES).deleteOne(new Document("_id", id)).getDeletedCount() > 0);
    }

    @Override
    public List<Schedule> findDueSchedules(Instant now) {
        var query = Query.query(Criteria.where("status").is(ScheduleStatus.ACTIVE.name())
                        .and("paused").is(false)
                        .and("nextFireTime").lte(Date.from(now)))
                .with(Sort.by("nextFireTime"));
        return execute("findDueSchedules", () -> mongo.find(query, Document.class, SCHEDULES).stream().map(this::toSchedule).toList());
    }

    private long nextSequence() {
        var counter = mongo.findAndModify(Query.query(Criteria.where("_id").is(JOBS)), new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true), Document.class, COUNTERS);
        if (counter == null) {
            throw new BackendOperationException("nextSequence", "counter document missing after upsert");
        }
        return ((Number) counter.get("seq")).longValue();
    }

    private Document toDocument(Job job) {
        return new Document("_id", job.getId())
                .append("seq", job.getSequence())
                .append("queue", job.getQueue())
                .append("status", job.getStatus().name())
                .append("scheduledFor", date(job.getScheduledFor()))
                .append("workerId", job.getWorkerId())
                .append("leasedUntil", date(job.getLeasedUntil()))
                .append("expiresAt", date(job.getExpiresAt()))
                .append("payload", codec.write(job));
    }

    private Document toDocument(Schedule schedule) {
        return new Document("_id", schedule.getId())
                .append("status", schedule.getStatus().name())
                .append("paused", schedule.isPaused())
                .append("nextFireTime", date(schedule.getNextFireTime()))
                .append("updatedAt", date(schedule.getUpdatedAt()))
                .append("payload", codec.write(schedule));
    }

    /**
     * Matches the job only while it is still RUNNING under the given lease.
     */
    private static Document leaseFilter(String id, String workerId, Instant leasedUntil) {
        return new Document("_id", id)
                .append("status", JobStatus.RUNNING.name())
                .append("workerId", workerId)
                .append("leasedUntil", date(leasedUntil));
    }

    private Job toJob(Document document) {
        var job = codec.read(document.getString("payload"), Job.class);
        job.setSequence(((Number) document.get("seq")).longValue());
        return job;
    }

    private Schedule toSchedule(Document document) {
        return codec.read(document.getString("payload"), Schedule.class);
    }

    private static Date date(Instant instant) {
        return instant == null ? null : Date.from(instant);
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessException | MongoException e) {
            throw new BackendOperationException(operation, e);
        }
    }
}
