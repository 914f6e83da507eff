package com.example.jobqueue.store;

import com.example.jobqueue.backend.BackendType;
import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local store for tests and single-JVM use. Every method holds the store
 * monitor, which makes lease and cancel atomic. Nothing survives a restart.
 */
@Slf4j
public class MemoryJobStore implements JobStore {

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, Schedule> schedules = new LinkedHashMap<>();
    private long sequence;

    @Override
    public BackendType getType() {
        return BackendType.MEMORY;
    }

    @Override
    public BackendCapabilities capabilities() {
        return BackendCapabilities.full();
    }

    @Override
    public synchronized Job enqueue(Job job) {
        var stored = job.copy();
        stored.setSequence(++sequence);
        jobs.put(stored.getId(), stored);
        return stored.copy();
    }

    @Override
    public synchronized void update(Job job) {
        jobs.put(job.getId(), job.copy());
    }

    @Override
    public synchronized boolean finish(Job job) {
        var current = jobs.get(job.getId());
        if (current == null || current.getStatus() != JobStatus.RUNNING) {
            return false;
        }
        jobs.put(job.getId(), job.copy());
        return true;
    }

    @Override
    public synchronized Optional<Job> findJob(String id) {
        return Optional.ofNullable(jobs.get(id)).map(Job::copy);
    }

    @Override
    public synchronized List<Job> findJobs(String queue) {
        return jobs.values().stream()
                .filter(job -> queue == null || queue.equals(job.getQueue()))
                .sorted(Comparator.comparingLong(Job::getSequence))
                .map(Job::copy)
                .toList();
    }

    @Override
    public synchronized List<String> jobIds() {
        return new ArrayList<>(jobs.keySet());
    }

    @Override
    public synchronized Optional<Job> lease(Collection<String> queues, String workerId, Instant now, Instant leaseUntil) {
        var next = jobs.values().stream()
                .filter(job -> job.getStatus() == JobStatus.PENDING)
                .filter(job -> queues.contains(job.getQueue()))
                .filter(job -> job.isDue(now))
                .min(Comparator.comparingLong(Job::getSequence));
        next.ifPresent(job -> job.markRunning(workerId, now, leaseUntil));
        return next.map(Job::copy);
    }

    @Override
    public synchronized Optional<Job> cancelJob(String id, Instant now) {
        var job = jobs.get(id);
        if (job == null || job.getStatus().isTerminal()) {
            return Optional.empty();
        }
        job.markCancelled(now);
        return Optional.of(job.copy());
    }

    @Override
    public synchronized boolean deleteJob(String id) {
        return jobs.remove(id) != null;
    }

    @Override
    public synchronized int purgeExpiredResults(Instant now) {
        var expired = jobs.values().stream()
                .filter(job -> job.getStatus().isTerminal() && job.isExpired(now))
                .map(Job::getId)
                .toList();
        expired.forEach(jobs::remove);
        return expired.size();
    }

    @Override
    public synchronized List<Job> findExpiredLeases(Instant now) {
        return jobs.values().stream()
                .filter(job -> job.isLeaseExpired(now))
                .map(Job::copy)
                .toList();
    }

    @Override
    public synchronized boolean renewLease(String id, String workerId, Instant leaseUntil) {
        var job = jobs.get(id);
        if (job == null || job.getStatus() != JobStatus.RUNNING || !workerId.equals(job.getWorkerId())) {
            return false;
        }
        job.setLeasedUntil(leaseUntil);
        return true;
    }

    @Override
    public synchronized boolean replaceSchedule(Schedule expected, Schedule updated) {
        var current = schedules.get(expected.getId());
        if (current == null || !current.hasSameStateAs(expected)) {
            return false;
        }
        schedules.put(updated.getId(), updated.copy());
        return true;
    }

    @Override
    public synchronized void saveSchedule(Schedule schedule) {
        schedules.put(schedule.getId(), schedule.copy());
    }

    @Override
    public synchronized Optional<Schedule> findSchedule(String id) {
        return Optional.ofNullable(schedules.get(id)).map(Schedule::copy);
    }

    @Override
    public synchronized List<Schedule> findSchedules() {
        return schedules.values().stream().map(Schedule::copy).toList();
    }

    @Override
    public synchronized List<String> scheduleIds() {
        return new ArrayList<>(schedules.keySet());
    }

    @Override
    public synchronized boolean deleteSchedule(String id) {
        return schedules.remove(id) != null;
    }

    @Override
    public synchronized List<Schedule> findDueSchedules(Instant now) {
        return schedules.values().stream()
                .filter(schedule -> schedule.isDue(now))
                .map(Schedule::copy)
                .toList();
    }
}
