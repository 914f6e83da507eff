package com.example.jobqueue.service.schedule;

import com.example.jobqueue.config.MetricsConfig;
import com.example.jobqueue.domain.enums.ConflictPolicy;
import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.exception.DuplicateScheduleException;
import com.example.jobqueue.exception.ScheduleNotFoundException;
import com.example.jobqueue.exception.TriggerConfigurationException;
import com.example.jobqueue.exception.UnsupportedBackendOperationException;
import com.example.jobqueue.service.JobQueueService;
import com.example.jobqueue.service.JobSubmission;
import com.example.jobqueue.service.SettingsResolver;
import com.example.jobqueue.service.function.JobFunctionRegistry;
import com.example.jobqueue.store.JobStore;
import com.example.jobqueue.trigger.TriggerResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Service for registering and managing schedules.
 * <p>
 * Provides operations for:
 * - Adding schedules with generated or explicit ids
 * - Cancelling, deleting, pausing and resuming schedules, one or all
 * - Emitting jobs from a schedule's template
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleService {

    /**
     * Most recent emitted job ids kept on a schedule
     */
    static final int HISTORY_LIMIT = 100;

    private final JobStore jobStore;
    private final JobQueueService jobQueueService;
    private final JobFunctionRegistry functionRegistry;
    private final TriggerResolver triggerResolver;
    private final SettingsResolver settingsResolver;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    // === Registration ===

    /**
     * Register a schedule.
     *
     * @return the id of the new schedule, or of the existing one under DO_NOTHING
     * @throws DuplicateScheduleException    if the id is taken under the EXCEPTION policy
     * @throws TriggerConfigurationException if the trigger is invalid or never fires
     */
    public String addSchedule(ScheduleRequest request) {
        if (request.getTrigger() == null) {
            throw new TriggerConfigurationException("A schedule needs a trigger");
        }
        functionRegistry.getFunctionOrThrow(request.getFunction());
        var trigger = triggerResolver.resolve(request.getTrigger());

        var name = request.getName() != null ? request.getName() : request.getFunction();
        var explicitId = request.getScheduleId() != null;
        var scheduleId = explicitId
                ? request.getScheduleId()
                : ScheduleIdGenerator.generate(name, jobStore.scheduleIds(), request.isOverwrite());
        var policy = request.getConflictPolicy() != null ? request.getConflictPolicy() : ConflictPolicy.DO_NOTHING;

        var existing = jobStore.findSchedule(scheduleId);
        if (existing.isPresent() && !(request.isOverwrite() && !explicitId)) {
            switch (policy) {
                case DO_NOTHING -> {
                    log.info("Schedule {} already exists, keeping it", scheduleId);
                    return scheduleId;
                }
                case EXCEPTION -> throw new DuplicateScheduleException(scheduleId);
                case REPLACE -> log.info("Replacing schedule {}", scheduleId);
            }
        }

        var now = clock.instant();
        var nextFireTime = trigger.firstFireTime(now)
                .orElseThrow(() -> new TriggerConfigurationException("Trigger never fires: " + trigger.describe()));
        if (request.getRepeat() != null && request.getRepeat() < 1) {
            throw new IllegalArgumentException("repeat must be at least 1 but was " + request.getRepeat());
        }
        if (request.getRetry() != null) {
            SettingsResolver.toPolicy(settingsResolver.resolveRetry(request.getRetry(), null));
        }

        var schedule = Schedule.builder()
                .id(scheduleId)
                .name(name)
                .trigger(trigger)
                .function(request.getFunction())
                .args(request.getArgs() != null ? new ArrayList<>(request.getArgs()) : new ArrayList<>())
                .kwargs(request.getKwargs() != null ? new LinkedHashMap<>(request.getKwargs()) : new LinkedHashMap<>())
                .queue(request.getQueue())
                .resultTtl(request.getResultTtl())
                .retry(request.getRetry())
                .paused(request.isPaused())
                .status(ScheduleStatus.ACTIVE)
                .conflictPolicy(policy)
                .createdAt(existing.map(Schedule::getCreatedAt).orElse(now))
                .updatedAt(now)
                .nextFireTime(nextFireTime)
                .repeat(request.getRepeat())
                .build();

        jobStore.saveSchedule(schedule);
        log.info("Added schedule {} for {} ({}), next fire time {}", scheduleId, schedule.getFunction(),
                trigger.describe(), nextFireTime);
        return scheduleId;
    }

    // === Queries ===

    public Optional<Schedule> getSchedule(String scheduleId) {
        return jobStore.findSchedule(scheduleId);
    }

    public List<Schedule> getSchedules() {
        return jobStore.findSchedules();
    }

    public List<String> scheduleIds() {
        return jobStore.scheduleIds();
    }

    // === Lifecycle ===

    /**
     * Stop a schedule from firing while keeping its record and history.
     *
     * @return false if the schedule is unknown or no longer active
     */
    public boolean cancelSchedule(String scheduleId) {
        var schedule = jobStore.findSchedule(scheduleId).orElse(null);
        if (schedule == null || schedule.getStatus() != ScheduleStatus.ACTIVE) {
            return false;
        }
        schedule.setStatus(ScheduleStatus.CANCELLED);
        schedule.setNextFireTime(null);
        schedule.setUpdatedAt(clock.instant());
        jobStore.saveSchedule(schedule);
        log.info("Cancelled schedule {}", scheduleId);
        return true;
    }

    /**
     * Remove a schedule and its history. Jobs it already emitted are kept.
     *
     * @return false if the schedule is unknown
     */
    public boolean deleteSchedule(String scheduleId) {
        var deleted = jobStore.deleteSchedule(scheduleId);
        if (deleted) {
            log.info("Deleted schedule {}", scheduleId);
        }
        return deleted;
    }

    /**
     * @return false if the schedule is unknown, not active or already paused
     */
    public boolean pauseSchedule(String scheduleId) {
        requirePauseSupport();
        var schedule = jobStore.findSchedule(scheduleId).orElse(null);
        if (schedule == null || schedule.getStatus() != ScheduleStatus.ACTIVE || schedule.isPaused()) {
            return false;
        }
        schedule.setPaused(true);
        schedule.setUpdatedAt(clock.instant());
        jobStore.saveSchedule(schedule);
        log.info("Paused schedule {}", scheduleId);
        return true;
    }

    /**
     * Resume a paused schedule. The next fire time is computed from now, so firings
     * missed while paused are skipped.
     *
     * @return false if the schedule is unknown, not active or not paused
     */
    public boolean resumeSchedule(String scheduleId) {
        requirePauseSupport();
        var schedule = jobStore.findSchedule(scheduleId).orElse(null);
        if (schedule == null || schedule.getStatus() != ScheduleStatus.ACTIVE || !schedule.isPaused()) {
            return false;
        }
        var now = clock.instant();
        schedule.setPaused(false);
        schedule.setUpdatedAt(now);
        var next = schedule.getTrigger().nextFireTime(now);
        if (next.isPresent()) {
            schedule.setNextFireTime(next.get());
            log.info("Resumed schedule {}, next fire time {}", scheduleId, next.get());
        } else {
            schedule.setNextFireTime(null);
            schedule.setStatus(ScheduleStatus.COMPLETED);
            log.info("Resumed schedule {} has no further fire times, marking it completed", scheduleId);
        }
        jobStore.saveSchedule(schedule);
        return true;
    }

    public int cancelAllSchedules() {
        return forEachSchedule(this::cancelSchedule, "Cancelled");
    }

    public int deleteAllSchedules() {
        return forEachSchedule(this::deleteSchedule, "Deleted");
    }

    public int pauseAllSchedules() {
        requirePauseSupport();
        return forEachSchedule(this::pauseSchedule, "Paused");
    }

    public int resumeAllSchedules() {
        requirePauseSupport();
        return forEachSchedule(this::resumeSchedule, "Resumed");
    }

    private int forEachSchedule(Predicate<String> action, String verb) {
        var count = 0;
        for (var scheduleId : jobStore.scheduleIds()) {
            if (action.test(scheduleId)) {
                count++;
            }
        }
        log.info("{} {} schedules", verb, count);
        return count;
    }

    // === Emission ===

    /**
     * Emit one job from the schedule's template right away, independent of its trigger.
     *
     * @return the emitted job id
     * @throws ScheduleNotFoundException if the schedule does not exist
     */
    public String runScheduleNow(String scheduleId) {
        var schedule = jobStore.findSchedule(scheduleId).orElseThrow(() -> new ScheduleNotFoundException(scheduleId));
        var updated = schedule.copy();
        var jobId = emitJob(updated);
        if (!jobStore.replaceSchedule(schedule, updated)) {
            log.debug("Schedule {} changed while running it now, job {} is not in its history", scheduleId, jobId);
        }
        return jobId;
    }

    /**
     * Submit a job built from the schedule's template and append it to the schedule's
     * history. The caller saves the schedule.
     */
    public String emitJob(Schedule schedule) {
        var submission = JobSubmission.builder()
                .function(schedule.getFunction())
                .args(schedule.getArgs())
                .kwargs(schedule.getKwargs())
                .queue(settingsResolver.resolveQueue(null, schedule.getQueue()))
                .resultTtl(settingsResolver.resolveResultTtl(null, schedule.getResultTtl()))
                .retry(settingsResolver.resolveRetry(null, schedule.getRetry()))
                .scheduleId(schedule.getId())
                .build();
        var jobId = jobQueueService.addJob(submission);

        var history = schedule.getEmittedJobIds() != null ? new ArrayList<>(schedule.getEmittedJobIds()) : new ArrayList<String>();
        history.add(jobId);
        if (history.size() > HISTORY_LIMIT) {
            history.subList(0, history.size() - HISTORY_LIMIT).clear();
        }
        schedule.setEmittedJobIds(history);

        metricsConfig.recordScheduleFired(schedule.getFunction());
        log.info("Schedule {} emitted job {}", schedule.getId(), jobId);
        return jobId;
    }

    private void requirePauseSupport() {
        if (!jobStore.capabilities().isSchedulePause()) {
            throw new UnsupportedBackendOperationException(jobStore.getType().getTag(), "schedule pause");
        }
    }
}
