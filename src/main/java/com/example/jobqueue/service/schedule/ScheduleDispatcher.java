package com.example.jobqueue.service.schedule;

import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.store.JobStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires due schedules.
 * <p>
 * Uses ShedLock so only one node dispatches at a time. Each firing first advances the
 * schedule with a conditional store write, so a fire time is claimed once and a pause,
 * cancel or delete that lands concurrently is never overwritten. Firings missed while
 * nobody was dispatching coalesce into one job.
 */
@Slf4j
@Service
public class ScheduleDispatcher {

    static final String LOCK_NAME = "jobQueueScheduleDispatch";

    private static final Duration LOCK_AT_MOST_FOR = Duration.ofMinutes(5);

    private final JobStore jobStore;
    private final ScheduleService scheduleService;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public ScheduleDispatcher(JobStore jobStore, ScheduleService scheduleService,
                              LockingTaskExecutor lockingTaskExecutor, Clock clock) {
        this.jobStore = jobStore;
        this.scheduleService = scheduleService;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.clock = clock;
    }

    /**
     * Dispatch tick run by worker pools started with a scheduler.
     */
    public void dispatchWithLock() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous dispatch cycle still running, skipping");
            return;
        }
        try {
            lockingTaskExecutor.executeWithLock((Runnable) this::dispatchDue,
                    new LockConfiguration(clock.instant(), LOCK_NAME, LOCK_AT_MOST_FOR, Duration.ZERO));
        } catch (RuntimeException e) {
            log.error("Error in schedule dispatch cycle: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Emit one job for every due schedule.
     *
     * @return number of emitted jobs
     */
    public int dispatchDue() {
        var now = clock.instant();
        var due = jobStore.findDueSchedules(now);
        if (due.isEmpty()) {
            return 0;
        }
        log.debug("Found {} due schedules", due.size());

        var fired = 0;
        for (var schedule : due) {
            try {
                if (fire(schedule, now)) {
                    fired++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to fire schedule {}: {}", schedule.getId(), e.getMessage(), e);
            }
        }
        return fired;
    }

    private boolean fire(Schedule schedule, Instant now) {
        var current = jobStore.findSchedule(schedule.getId()).filter(s -> s.isDue(now)).orElse(null);
        if (current == null) {
            log.debug("Schedule {} is no longer due", schedule.getId());
            return false;
        }

        // Claim the fire time before emitting; fails if the schedule was paused, cancelled or deleted since the read
        var advanced = advance(current, now);
        if (!jobStore.replaceSchedule(current, advanced)) {
            log.debug("Schedule {} changed before it could fire, skipping", current.getId());
            return false;
        }

        var withHistory = advanced.copy();
        try {
            scheduleService.emitJob(withHistory);
        } catch (RuntimeException e) {
            if (!jobStore.replaceSchedule(advanced, current)) {
                log.warn("Schedule {} changed while its firing failed, fire time {} is skipped", current.getId(),
                        current.getNextFireTime());
            }
            throw e;
        }
        if (!jobStore.replaceSchedule(advanced, withHistory)) {
            log.debug("Schedule {} changed while firing, keeping that change over the job history", current.getId());
        }
        if (advanced.getStatus() == ScheduleStatus.COMPLETED) {
            log.info("Schedule {} completed", current.getId());
        }
        return true;
    }

    /**
     * The schedule as it is after firing at {@code now}: one repeat used and the next
     * fire time computed, or completed when the trigger or the repeats ran out.
     */
    private Schedule advance(Schedule current, Instant now) {
        var advanced = current.copy();
        advanced.setLastFireTime(now);
        advanced.setUpdatedAt(now);
        if (advanced.getRepeat() != null) {
            advanced.setRepeat(advanced.getRepeat() - 1);
        }

        var next = advanced.getTrigger().nextFireTime(now);
        var repeatsUsedUp = advanced.getRepeat() != null && advanced.getRepeat() <= 0;
        if (next.isEmpty() || repeatsUsedUp) {
            advanced.setNextFireTime(null);
            advanced.setStatus(ScheduleStatus.COMPLETED);
        } else {
            advanced.setNextFireTime(next.get());
        }
        return advanced;
    }
}
