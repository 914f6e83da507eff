package com.example.jobqueue.domain.model;

import com.example.jobqueue.domain.enums.ConflictPolicy;
import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.trigger.Trigger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A recurring or one-shot rule that emits jobs built from its template.
 * <p>
 * Only the schedule registry and the dispatcher's fire bookkeeping mutate schedules.
 */
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {

    private String id;

    /**
     * Base name used for generated ids, defaults to the function name
     */
    private String name;

    private Trigger trigger;

    // Job template
    private String function;

    @Builder.Default
    private List<Object> args = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> kwargs = new LinkedHashMap<>();

    private String queue;

    private Duration resultTtl;

    private RetrySettings retry;

    private boolean paused;

    @Builder.Default
    private ScheduleStatus status = ScheduleStatus.ACTIVE;

    @Builder.Default
    private ConflictPolicy conflictPolicy = ConflictPolicy.DO_NOTHING;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant nextFireTime;

    private Instant lastFireTime;

    /**
     * Remaining firings; null repeats forever
     */
    private Integer repeat;

    @Builder.Default
    private List<String> emittedJobIds = new ArrayList<>();

    public boolean isDue(Instant now) {
        return status.isFiring() && !paused && nextFireTime != null && !nextFireTime.isAfter(now);
    }

    /**
     * Whether {@code other} has the same status, pause flag, next fire time and
     * last modification time. Conditional schedule writes compare on this.
     */
    public boolean hasSameStateAs(Schedule other) {
        return other != null
                && status == other.status
                && paused == other.paused
                && Objects.equals(nextFireTime, other.nextFireTime)
                && Objects.equals(updatedAt, other.updatedAt);
    }

    public Schedule copy() {
        return toBuilder()
                .args(args == null ? new ArrayList<>() : new ArrayList<>(args))
                .kwargs(kwargs == null ? new LinkedHashMap<>() : new LinkedHashMap<>(kwargs))
                .retry(retry == null ? null : retry.copy())
                .emittedJobIds(emittedJobIds == null ? new ArrayList<>() : new ArrayList<>(emittedJobIds))
                .build();
    }
}
