package com.example.jobqueue.service.schedule;

import com.example.jobqueue.domain.enums.ConflictPolicy;
import com.example.jobqueue.domain.model.RetrySettings;
import com.example.jobqueue.trigger.TriggerSpec;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Arguments of {@link ScheduleService#addSchedule}. {@code function} and {@code trigger} are required.
 */
@Value
@Builder
public class ScheduleRequest {

    String function;

    List<Object> args;

    Map<String, Object> kwargs;

    TriggerSpec trigger;

    /**
     * Explicit id; generated from {@link #name} when absent
     */
    String scheduleId;

    /**
     * Base name for generated ids, defaults to the function name
     */
    String name;

    boolean overwrite;

    /**
     * What to do when {@link #scheduleId} is taken, DO_NOTHING when null
     */
    ConflictPolicy conflictPolicy;

    String queue;

    Duration resultTtl;

    RetrySettings retry;

    /**
     * Number of firings, null for unlimited
     */
    Integer repeat;

    boolean paused;
}
