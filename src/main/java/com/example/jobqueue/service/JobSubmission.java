package com.example.jobqueue.service;

import com.example.jobqueue.domain.model.RetrySettings;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Arguments of {@link JobQueueService#addJob}. Only {@code function} is required.
 */
@Value
@Builder(toBuilder = true)
public class JobSubmission {

    String function;

    List<Object> args;

    Map<String, Object> kwargs;

    /**
     * Absolute start time, wins over {@link #runIn}
     */
    Instant runAt;

    Duration runIn;

    Duration resultTtl;

    String queue;

    String jobId;

    RetrySettings retry;

    /**
     * Set for jobs emitted by a schedule
     */
    String scheduleId;

    public static JobSubmission of(String function, Object... args) {
        return JobSubmission.builder().function(function).args(List.of(args)).build();
    }
}
