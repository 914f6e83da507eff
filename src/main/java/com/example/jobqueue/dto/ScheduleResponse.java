package com.example.jobqueue.dto;

import com.example.jobqueue.domain.enums.ScheduleStatus;
import com.example.jobqueue.trigger.TriggerType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for schedule details
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private String id;
    private String name;
    private String function;
    private List<Object> args;
    private Map<String, Object> kwargs;
    private String queue;
    private TriggerType triggerType;

    /**
     * Human readable trigger, e.g. "every weekday at 09:00"
     */
    private String trigger;

    private boolean paused;
    private ScheduleStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant nextFireTime;
    private Instant lastFireTime;
    private Integer repeat;
    private List<String> emittedJobIds;
}
