package com.example.jobqueue.dto;

import com.example.jobqueue.domain.enums.ConflictPolicy;
import com.example.jobqueue.domain.model.RetrySettings;
import com.example.jobqueue.trigger.TriggerSpec;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for adding a schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddScheduleRequest {

    @NotBlank(message = "Function is required")
    private String function;

    private List<Object> args;

    private Map<String, Object> kwargs;

    @NotNull(message = "Trigger is required")
    private TriggerSpec trigger;

    private String scheduleId;

    private String name;

    private boolean overwrite;

    private ConflictPolicy conflictPolicy;

    private String queue;

    private Duration resultTtl;

    private RetrySettings retry;

    @Min(value = 1, message = "Repeat must be at least 1")
    private Integer repeat;

    private boolean paused;
}
