package com.example.jobqueue.dto;

import com.example.jobqueue.domain.model.RetrySettings;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Request DTO for submitting a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitJobRequest {

    @NotBlank(message = "Function is required")
    private String function;

    private List<Object> args;

    private Map<String, Object> kwargs;

    /**
     * When to run the job, wins over runIn
     */
    private Instant runAt;

    /**
     * Delay before the job runs, ISO-8601 (e.g. PT30S)
     */
    private Duration runIn;

    /**
     * How long a successful result is kept
     */
    private Duration resultTtl;

    private String queue;

    /**
     * Explicit job id (default: random UUID)
     */
    private String jobId;

    private RetrySettings retry;
}
