package com.example.jobqueue.dto;

import com.example.jobqueue.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for job details
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private String id;
    private String function;
    private List<Object> args;
    private Map<String, Object> kwargs;
    private String queue;
    private JobStatus status;
    private Instant createdAt;
    private Instant scheduledFor;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant expiresAt;
    private Object result;
    private String errorType;
    private String errorMessage;
    private int attempts;
    private String scheduleId;
    private String workerId;
}
