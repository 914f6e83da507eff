package com.example.jobqueue.dto;

import com.example.jobqueue.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a job result query
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResultResponse {

    private String jobId;
    private boolean ready;
    private JobStatus status;
    private Object result;
    private String errorType;
    private String errorMessage;
}
