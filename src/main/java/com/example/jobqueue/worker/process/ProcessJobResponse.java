package com.example.jobqueue.worker.process;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line written back by a child worker process per request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessJobResponse {

    private String jobId;

    private boolean success;

    private Object result;

    private String errorType;

    private String errorMessage;

    private String errorStackTrace;

    private int attempts;
}
