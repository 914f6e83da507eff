package com.example.jobqueue.worker.process;

import com.example.jobqueue.domain.model.RetrySettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * One line sent to a child worker process: everything needed to run a job,
 * without any backend details.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessJobRequest {

    private String jobId;

    private String function;

    /**
     * Class the child instantiates through its no-arg constructor
     */
    private String functionClass;

    private List<Object> args;

    private Map<String, Object> kwargs;

    /**
     * Fully resolved retry settings
     */
    private RetrySettings retry;
}
