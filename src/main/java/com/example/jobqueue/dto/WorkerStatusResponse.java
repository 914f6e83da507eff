package com.example.jobqueue.dto;

import com.example.jobqueue.domain.enums.ExecutorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for the worker pool of this node
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WorkerStatusResponse {

    private boolean running;
    private String workerId;
    private ExecutorKind kind;
    private int slots;
    private boolean withScheduler;
}
