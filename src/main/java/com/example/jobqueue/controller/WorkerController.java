package com.example.jobqueue.controller;

import com.example.jobqueue.config.JobQueueProperties;
import com.example.jobqueue.domain.enums.ExecutorKind;
import com.example.jobqueue.dto.ApiResponse;
import com.example.jobqueue.dto.WorkerStatusResponse;
import com.example.jobqueue.worker.WorkerSupervisor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API controller for the worker pool of this node.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/workers")
@Tag(name = "Workers", description = "APIs for starting and stopping the local worker pool")
public class WorkerController {

    private final WorkerSupervisor workerSupervisor;
    private final JobQueueProperties properties;

    @GetMapping
    @Operation(summary = "Worker pool status")
    public ResponseEntity<ApiResponse<WorkerStatusResponse>> getStatus() {
        return ResponseEntity.ok(ApiResponse.success(currentStatus()));
    }

    @PostMapping("/start")
    @Operation(summary = "Start the worker pool", description = "Start a background worker pool on this node")
    public ResponseEntity<ApiResponse<WorkerStatusResponse>> start(
            @Parameter(description = "Number of slots") @RequestParam(required = false) Integer numWorkers,
            @Parameter(description = "thread, process or fiber") @RequestParam(required = false) String kind,
            @Parameter(description = "Also dispatch schedules") @RequestParam(required = false) Boolean withScheduler)
            throws InterruptedException {
        log.info("API: Start worker pool");

        workerSupervisor.startWorkerPool(
                numWorkers != null ? numWorkers : properties.getNumWorkers(),
                ExecutorKind.fromValue(kind != null ? kind : properties.getDefaultJobExecutor()),
                true,
                withScheduler != null ? withScheduler : properties.getWorker().isWithScheduler());
        return ResponseEntity.ok(ApiResponse.success(currentStatus(), "Worker pool started"));
    }

    @PostMapping("/stop")
    @Operation(summary = "Stop the worker pool", description = "Stop leasing and wait for running jobs up to the grace period")
    public ResponseEntity<ApiResponse<WorkerStatusResponse>> stop() {
        log.info("API: Stop worker pool");

        workerSupervisor.stopWorkerPool();
        return ResponseEntity.ok(ApiResponse.success(currentStatus(), "Worker pool stopped"));
    }

    private WorkerStatusResponse currentStatus() {
        return workerSupervisor.currentPool()
                .map(pool -> WorkerStatusResponse.builder()
                        .running(pool.isRunning())
                        .workerId(pool.getWorkerId())
                        .kind(pool.getEngine().getKind())
                        .slots(pool.getEngine().getSlots())
                        .withScheduler(pool.isWithScheduler())
                        .build())
                .orElseGet(() -> WorkerStatusResponse.builder().running(false).build());
    }
}
