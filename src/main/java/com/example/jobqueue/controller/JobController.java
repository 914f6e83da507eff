package com.example.jobqueue.controller;

import com.example.jobqueue.dto.ApiResponse;
import com.example.jobqueue.dto.JobResponse;
import com.example.jobqueue.dto.JobResultResponse;
import com.example.jobqueue.dto.SubmitJobRequest;
import com.example.jobqueue.mapper.JobMapper;
import com.example.jobqueue.service.JobQueueService;
import com.example.jobqueue.service.JobResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API controller for job operations.
 * <p>
 * Provides endpoints for:
 * - Submitting jobs, or running one and waiting for its result
 * - Retrieving jobs and results
 * - Cancelling, deleting and requeueing jobs
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Jobs", description = "APIs for submitting and managing jobs")
public class JobController {

    private final JobQueueService jobQueueService;
    private final JobMapper jobMapper;

    // === Submission ===

    @PostMapping
    @Operation(summary = "Submit a job", description = "Enqueue a job for immediate or delayed execution")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<JobResponse>> submitJob(@Valid @RequestBody SubmitJobRequest request) {
        log.info("API: Submit job for function {}", request.getFunction());

        var jobId = jobQueueService.addJob(jobMapper.toSubmission(request));
        var job = jobQueueService.getJob(jobId).map(jobMapper::toResponse)
                .orElseGet(() -> JobResponse.builder().id(jobId).function(request.getFunction()).build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(job, "Job submitted successfully"));
    }

    @PostMapping("/run")
    @Operation(summary = "Run a job", description = "Submit a job and wait until it finished; needs a running worker")
    public ResponseEntity<ApiResponse<Object>> runJob(@Valid @RequestBody SubmitJobRequest request) throws InterruptedException {
        log.info("API: Run job for function {}", request.getFunction());

        var result = jobQueueService.runJob(jobMapper.toSubmission(request));
        return ResponseEntity.ok(ApiResponse.success(result, "Job finished"));
    }

    // === Retrieval ===

    @GetMapping
    @Operation(summary = "List jobs", description = "List jobs in submission order, optionally for one queue")
    public ResponseEntity<ApiResponse<List<JobResponse>>> getJobs(
            @Parameter(description = "Queue filter") @RequestParam(required = false) String queue) {

        var jobs = jobMapper.toResponseList(jobQueueService.getJobs(queue));
        return ResponseEntity.ok(ApiResponse.success(jobs));
    }

    @GetMapping("/ids")
    @Operation(summary = "List job ids")
    public ResponseEntity<ApiResponse<List<String>>> getJobIds() {
        return ResponseEntity.ok(ApiResponse.success(jobQueueService.jobIds()));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job id") @PathVariable String jobId) {
        return jobQueueService.getJob(jobId)
                .map(job -> ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(job))))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{jobId}/result")
    @Operation(summary = "Get job result", description = "Result of a job; with wait=true blocks until the job finished")
    public ResponseEntity<ApiResponse<JobResultResponse>> getJobResult(
            @Parameter(description = "Job id") @PathVariable String jobId,
            @Parameter(description = "Wait for the job to finish") @RequestParam(defaultValue = "false") boolean wait)
            throws InterruptedException {

        JobResult result = jobQueueService.getJobResult(jobId, wait);
        var message = result.isReady() ? null : "Job has not finished yet";
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResultResponse(jobId, result), message));
    }

    // === Status Management ===

    @PostMapping("/{jobId}/cancel")
    @Operation(summary = "Cancel a job", description = "Cancel a pending or running job")
    public ResponseEntity<ApiResponse<Boolean>> cancelJob(@Parameter(description = "Job id") @PathVariable String jobId) {
        log.info("API: Cancel job {}", jobId);

        var cancelled = jobQueueService.cancelJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(cancelled, cancelled ? "Job cancelled" : "Job not found or already finished"));
    }

    @PostMapping("/{jobId}/requeue")
    @Operation(summary = "Requeue a job", description = "Put a failed or cancelled job back on its queue")
    public ResponseEntity<ApiResponse<JobResponse>> requeueJob(
            @Parameter(description = "Job id") @PathVariable String jobId,
            @Parameter(description = "Earliest start (default: now)") @RequestParam(required = false) Instant runAt) {
        log.info("API: Requeue job {}", jobId);

        var job = jobQueueService.requeueJob(jobId, runAt);
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toResponse(job), "Job requeued"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job")
    public ResponseEntity<ApiResponse<Boolean>> deleteJob(@Parameter(description = "Job id") @PathVariable String jobId) {
        log.info("API: Delete job {}", jobId);

        var deleted = jobQueueService.deleteJob(jobId);
        return ResponseEntity.ok(ApiResponse.success(deleted, deleted ? "Job deleted" : "Job not found"));
    }

    // === Bulk Operations ===

    @PostMapping("/cancel")
    @Operation(summary = "Cancel all jobs", description = "Cancel every unfinished job, optionally on one queue")
    public ResponseEntity<ApiResponse<Integer>> cancelAllJobs(
            @Parameter(description = "Queue filter") @RequestParam(required = false) String queue) {
        log.info("API: Cancel all jobs{}", queue != null ? " on queue " + queue : "");

        var count = jobQueueService.cancelAllJobs(queue);
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Cancelled %d jobs", count)));
    }

    @DeleteMapping
    @Operation(summary = "Delete all jobs", description = "Delete every job, optionally on one queue")
    public ResponseEntity<ApiResponse<Integer>> deleteAllJobs(
            @Parameter(description = "Queue filter") @RequestParam(required = false) String queue) {
        log.info("API: Delete all jobs{}", queue != null ? " on queue " + queue : "");

        var count = jobQueueService.deleteAllJobs(queue);
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Deleted %d jobs", count)));
    }
}
