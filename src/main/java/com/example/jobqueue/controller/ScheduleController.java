package com.example.jobqueue.controller;

import com.example.jobqueue.dto.AddScheduleRequest;
import com.example.jobqueue.dto.ApiResponse;
import com.example.jobqueue.dto.ScheduleResponse;
import com.example.jobqueue.mapper.JobMapper;
import com.example.jobqueue.service.schedule.ScheduleService;
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
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API controller for schedule operations.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
@Tag(name = "Schedules", description = "APIs for managing cron, interval and date schedules")
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final JobMapper jobMapper;

    // === Registration ===

    @PostMapping
    @Operation(summary = "Add a schedule", description = "Register a schedule that emits jobs from a template")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> addSchedule(@Valid @RequestBody AddScheduleRequest request) {
        log.info("API: Add schedule for function {}", request.getFunction());

        var scheduleId = scheduleService.addSchedule(jobMapper.toScheduleRequest(request));
        var schedule = scheduleService.getSchedule(scheduleId).map(jobMapper::toScheduleResponse)
                .orElseGet(() -> ScheduleResponse.builder().id(scheduleId).function(request.getFunction()).build());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(schedule, "Schedule added successfully"));
    }

    // === Retrieval ===

    @GetMapping
    @Operation(summary = "List schedules")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> getSchedules() {
        return ResponseEntity.ok(ApiResponse.success(jobMapper.toScheduleResponseList(scheduleService.getSchedules())));
    }

    @GetMapping("/ids")
    @Operation(summary = "List schedule ids")
    public ResponseEntity<ApiResponse<List<String>>> getScheduleIds() {
        return ResponseEntity.ok(ApiResponse.success(scheduleService.scheduleIds()));
    }

    @GetMapping("/{scheduleId}")
    @Operation(summary = "Get schedule by ID")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(
            @Parameter(description = "Schedule id") @PathVariable String scheduleId) {
        return scheduleService.getSchedule(scheduleId)
                .map(schedule -> ResponseEntity.ok(ApiResponse.success(jobMapper.toScheduleResponse(schedule))))
                .orElse(ResponseEntity.notFound().build());
    }

    // === Status Management ===

    @PostMapping("/{scheduleId}/cancel")
    @Operation(summary = "Cancel a schedule", description = "Stop firing but keep the schedule and its history")
    public ResponseEntity<ApiResponse<Boolean>> cancelSchedule(@PathVariable String scheduleId) {
        log.info("API: Cancel schedule {}", scheduleId);
        var cancelled = scheduleService.cancelSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(cancelled, cancelled ? "Schedule cancelled" : "Schedule not found or not active"));
    }

    @PostMapping("/{scheduleId}/pause")
    @Operation(summary = "Pause a schedule")
    public ResponseEntity<ApiResponse<Boolean>> pauseSchedule(@PathVariable String scheduleId) {
        log.info("API: Pause schedule {}", scheduleId);
        var paused = scheduleService.pauseSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(paused, paused ? "Schedule paused" : "Schedule not found or not running"));
    }

    @PostMapping("/{scheduleId}/resume")
    @Operation(summary = "Resume a schedule", description = "Resume a paused schedule; missed firings are skipped")
    public ResponseEntity<ApiResponse<Boolean>> resumeSchedule(@PathVariable String scheduleId) {
        log.info("API: Resume schedule {}", scheduleId);
        var resumed = scheduleService.resumeSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(resumed, resumed ? "Schedule resumed" : "Schedule not found or not paused"));
    }

    @PostMapping("/{scheduleId}/run")
    @Operation(summary = "Run a schedule now", description = "Emit one job from the schedule's template immediately")
    public ResponseEntity<ApiResponse<String>> runScheduleNow(@PathVariable String scheduleId) {
        log.info("API: Run schedule {} now", scheduleId);
        var jobId = scheduleService.runScheduleNow(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(jobId, "Job emitted"));
    }

    @DeleteMapping("/{scheduleId}")
    @Operation(summary = "Delete a schedule")
    public ResponseEntity<ApiResponse<Boolean>> deleteSchedule(@PathVariable String scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);
        var deleted = scheduleService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(deleted, deleted ? "Schedule deleted" : "Schedule not found"));
    }

    // === Bulk Operations ===

    @PostMapping("/cancel")
    @Operation(summary = "Cancel all schedules")
    public ResponseEntity<ApiResponse<Integer>> cancelAllSchedules() {
        var count = scheduleService.cancelAllSchedules();
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Cancelled %d schedules", count)));
    }

    @PostMapping("/pause")
    @Operation(summary = "Pause all schedules")
    public ResponseEntity<ApiResponse<Integer>> pauseAllSchedules() {
        var count = scheduleService.pauseAllSchedules();
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Paused %d schedules", count)));
    }

    @PostMapping("/resume")
    @Operation(summary = "Resume all schedules")
    public ResponseEntity<ApiResponse<Integer>> resumeAllSchedules() {
        var count = scheduleService.resumeAllSchedules();
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Resumed %d schedules", count)));
    }

    @DeleteMapping
    @Operation(summary = "Delete all schedules")
    public ResponseEntity<ApiResponse<Integer>> deleteAllSchedules() {
        var count = scheduleService.deleteAllSchedules();
        return ResponseEntity.ok(ApiResponse.success(count, String.format("Deleted %d schedules", count)));
    }
}
