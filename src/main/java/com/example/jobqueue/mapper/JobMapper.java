package com.example.jobqueue.mapper;

import com.example.jobqueue.domain.model.Job;
import com.example.jobqueue.domain.model.Schedule;
import com.example.jobqueue.dto.AddScheduleRequest;
import com.example.jobqueue.dto.JobResponse;
import com.example.jobqueue.dto.JobResultResponse;
import com.example.jobqueue.dto.ScheduleResponse;
import com.example.jobqueue.dto.SubmitJobRequest;
import com.example.jobqueue.service.JobResult;
import com.example.jobqueue.service.JobSubmission;
import com.example.jobqueue.service.schedule.ScheduleRequest;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

import java.util.List;

/**
 * MapStruct mapper for converting between domain objects and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface JobMapper {

    /**
     * Convert Job to JobResponse DTO
     */
    JobResponse toResponse(Job job);

    List<JobResponse> toResponseList(List<Job> jobs);

    @Mapping(target = "triggerType", expression = "java(schedule.getTrigger() != null ? schedule.getTrigger().getType() : null)")
    @Mapping(target = "trigger", expression = "java(schedule.getTrigger() != null ? schedule.getTrigger().describe() : null)")
    ScheduleResponse toScheduleResponse(Schedule schedule);

    List<ScheduleResponse> toScheduleResponseList(List<Schedule> schedules);

    @Mapping(target = "jobId", source = "jobId")
    @Mapping(target = "ready", source = "result.ready")
    @Mapping(target = "status", source = "result.status")
    @Mapping(target = "result", source = "result.value")
    @Mapping(target = "errorType", source = "result.errorType")
    @Mapping(target = "errorMessage", source = "result.errorMessage")
    JobResultResponse toResultResponse(String jobId, JobResult result);

    JobSubmission toSubmission(SubmitJobRequest request);

    ScheduleRequest toScheduleRequest(AddScheduleRequest request);
}
