package com.example.jobqueue.controller;

import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.exception.GlobalExceptionHandler;
import com.example.jobqueue.exception.JobFailedException;
import com.example.jobqueue.exception.UnsupportedBackendOperationException;
import com.example.jobqueue.mapper.JobMapper;
import com.example.jobqueue.service.JobQueueService;
import com.example.jobqueue.service.JobSubmission;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobController Tests")
class JobControllerTest {

    @Mock
    private JobQueueService jobQueueService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        var controller = new JobController(jobQueueService, Mappers.getMapper(JobMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("Should map request fields onto the submission")
    void shouldMapSubmission() throws Exception {
        // Given
        when(jobQueueService.addJob(any())).thenReturn("job-1");
        when(jobQueueService.getJob("job-1")).thenReturn(Optional.empty());

        // When
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"function": "echo", "args": [1, "a"], "queue": "high", "runIn": "PT30S",
                                 "jobId": "job-1", "retry": {"maxRetries": 3}}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.data.id").value("job-1"));

        // Then
        var captor = ArgumentCaptor.forClass(JobSubmission.class);
        verify(jobQueueService).addJob(captor.capture());
        var submission = captor.getValue();
        assertThat(submission.getFunction()).isEqualTo("echo");
        assertThat(submission.getArgs()).containsExactly(1, "a");
        assertThat(submission.getQueue()).isEqualTo("high");
        assertThat(submission.getRunIn()).isEqualTo(Duration.ofSeconds(30));
        assertThat(submission.getJobId()).isEqualTo("job-1");
        assertThat(submission.getRetry().getMaxRetries()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should answer 422 when a run job fails")
    void shouldMapJobFailure() throws Exception {
        // Given
        when(jobQueueService.runJob(any()))
                .thenThrow(new JobFailedException("job-2", "java.lang.IllegalStateException", "boom", null));

        // When / Then
        mockMvc.perform(post("/api/v1/jobs/run")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"function\": \"echo\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("Should answer 501 for operations the backend lacks")
    void shouldMapUnsupportedOperation() throws Exception {
        // Given
        when(jobQueueService.getJobs(any()))
                .thenThrow(new UnsupportedBackendOperationException("redis", "list jobs"));

        // When / Then
        mockMvc.perform(get("/api/v1/jobs"))
                .andExpect(status().isNotImplemented());
    }

    @Test
    @DisplayName("Should answer 503 when the backend fails")
    void shouldMapBackendFailure() throws Exception {
        // Given
        when(jobQueueService.jobIds()).thenThrow(new BackendOperationException("list job ids", "connection refused"));

        // When / Then
        mockMvc.perform(get("/api/v1/jobs/ids"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value(containsString("Backend error")));
    }

    @Test
    @DisplayName("Should answer 400 for malformed body")
    void shouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/v1/jobs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"function\": "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(jobQueueService);
    }

    @Test
    @DisplayName("Should return bulk cancel count")
    void shouldReturnBulkCount() throws Exception {
        // Given
        when(jobQueueService.cancelAllJobs("low")).thenReturn(4);

        // When / Then
        mockMvc.perform(post("/api/v1/jobs/cancel").param("queue", "low"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(4))
                .andExpect(jsonPath("$.message").value("Cancelled 4 jobs"));
    }
}
