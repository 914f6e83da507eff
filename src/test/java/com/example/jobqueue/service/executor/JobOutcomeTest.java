package com.example.jobqueue.service.executor;

import com.example.jobqueue.domain.enums.JobStatus;
import com.example.jobqueue.domain.model.Job;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("JobOutcome Tests")
class JobOutcomeTest {

    @Test
    @DisplayName("Should create success outcome")
    void shouldCreateSuccessOutcome() {
        var outcome = JobOutcome.success(42, 2);
        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getResult()).isEqualTo(42);
        assertThat(outcome.getAttempts()).isEqualTo(2);
        assertThat(outcome.status()).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("Should capture type, message and stack trace of a local failure")
    void shouldCreateFailureFromThrowable() {
        var error = new IllegalStateException("disk full", new IOException("ENOSPC"));

        var outcome = JobOutcome.failure(error, 3);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getError()).isSameAs(error);
        assertThat(outcome.getErrorType()).isEqualTo("java.lang.IllegalStateException");
        assertThat(outcome.getErrorMessage()).isEqualTo("disk full");
        assertThat(outcome.getErrorStackTrace()).contains("Caused by: java.io.IOException: ENOSPC");
        assertThat(outcome.status()).isEqualTo(JobStatus.FAILED);
    }

    @Test
    @DisplayName("Should create failure reported by a child process")
    void shouldCreateRemoteFailure() {
        var outcome = JobOutcome.failure("com.acme.Boom", "boom", "trace", 1);
        assertThat(outcome.getError()).isNull();
        assertThat(outcome.getErrorType()).isEqualTo("com.acme.Boom");
    }

    @Test
    @DisplayName("Should create cancelled outcome")
    void shouldCreateCancelledOutcome() {
        var outcome = JobOutcome.cancelled();
        assertThat(outcome.isCancelled()).isTrue();
        assertThat(outcome.status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("Should rebuild the outcome of a stored job")
    void shouldRebuildFromJob() {
        var now = Instant.parse("2024-01-01T00:00:00Z");
        var succeeded = Job.builder().id("a").build();
        succeeded.markSucceeded("value", now);
        var failed = Job.builder().id("b").attempts(4).build();
        failed.markFailed("java.lang.RuntimeException", "nope", null, now);
        var cancelled = Job.builder().id("c").build();
        cancelled.markCancelled(now);

        assertThat(JobOutcome.fromJob(succeeded).getResult()).isEqualTo("value");
        assertThat(JobOutcome.fromJob(failed).getAttempts()).isEqualTo(4);
        assertThat(JobOutcome.fromJob(failed).getErrorMessage()).isEqualTo("nope");
        assertThat(JobOutcome.fromJob(cancelled).status()).isEqualTo(JobStatus.CANCELLED);
    }
}
