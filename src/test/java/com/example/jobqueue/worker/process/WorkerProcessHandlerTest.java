package com.example.jobqueue.worker.process;

import com.example.jobqueue.domain.model.RetrySettings;
import com.example.jobqueue.retry.BackoffCalculator;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.service.function.EchoFunction;
import com.example.jobqueue.service.function.JobFunction;
import com.example.jobqueue.store.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("WorkerProcessHandler Tests")
class WorkerProcessHandlerTest {

    private JsonCodec codec;
    private WorkerProcessHandler handler;

    @BeforeEach
    void setUp() {
        codec = new JsonCodec();
        handler = new WorkerProcessHandler(codec, new RetryExecutor(new BackoffCalculator(() -> 0.0)));
    }

    private String request(String jobId, Class<? extends JobFunction> type, RetrySettings retry, Object... args) {
        return codec.write(ProcessJobRequest.builder()
                .jobId(jobId)
                .function(jobId + "-fn")
                .functionClass(type.getName())
                .args(List.of(args))
                .kwargs(Map.of())
                .retry(retry)
                .build());
    }

    @Nested
    @DisplayName("Handle Tests")
    class HandleTests {

        @Test
        @DisplayName("Should run function and report its result")
        void shouldRunFunction() {
            // When
            var response = handler.handle(request("job-1", EchoFunction.class, null, "hello", 3));

            // Then
            assertThat(response.isSuccess()).isTrue();
            assertThat(response.getJobId()).isEqualTo("job-1");
            assertThat(response.getAttempts()).isEqualTo(1);
            assertThat(response.getResult()).isInstanceOf(Map.class);
            @SuppressWarnings("unchecked")
            var result = (Map<String, Object>) response.getResult();
            assertThat(result.get("args")).isEqualTo(List.of("hello", 3));
        }

        @Test
        @DisplayName("Should retry failing function and report attempts")
        void shouldRetryFailingFunction() {
            // Given
            var retry = RetrySettings.builder().maxRetries(2).retryDelay(0.001).jitterFactor(0.0).build();

            // When
            var response = handler.handle(request("job-2", FailingFunction.class, retry));

            // Then
            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getAttempts()).isEqualTo(3);
            assertThat(response.getErrorType()).isEqualTo(IllegalStateException.class.getName());
            assertThat(response.getErrorMessage()).isEqualTo(FailingFunction.MESSAGE);
            assertThat(response.getErrorStackTrace()).contains("IllegalStateException");
        }

        @Test
        @DisplayName("Should fail job when function class cannot be loaded")
        void shouldFailUnknownClass() {
            // Given
            var line = codec.write(ProcessJobRequest.builder()
                    .jobId("job-3")
                    .function("missing")
                    .functionClass("com.example.jobqueue.DoesNotExist")
                    .args(List.of())
                    .kwargs(Map.of())
                    .build());

            // When
            var response = handler.handle(line);

            // Then
            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getJobId()).isEqualTo("job-3");
            assertThat(response.getAttempts()).isEqualTo(1);
            assertThat(response.getErrorMessage()).contains("com.example.jobqueue.DoesNotExist");
        }

        @Test
        @DisplayName("Should answer malformed line with failure")
        void shouldRejectMalformedLine() {
            // When
            var response = handler.handle("{not json");

            // Then
            assertThat(response.isSuccess()).isFalse();
            assertThat(response.getJobId()).isNull();
            assertThat(response.getAttempts()).isZero();
        }
    }

    @Nested
    @DisplayName("Serve Tests")
    class ServeTests {

        @Test
        @DisplayName("Should write one response line per request and skip blank lines")
        void shouldServeUntilInputCloses() throws Exception {
            // Given
            var input = request("a", EchoFunction.class, null, 1) + "\n\n"
                    + request("b", FailingFunction.class, null) + "\n";
            var out = new StringWriter();

            // When
            handler.serve(new BufferedReader(new StringReader(input)), out);

            // Then
            var lines = out.toString().split("\n");
            assertThat(lines).hasSize(2);
            var first = codec.read(lines[0], ProcessJobResponse.class);
            var second = codec.read(lines[1], ProcessJobResponse.class);
            assertThat(first.getJobId()).isEqualTo("a");
            assertThat(first.isSuccess()).isTrue();
            assertThat(second.getJobId()).isEqualTo("b");
            assertThat(second.isSuccess()).isFalse();
        }
    }

    /**
     * Always throws; loadable by name like any function a child runs.
     */
    public static class FailingFunction implements JobFunction {

        static final String NAME = "always-fails";
        static final String MESSAGE = "nope";

        @Override
        public String getName() {
            return NAME;
        }

        @Override
        public Object run(List<Object> args, Map<String, Object> kwargs) {
            throw new IllegalStateException(MESSAGE);
        }
    }
}
