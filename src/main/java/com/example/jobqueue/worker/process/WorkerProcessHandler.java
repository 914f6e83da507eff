package com.example.jobqueue.worker.process;

import com.example.jobqueue.exception.BackendOperationException;
import com.example.jobqueue.retry.RetryExecutor;
import com.example.jobqueue.service.SettingsResolver;
import com.example.jobqueue.service.executor.JobOutcome;
import com.example.jobqueue.service.function.JobFunction;
import com.example.jobqueue.store.JsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.ClassUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Child side of the process protocol: reads one request per line, runs it under its
 * retry policy and writes one response per line until the input closes.
 */
@Slf4j
@RequiredArgsConstructor
public class WorkerProcessHandler {

    private final JsonCodec jsonCodec;
    private final RetryExecutor retryExecutor;

    private final Map<String, JobFunction> functions = new ConcurrentHashMap<>();

    public void serve(BufferedReader in, Writer out) throws IOException {
        String line;
        while ((line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            var response = handle(line);
            String encoded;
            try {
                encoded = jsonCodec.write(response);
            } catch (BackendOperationException e) {
                log.error("Result of job {} is not serializable: {}", response.getJobId(), e.getMessage());
                encoded = jsonCodec.write(failure(response.getJobId(), e, response.getAttempts()));
            }
            out.write(encoded);
            out.write('\n');
            out.flush();
        }
        log.debug("Input closed, worker process exiting");
    }

    ProcessJobResponse handle(String line) {
        ProcessJobRequest request;
        try {
            request = jsonCodec.read(line, ProcessJobRequest.class);
        } catch (BackendOperationException e) {
            log.error("Malformed request: {}", e.getMessage());
            return failure(null, e, 0);
        }

        log.info("Running job {} ({})", request.getJobId(), request.getFunction());
        var attempts = new AtomicInteger();
        try {
            var function = functions.computeIfAbsent(request.getFunctionClass(), WorkerProcessHandler::instantiate);
            var policy = SettingsResolver.toPolicy(request.getRetry());
            var result = retryExecutor.execute("job " + request.getJobId(), policy, () -> {
                attempts.incrementAndGet();
                return function.run(request.getArgs(), request.getKwargs());
            });
            return ProcessJobResponse.builder()
                    .jobId(request.getJobId())
                    .success(true)
                    .result(result)
                    .attempts(attempts.get())
                    .build();
        } catch (Exception e) {
            log.error("Job {} failed: {}", request.getJobId(), e.getMessage());
            return failure(request.getJobId(), e, Math.max(1, attempts.get()));
        }
    }

    private static ProcessJobResponse failure(String jobId, Throwable error, int attempts) {
        return ProcessJobResponse.builder()
                .jobId(jobId)
                .success(false)
                .errorType(error.getClass().getName())
                .errorMessage(error.getMessage())
                .errorStackTrace(JobOutcome.stackTraceOf(error))
                .attempts(attempts)
                .build();
    }

    private static JobFunction instantiate(String className) {
        try {
            var type = ClassUtils.forName(className, WorkerProcessHandler.class.getClassLoader());
            return (JobFunction) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException | LinkageError | ClassCastException e) {
            throw new IllegalStateException("Cannot instantiate job function " + className, e);
        }
    }
}
