package com.example.jobqueue.service.function;

import java.util.List;
import java.util.Map;

/**
 * Interface for job functions.
 * <p>
 * A job names its function; workers look the function up in the
 * {@link JobFunctionRegistry} and call {@link #run} with the stored arguments.
 * The queue never inspects argument contents, it only serializes them, so they must
 * be JSON friendly for non-memory backends.
 * <p>
 * Implementations should:
 * - Be stateless and thread-safe
 * - Throw on failure; retryable failures are retried per the job's retry settings
 * - Have a public no-arg constructor if they are to run in process worker pools
 */
public interface JobFunction {

    /**
     * Name jobs refer to this function by
     */
    String getName();

    /**
     * Execute the function
     *
     * @param args   positional arguments
     * @param kwargs named arguments
     * @return the job result, may be null
     */
    Object run(List<Object> args, Map<String, Object> kwargs) throws Exception;
}
