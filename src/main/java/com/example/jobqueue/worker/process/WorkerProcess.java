package com.example.jobqueue.worker.process;

import java.io.IOException;
import java.time.Duration;

/**
 * Parent's handle on one child worker.
 */
public interface WorkerProcess {

    void send(String line) throws IOException;

    /**
     * @return the next line, or null once the child closed its output
     */
    String receive() throws IOException;

    boolean isAlive();

    /**
     * Close the child's input and wait for it to exit, killing it after the timeout.
     */
    void shutdown(Duration timeout);

    void destroy();
}
