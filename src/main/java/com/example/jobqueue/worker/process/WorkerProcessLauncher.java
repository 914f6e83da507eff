package com.example.jobqueue.worker.process;

import java.io.IOException;

/**
 * Starts child worker processes.
 */
@FunctionalInterface
public interface WorkerProcessLauncher {

    WorkerProcess launch(int slot) throws IOException;
}
