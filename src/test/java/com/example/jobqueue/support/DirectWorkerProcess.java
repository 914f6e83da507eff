package com.example.jobqueue.support;

import com.example.jobqueue.worker.process.WorkerProcess;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.UnaryOperator;

/**
 * Child worker stand-in that answers each request synchronously in the calling
 * thread, so process engine tests need no second JVM.
 */
public class DirectWorkerProcess implements WorkerProcess {

    private final UnaryOperator<String> responder;
    private final Deque<String> responses = new ArrayDeque<>();
    private volatile boolean alive = true;
    private volatile boolean shutdown;

    /**
     * @param responder maps a request line to a response line, null simulates a crash
     */
    public DirectWorkerProcess(UnaryOperator<String> responder) {
        this.responder = responder;
    }

    @Override
    public synchronized void send(String line) throws IOException {
        if (!alive) {
            throw new IOException("Broken pipe");
        }
        var response = responder.apply(line);
        if (response == null) {
            alive = false;
        } else {
            responses.add(response);
        }
    }

    @Override
    public synchronized String receive() {
        return responses.poll();
    }

    @Override
    public boolean isAlive() {
        return alive;
    }

    @Override
    public void shutdown(Duration timeout) {
        shutdown = true;
        alive = false;
    }

    @Override
    public void destroy() {
        alive = false;
    }

    public boolean wasShutDown() {
        return shutdown;
    }
}
