package com.example.jobqueue.backend.event;

import java.time.Duration;

/**
 * In-process broker: a generation counter guarded by this object's monitor.
 */
public class LocalEventBroker implements JobEventBroker {

    private long generation;

    @Override
    public void publish(String queue) {
        signal();
    }

    public synchronized void signal() {
        generation++;
        notifyAll();
    }

    @Override
    public synchronized boolean await(Duration timeout) throws InterruptedException {
        var seen = generation;
        var deadline = System.nanoTime() + timeout.toNanos();
        while (generation == seen) {
            var remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            wait(remaining / 1_000_000L, (int) (remaining % 1_000_000L));
        }
        return true;
    }

    @Override
    public synchronized void close() {
        notifyAll();
    }
}
