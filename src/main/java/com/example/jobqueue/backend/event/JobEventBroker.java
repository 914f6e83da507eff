package com.example.jobqueue.backend.event;

import java.time.Duration;

/**
 * Wakes lease loops early when a job becomes available, instead of letting them
 * sleep out the full poll timeout.
 */
public interface JobEventBroker extends AutoCloseable {

    /**
     * Announce that a job was enqueued on {@code queue}.
     */
    void publish(String queue);

    /**
     * Block until an announcement arrives or the timeout passes.
     *
     * @return true when woken by an announcement
     */
    boolean await(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
