package com.example.jobqueue.worker;

import com.example.jobqueue.domain.enums.ExecutorKind;

import java.time.Duration;

/**
 * Slots that lease jobs and run them under one concurrency model.
 */
public interface ExecutionEngine {

    ExecutorKind getKind();

    int getSlots();

    JobLeaser getLeaser();

    void start();

    /**
     * Stop leasing, give in-flight jobs up to {@code gracePeriod} to finish, then
     * terminate whatever is still running.
     */
    void stop(Duration gracePeriod);

    boolean isRunning();
}
