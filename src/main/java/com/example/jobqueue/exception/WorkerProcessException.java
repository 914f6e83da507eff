package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for a child worker process that crashed or broke the message protocol
 */
@Getter
public class WorkerProcessException extends RuntimeException {

    private final int slot;

    public WorkerProcessException(int slot, String message) {
        super(String.format("Worker process in slot %d: %s", slot, message));
        this.slot = slot;
    }

    public WorkerProcessException(int slot, String message, Throwable cause) {
        super(String.format("Worker process in slot %d: %s", slot, message), cause);
        this.slot = slot;
    }
}
