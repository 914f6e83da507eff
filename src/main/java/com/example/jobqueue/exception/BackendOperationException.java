package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception wrapping an I/O or driver failure inside a job store
 */
@Getter
public class BackendOperationException extends RuntimeException {

    private final String operation;

    public BackendOperationException(String operation, Throwable cause) {
        super(String.format("Backend operation %s failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }

    public BackendOperationException(String operation, String message) {
        super(String.format("Backend operation %s failed: %s", operation, message));
        this.operation = operation;
    }
}
