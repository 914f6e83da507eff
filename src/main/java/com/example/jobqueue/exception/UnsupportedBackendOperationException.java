package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for an operation the configured backend cannot perform
 */
@Getter
public class UnsupportedBackendOperationException extends RuntimeException {

    private final String backend;
    private final String operation;

    public UnsupportedBackendOperationException(String backend, String operation) {
        super(String.format("Backend %s does not support %s", backend, operation));
        this.backend = backend;
        this.operation = operation;
    }
}
