package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for invalid or incomplete backend configuration, raised at construction
 */
@Getter
public class BackendConfigurationException extends RuntimeException {

    private final String backendType;

    public BackendConfigurationException(String backendType, String message) {
        super(String.format("Invalid %s backend configuration: %s", backendType, message));
        this.backendType = backendType;
    }

    public BackendConfigurationException(String backendType, String message, Throwable cause) {
        super(String.format("Invalid %s backend configuration: %s", backendType, message), cause);
        this.backendType = backendType;
    }
}
