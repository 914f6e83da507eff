package com.example.jobqueue.exception;

/**
 * Exception for trigger specifications that cannot be resolved
 */
public class TriggerConfigurationException extends RuntimeException {

    public TriggerConfigurationException(String message) {
        super(message);
    }

    public TriggerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
