package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for a job referring to a function nobody registered
 */
@Getter
public class UnknownJobFunctionException extends RuntimeException {

    private final String function;

    public UnknownJobFunctionException(String function) {
        super("No job function registered under name: " + function);
        this.function = function;
    }
}
