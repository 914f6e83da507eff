package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for a schedule id that already exists under the EXCEPTION conflict policy
 */
@Getter
public class DuplicateScheduleException extends RuntimeException {

    private final String scheduleId;

    public DuplicateScheduleException(String scheduleId) {
        super(String.format("Schedule %s already exists", scheduleId));
        this.scheduleId = scheduleId;
    }
}
