package com.example.jobqueue.exception;

import lombok.Getter;

/**
 * Exception for schedule not found
 */
@Getter
public class ScheduleNotFoundException extends RuntimeException {

    private final String scheduleId;

    public ScheduleNotFoundException(String scheduleId) {
        super("Schedule not found: " + scheduleId);
        this.scheduleId = scheduleId;
    }
}
