package com.example.jobqueue.domain.enums;

/**
 * What to do when a schedule is added under an id that already exists.
 */
public enum ConflictPolicy {

    /**
     * Overwrite the existing schedule.
     */
    REPLACE,

    /**
     * Keep the existing schedule and return its id.
     */
    DO_NOTHING,

    /**
     * Reject the new schedule with a DuplicateScheduleException.
     */
    EXCEPTION
}
