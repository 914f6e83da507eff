package com.example.jobqueue.domain.enums;

/**
 * Schedule states. Pausing is a flag on an ACTIVE schedule, not a status.
 */
public enum ScheduleStatus {
    ACTIVE,
    CANCELLED,
    COMPLETED;

    public boolean isFiring() {
        return this == ACTIVE;
    }
}
