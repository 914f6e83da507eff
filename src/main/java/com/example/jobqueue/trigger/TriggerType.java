package com.example.jobqueue.trigger;

public enum TriggerType {
    CRON,
    INTERVAL,
    DATE
}
