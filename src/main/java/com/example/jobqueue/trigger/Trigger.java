package com.example.jobqueue.trigger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;
import java.util.Optional;

/**
 * When a schedule fires. Exactly one of cron, interval or date.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CronTrigger.class, name = "CRON"),
        @JsonSubTypes.Type(value = IntervalTrigger.class, name = "INTERVAL"),
        @JsonSubTypes.Type(value = DateTrigger.class, name = "DATE")
})
public interface Trigger {

    @JsonIgnore
    TriggerType getType();

    /**
     * First fire time strictly after {@code after}, or empty when the trigger is exhausted.
     */
    Optional<Instant> nextFireTime(Instant after);

    /**
     * First fire time for a schedule created at {@code now}; a fire time equal to now counts.
     */
    default Optional<Instant> firstFireTime(Instant now) {
        return nextFireTime(now.minusNanos(1));
    }

    String describe();
}
