package com.example.jobqueue.trigger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Optional;

/**
 * Fires once at {@code at}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DateTrigger implements Trigger {

    private Instant at;

    @Override
    public TriggerType getType() {
        return TriggerType.DATE;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        return at.isAfter(after) ? Optional.of(at) : Optional.empty();
    }

    /**
     * A date already in the past still fires once, as soon as the dispatcher runs.
     */
    @Override
    public Optional<Instant> firstFireTime(Instant now) {
        return Optional.of(at);
    }

    @Override
    public String describe() {
        return CronDescriber.describeDate(at);
    }
}
