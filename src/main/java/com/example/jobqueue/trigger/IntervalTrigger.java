package com.example.jobqueue.trigger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Fires at {@code start}, then every {@code period}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IntervalTrigger implements Trigger {

    private Duration period;

    private Instant start;

    @Override
    public TriggerType getType() {
        return TriggerType.INTERVAL;
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        if (after.isBefore(start)) {
            return Optional.of(start);
        }
        var periodNanos = period.toNanos();
        var elapsed = Duration.between(start, after).toNanos();
        var periods = elapsed / periodNanos + 1;
        return Optional.of(start.plusNanos(periods * periodNanos));
    }

    @Override
    public String describe() {
        return CronDescriber.describeInterval(period);
    }
}
