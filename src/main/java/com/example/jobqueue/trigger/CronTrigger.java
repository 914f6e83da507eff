package com.example.jobqueue.trigger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Five-field cron trigger evaluated with Spring's {@link CronExpression} in a fixed zone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CronTrigger implements Trigger {

    @Builder.Default
    private String minute = "*";

    @Builder.Default
    private String hour = "*";

    @Builder.Default
    private String day = "*";

    @Builder.Default
    private String month = "*";

    @Builder.Default
    private String dayOfWeek = "*";

    /**
     * Zone id the fields are interpreted in
     */
    private String zone;

    @Override
    public TriggerType getType() {
        return TriggerType.CRON;
    }

    @JsonIgnore
    public String getCrontab() {
        return String.join(" ", minute, hour, day, month, dayOfWeek);
    }

    @Override
    public Optional<Instant> nextFireTime(Instant after) {
        var zoneId = zone != null ? ZoneId.of(zone) : ZoneId.systemDefault();
        var next = expression().next(after.atZone(zoneId));
        return Optional.ofNullable(next).map(n -> n.toInstant());
    }

    @Override
    public String describe() {
        return CronDescriber.describe(minute, hour, day, month, dayOfWeek);
    }

    /**
     * Parse the fields as a Spring cron expression, seconds pinned to zero.
     *
     * @throws IllegalArgumentException if a field is malformed
     */
    CronExpression expression() {
        return CronExpression.parse("0 " + getCrontab());
    }
}
