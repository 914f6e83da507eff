package com.example.jobqueue.trigger;

import com.example.jobqueue.exception.TriggerConfigurationException;
import lombok.RequiredArgsConstructor;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Resolves a {@link TriggerSpec} into a concrete trigger, validating it up front so
 * a bad schedule fails when it is added rather than when it is due.
 */
@RequiredArgsConstructor
public class TriggerResolver {

    private final Clock clock;

    public Trigger resolve(TriggerSpec spec) {
        if (spec == null) {
            throw new TriggerConfigurationException("A trigger is required");
        }
        var type = spec.getType() != null ? spec.getType() : inferType(spec);
        return switch (type) {
            case CRON -> resolveCron(spec);
            case INTERVAL -> resolveInterval(spec);
            case DATE -> resolveDate(spec);
        };
    }

    private TriggerType inferType(TriggerSpec spec) {
        var kinds = new ArrayList<TriggerType>();
        if (spec.hasCronFields()) {
            kinds.add(TriggerType.CRON);
        }
        if (spec.hasIntervalFields()) {
            kinds.add(TriggerType.INTERVAL);
        }
        if (spec.hasDateFields()) {
            kinds.add(TriggerType.DATE);
        }
        if (kinds.size() > 1) {
            throw new TriggerConfigurationException("Exactly one of cron, interval or date may be given, got " + kinds);
        }
        if (kinds.isEmpty()) {
            throw new TriggerConfigurationException("One of cron, interval or date is required");
        }
        return kinds.get(0);
    }

    private CronTrigger resolveCron(TriggerSpec spec) {
        var hasFields = spec.getMinute() != null || spec.getHour() != null || spec.getDay() != null
                || spec.getMonth() != null || spec.getDayOfWeek() != null;
        if (spec.getCrontab() != null && hasFields) {
            throw new TriggerConfigurationException("Specify either a crontab string or cron fields, not both");
        }

        CronTrigger trigger;
        if (spec.getCrontab() != null) {
            var fields = spec.getCrontab().trim().split("\\s+");
            if (fields.length != 5) {
                throw new TriggerConfigurationException(
                        String.format("Crontab '%s' must have 5 fields (minute hour day month day-of-week)", spec.getCrontab()));
            }
            trigger = new CronTrigger(fields[0], fields[1], fields[2], fields[3], fields[4], null);
        } else {
            trigger = new CronTrigger(
                    Objects.requireNonNullElse(spec.getMinute(), "*"),
                    Objects.requireNonNullElse(spec.getHour(), "*"),
                    Objects.requireNonNullElse(spec.getDay(), "*"),
                    Objects.requireNonNullElse(spec.getMonth(), "*"),
                    Objects.requireNonNullElse(spec.getDayOfWeek(), "*"),
                    null);
        }
        trigger.setZone(resolveZone(spec.getZone()));

        try {
            trigger.expression();
        } catch (IllegalArgumentException e) {
            throw new TriggerConfigurationException("Invalid cron expression '" + trigger.getCrontab() + "': " + e.getMessage(), e);
        }
        return trigger;
    }

    private IntervalTrigger resolveInterval(TriggerSpec spec) {
        Duration total;
        try {
            total = Duration.ZERO
                    .plusSeconds(orZero(spec.getInterval()))
                    .plusDays(Math.multiplyExact(orZero(spec.getWeeks()), 7L))
                    .plusDays(orZero(spec.getDays()))
                    .plusHours(orZero(spec.getHours()))
                    .plusMinutes(orZero(spec.getMinutes()))
                    .plusSeconds(orZero(spec.getSeconds()));
        } catch (ArithmeticException e) {
            throw new TriggerConfigurationException("Interval is too large: " + e.getMessage(), e);
        }
        if (total.isZero() || total.isNegative()) {
            throw new TriggerConfigurationException("Interval must be greater than zero but was " + total.toSeconds() + "s");
        }
        var start = clock.instant();
        try {
            // Fire times are computed in nanoseconds from the start
            total.toNanos();
            start.plus(total);
        } catch (ArithmeticException | DateTimeException e) {
            throw new TriggerConfigurationException("Interval of " + total.toSeconds() + "s is too large", e);
        }
        return new IntervalTrigger(total, start);
    }

    private DateTrigger resolveDate(TriggerSpec spec) {
        return new DateTrigger(spec.getDate() != null ? spec.getDate() : clock.instant());
    }

    private String resolveZone(String zone) {
        if (zone == null || zone.isBlank()) {
            return clock.getZone().getId();
        }
        try {
            return ZoneId.of(zone).getId();
        } catch (DateTimeException e) {
            throw new TriggerConfigurationException("Unknown time zone: " + zone, e);
        }
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
