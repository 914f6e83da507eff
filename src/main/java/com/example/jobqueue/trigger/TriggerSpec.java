package com.example.jobqueue.trigger;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Loose trigger description as callers supply it. {@link TriggerResolver} turns it
 * into exactly one {@link Trigger}.
 * <p>
 * The kind is taken from {@code type} when set, otherwise inferred from which
 * fields are present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerSpec {

    private TriggerType type;

    // Cron
    private String crontab;
    private String minute;
    private String hour;
    private String day;
    private String month;
    private String dayOfWeek;

    // Interval, all parts are additive
    private Long interval;
    private Long weeks;
    private Long days;
    private Long hours;
    private Long minutes;
    private Long seconds;

    // Date
    private Instant date;

    /**
     * Zone for cron evaluation, defaults to the system zone
     */
    private String zone;

    public static TriggerSpec cron(String crontab) {
        return TriggerSpec.builder().type(TriggerType.CRON).crontab(crontab).build();
    }

    public static TriggerSpec interval(Duration period) {
        return TriggerSpec.builder().type(TriggerType.INTERVAL).seconds(period.toSeconds()).build();
    }

    public static TriggerSpec date(Instant at) {
        return TriggerSpec.builder().type(TriggerType.DATE).date(at).build();
    }

    boolean hasCronFields() {
        return crontab != null || minute != null || hour != null || day != null || month != null || dayOfWeek != null;
    }

    boolean hasIntervalFields() {
        return interval != null || weeks != null || days != null || hours != null || minutes != null || seconds != null;
    }

    boolean hasDateFields() {
        return date != null;
    }
}
