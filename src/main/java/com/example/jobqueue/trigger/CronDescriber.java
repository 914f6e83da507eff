package com.example.jobqueue.trigger;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns trigger definitions into short English descriptions for listings and logs,
 * e.g. {@code 30 9 15 * *} becomes {@code day 15 of every month at 09:30}.
 * <p>
 * Unrecognized shapes fall back to a field-by-field description; malformed input
 * is echoed back verbatim.
 */
public final class CronDescriber {

    private static final String ANY = "*";

    private static final Map<String, String> DAYS = Map.ofEntries(
            Map.entry("0", "Sunday"), Map.entry("7", "Sunday"), Map.entry("sun", "Sunday"), Map.entry("sunday", "Sunday"),
            Map.entry("1", "Monday"), Map.entry("mon", "Monday"), Map.entry("monday", "Monday"),
            Map.entry("2", "Tuesday"), Map.entry("tue", "Tuesday"), Map.entry("tuesday", "Tuesday"),
            Map.entry("3", "Wednesday"), Map.entry("wed", "Wednesday"), Map.entry("wednesday", "Wednesday"),
            Map.entry("4", "Thursday"), Map.entry("thu", "Thursday"), Map.entry("thursday", "Thursday"),
            Map.entry("5", "Friday"), Map.entry("fri", "Friday"), Map.entry("friday", "Friday"),
            Map.entry("6", "Saturday"), Map.entry("sat", "Saturday"), Map.entry("saturday", "Saturday"));

    private static final Map<String, String> MONTHS = Map.ofEntries(
            Map.entry("1", "January"), Map.entry("jan", "January"),
            Map.entry("2", "February"), Map.entry("feb", "February"),
            Map.entry("3", "March"), Map.entry("mar", "March"),
            Map.entry("4", "April"), Map.entry("apr", "April"),
            Map.entry("5", "May"), Map.entry("may", "May"),
            Map.entry("6", "June"), Map.entry("jun", "June"),
            Map.entry("7", "July"), Map.entry("jul", "July"),
            Map.entry("8", "August"), Map.entry("aug", "August"),
            Map.entry("9", "September"), Map.entry("sep", "September"),
            Map.entry("10", "October"), Map.entry("oct", "October"),
            Map.entry("11", "November"), Map.entry("nov", "November"),
            Map.entry("12", "December"), Map.entry("dec", "December"));

    private CronDescriber() {
    }

    public static String describe(String crontab) {
        var fields = crontab == null ? new String[0] : crontab.trim().split("\\s+");
        if (fields.length != 5) {
            return String.valueOf(crontab);
        }
        return describe(fields[0], fields[1], fields[2], fields[3], fields[4]);
    }

    public static String describe(String minute, String hour, String day, String month, String dayOfWeek) {
        var m = normalize(minute);
        var h = normalize(hour);
        var d = normalize(day);
        var mo = normalize(month);
        var dow = normalize(dayOfWeek);

        try {
            var dateFree = ANY.equals(d) && ANY.equals(mo) && ANY.equals(dow);

            if (ANY.equals(m) && ANY.equals(h) && dateFree) {
                return "every minute";
            }
            if (isStep(m) && ANY.equals(h) && dateFree) {
                return "every " + stepOf(m) + " minutes";
            }
            if (isNumber(m) && isStep(h) && dateFree) {
                var base = "every " + stepOf(h) + " hours";
                return Integer.parseInt(m) == 0 ? base : base + " at minute " + Integer.parseInt(m);
            }
            if (isNumber(m) && ANY.equals(h) && dateFree) {
                return Integer.parseInt(m) == 0 ? "every hour" : "every hour at minute " + Integer.parseInt(m);
            }

            if (isNumber(m) && isNumberList(h)) {
                var time = timePhrase(Integer.parseInt(m), h);
                if (dateFree) {
                    return "every day " + time;
                }
                if (ANY.equals(d) && ANY.equals(mo)) {
                    return isWeekdays(dow) ? "every weekday " + time : "every " + dayNames(dow) + " " + time;
                }
                if (ANY.equals(mo) && ANY.equals(dow)) {
                    return "day " + d + " of every month " + time;
                }
                if (ANY.equals(dow)) {
                    return "on day " + d + " of " + monthNames(mo) + " " + time;
                }
            }

            return fieldByField(m, h, d, mo, dow);
        } catch (RuntimeException e) {
            return String.join(" ", m, h, d, mo, dow);
        }
    }

    public static String describeInterval(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            return "interval";
        }
        var parts = new ArrayList<String>();
        var days = period.toDays();
        var hours = period.toHoursPart();
        var minutes = period.toMinutesPart();
        var seconds = period.toSecondsPart();
        if (days > 0) {
            parts.add(days + "d");
        }
        if (hours > 0) {
            parts.add(hours + "h");
        }
        if (minutes > 0) {
            parts.add(minutes + "m");
        }
        if (seconds > 0 || parts.isEmpty()) {
            parts.add(seconds + "s");
        }
        return "every " + String.join(" ", parts);
    }

    public static String describeDate(Instant at) {
        return "once at " + (at == null ? "now" : at.truncatedTo(ChronoUnit.SECONDS));
    }

    private static String fieldByField(String m, String h, String d, String mo, String dow) {
        var parts = new ArrayList<String>();
        if (!ANY.equals(m)) {
            parts.add("at minute " + m);
        }
        if (!ANY.equals(h)) {
            parts.add("hour " + h);
        }
        if (!ANY.equals(d)) {
            parts.add("day " + d);
        }
        if (!ANY.equals(mo)) {
            parts.add("in " + monthNames(mo));
        }
        if (!ANY.equals(dow)) {
            parts.add("on " + dayNames(dow));
        }
        return parts.isEmpty() ? "every minute" : "runs " + String.join(" ", parts);
    }

    private static String timePhrase(int minute, String hours) {
        var times = Arrays.stream(hours.split(","))
                .map(Integer::parseInt)
                .map(hour -> formatTime(hour, minute))
                .collect(Collectors.joining(", "));
        return "at " + times;
    }

    private static String formatTime(int hour, int minute) {
        if (minute == 0 && hour == 0) {
            return "midnight";
        }
        if (minute == 0 && hour == 12) {
            return "noon";
        }
        return String.format("%02d:%02d", hour, minute);
    }

    static String dayNames(String field) {
        return names(field, DAYS);
    }

    static String monthNames(String field) {
        return names(field, MONTHS);
    }

    private static String names(String field, Map<String, String> lookup) {
        if (field.contains(",")) {
            return Arrays.stream(field.split(","))
                    .map(part -> names(part, lookup))
                    .collect(Collectors.joining(", "));
        }
        if (field.contains("-") && !field.contains("/")) {
            var bounds = field.split("-", 2);
            return lookup.getOrDefault(bounds[0].trim(), bounds[0].trim())
                    + " through " + lookup.getOrDefault(bounds[1].trim(), bounds[1].trim());
        }
        return lookup.getOrDefault(field.trim(), field.trim());
    }

    private static boolean isWeekdays(String dow) {
        return "1-5".equals(dow) || "mon-fri".equals(dow) || "monday-friday".equals(dow);
    }

    private static String normalize(String field) {
        return field == null || field.isBlank() ? ANY : field.trim().toLowerCase(Locale.ROOT);
    }

    private static boolean isStep(String field) {
        return field.startsWith("*/") && isNumber(field.substring(2));
    }

    private static String stepOf(String field) {
        return field.substring(2);
    }

    private static boolean isNumber(String field) {
        return !field.isEmpty() && field.chars().allMatch(Character::isDigit);
    }

    private static boolean isNumberList(String field) {
        return Arrays.stream(field.split(",")).allMatch(CronDescriber::isNumber);
    }
}
