package com.example.jobqueue.service.schedule;

import java.util.Collection;
import java.util.regex.Pattern;

/**
 * Generates schedule ids of the form {@code "{name}-{n}"}.
 */
public final class ScheduleIdGenerator {

    private ScheduleIdGenerator() {
    }

    /**
     * @param name        base name, usually the function name
     * @param existingIds ids already taken
     * @param overwrite   always answer {@code "{name}-1"} so the caller replaces it
     */
    public static String generate(String name, Collection<String> existingIds, boolean overwrite) {
        if (overwrite) {
            return name + "-1";
        }
        var pattern = Pattern.compile(Pattern.quote(name) + "-(\\d+)");
        var max = 0L;
        for (var id : existingIds) {
            var matcher = pattern.matcher(id);
            if (matcher.matches()) {
                try {
                    max = Math.max(max, Long.parseLong(matcher.group(1)));
                } catch (NumberFormatException e) {
                    // too many digits to be one of ours
                    continue;
                }
            }
        }
        return name + "-" + (max + 1);
    }
}
