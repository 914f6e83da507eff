package com.example.jobqueue.trigger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CronDescriber Tests")
class CronDescriberTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource(delimiter = '|', value = {
            "* * * * *       | every minute",
            "*/15 * * * *    | every 15 minutes",
            "0 */2 * * *     | every 2 hours",
            "0 * * * *       | every hour",
            "0 0 * * *       | every day at midnight",
            "30 9 * * 1-5    | every weekday at 09:30",
            "0 12 * * sun    | every Sunday at noon",
            "30 9 15 * *     | day 15 of every month at 09:30",
            "0 8 1 jan *     | on day 1 of January at 08:00",
            "0 9,17 * * *    | every day at 09:00, 17:00"
    })
    void shouldDescribeCommonShapes(String crontab, String expected) {
        assertThat(CronDescriber.describe(crontab.trim())).isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "not a cron  | not a cron",
            "5-10 * * * *| runs at minute 5-10"
    })
    void shouldFallBackForOtherShapes(String crontab, String expected) {
        assertThat(CronDescriber.describe(crontab.trim())).isEqualTo(expected);
    }
}
