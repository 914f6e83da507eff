package com.example.jobqueue.trigger;

import com.example.jobqueue.exception.TriggerConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TriggerResolver Tests")
class TriggerResolverTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private final TriggerResolver resolver = new TriggerResolver(Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("Cron")
    class Cron {

        @Test
        @DisplayName("Should split a crontab string into fields")
        void shouldParseCrontab() {
            // When
            var trigger = (CronTrigger) resolver.resolve(TriggerSpec.cron("30 9 * * 1-5"));

            // Then
            assertThat(trigger.getMinute()).isEqualTo("30");
            assertThat(trigger.getHour()).isEqualTo("9");
            assertThat(trigger.getDayOfWeek()).isEqualTo("1-5");
            assertThat(trigger.getZone()).isEqualTo("Z");
        }

        @Test
        @DisplayName("Should default missing fields to any")
        void shouldDefaultFields() {
            // Given
            var spec = TriggerSpec.builder().minute("0").hour("3").build();

            // When
            var trigger = (CronTrigger) resolver.resolve(spec);

            // Then
            assertThat(trigger.getCrontab()).isEqualTo("0 3 * * *");
        }

        @Test
        @DisplayName("Should reject a crontab without five fields")
        void shouldRejectWrongFieldCount() {
            assertThatThrownBy(() -> resolver.resolve(TriggerSpec.cron("0 3 * *")))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("5 fields");
        }

        @Test
        @DisplayName("Should reject a crontab combined with fields")
        void shouldRejectCrontabAndFields() {
            var spec = TriggerSpec.builder().crontab("0 3 * * *").hour("4").build();

            assertThatThrownBy(() -> resolver.resolve(spec)).isInstanceOf(TriggerConfigurationException.class);
        }

        @Test
        @DisplayName("Should reject out-of-range values")
        void shouldRejectInvalidCron() {
            assertThatThrownBy(() -> resolver.resolve(TriggerSpec.cron("0 25 * * *")))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("Invalid cron expression");
        }

        @Test
        @DisplayName("Should reject an unknown zone")
        void shouldRejectUnknownZone() {
            var spec = TriggerSpec.builder().crontab("0 3 * * *").zone("Mars/Olympus").build();

            assertThatThrownBy(() -> resolver.resolve(spec))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("Mars/Olympus");
        }
    }

    @Nested
    @DisplayName("Interval")
    class Interval {

        @Test
        @DisplayName("Should add up all interval parts and start now")
        void shouldSumParts() {
            // Given
            var spec = TriggerSpec.builder().hours(1L).minutes(30L).seconds(15L).build();

            // When
            var trigger = (IntervalTrigger) resolver.resolve(spec);

            // Then
            assertThat(trigger.getPeriod()).isEqualTo(Duration.ofSeconds(5_415));
            assertThat(trigger.getStart()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("Should reject a zero interval")
        void shouldRejectZero() {
            var spec = TriggerSpec.builder().type(TriggerType.INTERVAL).build();

            assertThatThrownBy(() -> resolver.resolve(spec))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("greater than zero");
        }

        @Test
        @DisplayName("Should reject interval parts that overflow a duration")
        void shouldRejectOverflowingParts() {
            var weeks = TriggerSpec.builder().weeks(Long.MAX_VALUE).build();
            var days = TriggerSpec.builder().days(Long.MAX_VALUE).build();

            assertThatThrownBy(() -> resolver.resolve(weeks))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("too large");
            assertThatThrownBy(() -> resolver.resolve(days))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("too large");
        }

        @Test
        @DisplayName("Should reject an interval too long to compute fire times with")
        void shouldRejectIntervalBeyondNanosecondRange() {
            var spec = TriggerSpec.builder().days(200_000L).build();

            assertThatThrownBy(() -> resolver.resolve(spec))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("too large");
        }

        @Test
        @DisplayName("Should accept a long but computable interval")
        void shouldAcceptLongInterval() {
            var trigger = (IntervalTrigger) resolver.resolve(TriggerSpec.builder().weeks(520L).build());

            assertThat(trigger.getPeriod()).isEqualTo(Duration.ofDays(3_640));
            assertThat(trigger.nextFireTime(NOW)).contains(NOW.plus(Duration.ofDays(3_640)));
        }
    }

    @Nested
    @DisplayName("Inference")
    class Inference {

        @Test
        @DisplayName("Should infer a date trigger from its field")
        void shouldInferDate() {
            var at = NOW.plusSeconds(60);

            var trigger = resolver.resolve(TriggerSpec.builder().date(at).build());

            assertThat(trigger).isEqualTo(new DateTrigger(at));
        }

        @Test
        @DisplayName("Should reject more than one trigger kind")
        void shouldRejectAmbiguousSpec() {
            var spec = TriggerSpec.builder().crontab("* * * * *").seconds(5L).build();

            assertThatThrownBy(() -> resolver.resolve(spec))
                    .isInstanceOf(TriggerConfigurationException.class)
                    .hasMessageContaining("Exactly one");
        }

        @Test
        @DisplayName("Should reject an empty spec")
        void shouldRejectEmptySpec() {
            assertThatThrownBy(() -> resolver.resolve(new TriggerSpec()))
                    .isInstanceOf(TriggerConfigurationException.class);
        }

        @Test
        @DisplayName("Should reject a missing spec")
        void shouldRejectNull() {
            assertThatThrownBy(() -> resolver.resolve(null)).isInstanceOf(TriggerConfigurationException.class);
        }
    }
}
