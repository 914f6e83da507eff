package com.example.jobqueue.retry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BackoffCalculator Tests")
class BackoffCalculatorTest {

    @Test
    @DisplayName("Should double the delay for each attempt without jitter")
    void shouldDoubleDelay() {
        // Given
        var calculator = new BackoffCalculator(() -> 0.0);

        // When / Then
        assertThat(calculator.delayFor(1.0, 0.0, 1)).isEqualTo(Duration.ofSeconds(1));
        assertThat(calculator.delayFor(1.0, 0.0, 2)).isEqualTo(Duration.ofSeconds(2));
        assertThat(calculator.delayFor(1.0, 0.0, 3)).isEqualTo(Duration.ofSeconds(4));
        assertThat(calculator.delayFor(0.5, 0.0, 4)).isEqualTo(Duration.ofSeconds(4));
    }

    @Test
    @DisplayName("Should scale the nominal delay by the jitter sample")
    void shouldApplyJitter() {
        var up = new BackoffCalculator(() -> 1.0);
        var down = new BackoffCalculator(() -> -1.0);

        assertThat(up.delayFor(2.0, 0.5, 1)).isEqualTo(Duration.ofSeconds(3));
        assertThat(down.delayFor(2.0, 0.5, 1)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    @DisplayName("Should never go below zero")
    void shouldClampAtZero() {
        var calculator = new BackoffCalculator(() -> -1.0);

        assertThat(calculator.delayFor(1.0, 1.0, 3)).isEqualTo(Duration.ZERO);
    }

    @RepeatedTest(50)
    @DisplayName("Should stay within the jittered bound")
    void shouldStayWithinBound() {
        var calculator = new BackoffCalculator();
        var policy = RetryPolicy.builder().maxRetries(5).baseDelay(0.2).jitterFactor(0.3).build();

        for (int attempt = 1; attempt <= 5; attempt++) {
            var delay = calculator.delayFor(policy, attempt);
            var upperNanos = (long) (0.2 * Math.pow(2, attempt - 1) * 1.3 * 1_000_000_000L);
            assertThat(delay).isBetween(Duration.ZERO, Duration.ofNanos(upperNanos));
        }
    }

    @Test
    @DisplayName("Should reject attempts below one")
    void shouldRejectAttemptZero() {
        var calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.delayFor(1.0, 0.0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
