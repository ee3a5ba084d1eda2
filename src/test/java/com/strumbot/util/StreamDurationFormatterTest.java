package com.strumbot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class StreamDurationFormatterTest {

    @Test
    @DisplayName("should pad minutes and seconds")
    void format_ShortDuration_PadsFields() {
        assertThat(StreamDurationFormatter.format(Duration.ofSeconds(65))).isEqualTo("0:01:05");
    }

    @Test
    @DisplayName("should not wrap hours at 24")
    void format_LongDuration_KeepsHours() {
        assertThat(StreamDurationFormatter.format(Duration.ofHours(49).plusMinutes(3))).isEqualTo("49:03:00");
    }

    @Test
    @DisplayName("should drop fractions of a second")
    void format_Fraction_Truncates() {
        assertThat(StreamDurationFormatter.format(Duration.ofMillis(3_599_999))).isEqualTo("0:59:59");
    }

    @Test
    @DisplayName("should clamp negative or missing durations to zero")
    void format_NegativeOrNull_ReturnsZero() {
        assertThat(StreamDurationFormatter.format(Duration.ofSeconds(-5))).isEqualTo("0:00:00");
        assertThat(StreamDurationFormatter.format(null)).isEqualTo("0:00:00");
    }
}
