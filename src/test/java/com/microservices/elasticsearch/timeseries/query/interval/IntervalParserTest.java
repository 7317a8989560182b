package com.microservices.elasticsearch.timeseries.query.interval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import com.microservices.elasticsearch.timeseries.query.exception.QueryParseException;

class IntervalParserTest {

    @Test
    void testParse_ShouldSupportEveryUnit() {
        assertThat(IntervalParser.parse("250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(IntervalParser.parse("10s")).isEqualTo(Duration.ofSeconds(10));
        assertThat(IntervalParser.parse("5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(IntervalParser.parse("2h")).isEqualTo(Duration.ofHours(2));
        assertThat(IntervalParser.parse("1d")).isEqualTo(Duration.ofDays(1));
        assertThat(IntervalParser.parse("1w")).isEqualTo(Duration.ofDays(7));
        assertThat(IntervalParser.parse("1M")).isEqualTo(Duration.ofDays(30));
        assertThat(IntervalParser.parse("1y")).isEqualTo(Duration.ofDays(365));
    }

    @Test
    void testParse_WithCompoundAndFractionalClockUnits_ShouldSumComponents() {
        assertThat(IntervalParser.parse("1h30m")).isEqualTo(Duration.ofMinutes(90));
        assertThat(IntervalParser.parse("1.5h")).isEqualTo(Duration.ofMinutes(90));
        assertThat(IntervalParser.parse("2m30.5s")).isEqualTo(Duration.ofMillis(150_500));
        assertThat(IntervalParser.parse(".5s")).isEqualTo(Duration.ofMillis(500));
        assertThat(IntervalParser.parse("500us")).isEqualTo(Duration.ofNanos(500_000));
        assertThat(IntervalParser.parse("2\u00b5s")).isEqualTo(Duration.ofNanos(2_000));
        assertThat(IntervalParser.parse("750ns")).isEqualTo(Duration.ofNanos(750));
        assertThat(IntervalParser.parse("1s500ms")).isEqualTo(Duration.ofMillis(1_500));
        assertThat(IntervalParser.parse("0")).isEqualTo(Duration.ZERO);
    }

    @Test
    void testParse_WithGarbage_ShouldThrow() {
        assertThatThrownBy(() -> IntervalParser.parse("ten seconds"))
                .isInstanceOf(QueryParseException.class)
                .hasMessageContaining("ten seconds");
        assertThatThrownBy(() -> IntervalParser.parse("1.5d")).isInstanceOf(QueryParseException.class);
        assertThatThrownBy(() -> IntervalParser.parse("1h 30m")).isInstanceOf(QueryParseException.class);
        assertThatThrownBy(() -> IntervalParser.parse("")).isInstanceOf(QueryParseException.class);
        assertThatThrownBy(() -> IntervalParser.parse("10")).isInstanceOf(QueryParseException.class);
    }

    @Test
    void testMinInterval_ShouldFallBackFromQueryToDatasourceToDefault() {
        Duration fallback = IntervalParser.DEFAULT_MIN_INTERVAL;

        assertThat(IntervalParser.minInterval("1m", "10s", fallback)).isEqualTo(Duration.ofMinutes(1));
        assertThat(IntervalParser.minInterval("", "10s", fallback)).isEqualTo(Duration.ofSeconds(10));
        assertThat(IntervalParser.minInterval(null, "", fallback)).isEqualTo(Duration.ofSeconds(5));
        assertThat(IntervalParser.minInterval(">30s", null, fallback)).isEqualTo(Duration.ofSeconds(30));
        assertThat(IntervalParser.minInterval("15", null, fallback)).isEqualTo(Duration.ofSeconds(15));
        assertThat(IntervalParser.minInterval(">1h30m", null, fallback)).isEqualTo(Duration.ofMinutes(90));
        assertThat(IntervalParser.minInterval("", "1.5h", fallback)).isEqualTo(Duration.ofMinutes(90));
        assertThat(IntervalParser.minInterval("500us", null, fallback)).isEqualTo(Duration.ofNanos(500_000));
    }

    @Test
    void testFormat_ShouldUseLargestWholeUnit() {
        assertThat(IntervalParser.format(Duration.ofMillis(500))).isEqualTo("500ms");
        assertThat(IntervalParser.format(Duration.ofMillis(1_500))).isEqualTo("1s");
        assertThat(IntervalParser.format(Duration.ofMinutes(2))).isEqualTo("2m");
        assertThat(IntervalParser.format(Duration.ofHours(12))).isEqualTo("12h");
        assertThat(IntervalParser.format(Duration.ofDays(30))).isEqualTo("30d");
        assertThat(IntervalParser.format(Duration.ofDays(365))).isEqualTo("1y");
        assertThat(IntervalParser.format(Duration.ZERO)).isEqualTo("1ms");
    }
}
