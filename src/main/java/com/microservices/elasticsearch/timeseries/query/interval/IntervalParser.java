package com.microservices.elasticsearch.timeseries.query.interval;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.microservices.elasticsearch.timeseries.query.exception.QueryParseException;

/**
 * Parses and formats interval strings such as {@code 500ms}, {@code 1h30m}, {@code 1.5h} or {@code 1d}.
 * Calendar-like units (d, w, M, y) take a single whole amount; the clock units ns, us, ms, s, m and h
 * may be fractional and combined.
 */
public final class IntervalParser {
    private IntervalParser() {}

    public static final Duration DEFAULT_MIN_INTERVAL = Duration.ofSeconds(5);

    private static final Pattern CALENDAR_DURATION = Pattern.compile("^(\\d+)([dwMy])$");
    // ms must be tried before m and s
    private static final Pattern CLOCK_COMPONENT = Pattern.compile("(\\d+(?:\\.\\d*)?|\\.\\d+)(ns|us|\u00b5s|\u03bcs|ms|s|m|h)");
    private static final Map<String, Long> CLOCK_UNIT_NANOS = Map.of(
            "ns", 1L,
            "us", 1_000L,
            "\u00b5s", 1_000L,
            "\u03bcs", 1_000L,
            "ms", 1_000_000L,
            "s", 1_000_000_000L,
            "m", 60_000_000_000L,
            "h", 3_600_000_000_000L);
    private static final Pattern PURE_NUMBER = Pattern.compile("^\\d+$");

    private static final Duration DAY = Duration.ofDays(1);
    private static final Duration YEAR = Duration.ofDays(365);

    /**
     * Minimum interval for a query: the query's own interval, else the datasource interval,
     * else {@code defaultInterval}. Bare numbers are seconds.
     */
    public static Duration minInterval(String queryInterval, String datasourceInterval, Duration defaultInterval) {
        String interval = queryInterval;
        if (interval == null || interval.isBlank()) {
            interval = datasourceInterval;
        }
        if (interval == null || interval.isBlank()) {
            return defaultInterval;
        }
        interval = interval.trim().replaceFirst("<", "").replaceFirst(">", "");
        if (PURE_NUMBER.matcher(interval).matches()) {
            interval += "s";
        }
        return parse(interval);
    }

    public static Duration parse(String interval) {
        String text = interval == null ? "" : interval.trim();
        Matcher calendar = CALENDAR_DURATION.matcher(text);
        if (calendar.matches()) {
            long amount = Long.parseLong(calendar.group(1));
            return switch (calendar.group(2)) {
                case "d" -> Duration.ofDays(amount);
                case "w" -> Duration.ofDays(amount * 7);
                case "M" -> Duration.ofDays(amount * 30);
                default -> YEAR.multipliedBy(amount);
            };
        }
        return parseClockDuration(text, interval);
    }

    private static Duration parseClockDuration(String text, String interval) {
        if ("0".equals(text)) {
            return Duration.ZERO;
        }
        Matcher component = CLOCK_COMPONENT.matcher(text);
        BigDecimal nanos = BigDecimal.ZERO;
        int position = 0;
        while (position < text.length()) {
            if (!component.find(position) || component.start() != position) {
                throw new QueryParseException("Invalid interval: " + interval);
            }
            BigDecimal amount = new BigDecimal(component.group(1));
            nanos = nanos.add(amount.multiply(BigDecimal.valueOf(CLOCK_UNIT_NANOS.get(component.group(2)))));
            position = component.end();
        }
        if (position == 0) {
            throw new QueryParseException("Invalid interval: " + interval);
        }
        try {
            return Duration.ofNanos(nanos.toBigInteger().longValueExact());
        } catch (ArithmeticException e) {
            throw new QueryParseException("Invalid interval: " + interval, e);
        }
    }

    /**
     * Largest whole unit representation, truncating the remainder
     */
    public static String format(Duration interval) {
        long millis = interval.toMillis();
        if (interval.compareTo(YEAR) >= 0) {
            return millis / YEAR.toMillis() + "y";
        }
        if (interval.compareTo(DAY) >= 0) {
            return millis / DAY.toMillis() + "d";
        }
        if (millis >= 3_600_000L) {
            return millis / 3_600_000L + "h";
        }
        if (millis >= 60_000L) {
            return millis / 60_000L + "m";
        }
        if (millis >= 1_000L) {
            return millis / 1_000L + "s";
        }
        if (millis >= 1L) {
            return millis + "ms";
        }
        return "1ms";
    }
}
