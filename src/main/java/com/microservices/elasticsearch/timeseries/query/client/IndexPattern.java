package com.microservices.elasticsearch.timeseries.query.client;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;

import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;

/**
 * Resolves the indices a time range touches. Without an interval the pattern is a plain index name;
 * with one, it is a date pattern such as {@code [logs-]YYYY.MM.DD} where bracketed text is literal.
 * Dates are evaluated in UTC.
 */
public final class IndexPattern {

    public enum Granularity {
        HOURLY(t -> t.truncatedTo(ChronoUnit.HOURS), t -> t.plusHours(1)),
        DAILY(t -> t.truncatedTo(ChronoUnit.DAYS), t -> t.plusDays(1)),
        WEEKLY(t -> t.truncatedTo(ChronoUnit.DAYS).with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)),
                t -> t.plusWeeks(1)),
        MONTHLY(t -> t.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1), t -> t.plusMonths(1)),
        YEARLY(t -> t.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1), t -> t.plusYears(1));

        private final UnaryOperator<ZonedDateTime> truncate;
        private final UnaryOperator<ZonedDateTime> next;

        Granularity(UnaryOperator<ZonedDateTime> truncate, UnaryOperator<ZonedDateTime> next) {
            this.truncate = truncate;
            this.next = next;
        }

        static Granularity fromName(String name) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported index interval: " + name, e);
            }
        }
    }

    private final String pattern;
    private final Granularity granularity;
    private final DateTimeFormatter formatter;

    private IndexPattern(String pattern, Granularity granularity) {
        this.pattern = pattern;
        this.granularity = granularity;
        this.formatter = granularity == null ? null : toFormatter(pattern);
    }

    public static IndexPattern of(String pattern, String interval) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("Index pattern must not be empty");
        }
        if (interval == null || interval.isBlank()) {
            return new IndexPattern(pattern, null);
        }
        return new IndexPattern(pattern, Granularity.fromName(interval));
    }

    public List<String> indices(TimeRange timeRange) {
        if (granularity == null) {
            return List.of(pattern);
        }
        ZonedDateTime end = Instant.ofEpochMilli(timeRange.getTo()).atZone(ZoneOffset.UTC);
        ZonedDateTime cursor = granularity.truncate.apply(Instant.ofEpochMilli(timeRange.getFrom()).atZone(ZoneOffset.UTC));
        Set<String> indices = new LinkedHashSet<>();
        while (!cursor.isAfter(end)) {
            indices.add(formatter.format(cursor));
            cursor = granularity.next.apply(cursor);
        }
        return new ArrayList<>(indices);
    }

    /**
     * Translate the date tokens YYYY, GGGG, MM, WW, DD and HH; everything else is copied literally
     */
    static DateTimeFormatter toFormatter(String pattern) {
        DateTimeFormatterBuilder builder = new DateTimeFormatterBuilder();
        int i = 0;
        while (i < pattern.length()) {
            char c = pattern.charAt(i);
            if (c == '[') {
                int close = pattern.indexOf(']', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unterminated literal in index pattern: " + pattern);
                }
                builder.appendLiteral(pattern.substring(i + 1, close));
                i = close + 1;
            } else if (pattern.startsWith("YYYY", i)) {
                builder.appendValue(ChronoField.YEAR, 4);
                i += 4;
            } else if (pattern.startsWith("GGGG", i)) {
                builder.appendValue(IsoFields.WEEK_BASED_YEAR, 4);
                i += 4;
            } else if (pattern.startsWith("MM", i)) {
                builder.appendValue(ChronoField.MONTH_OF_YEAR, 2);
                i += 2;
            } else if (pattern.startsWith("WW", i)) {
                builder.appendValue(IsoFields.WEEK_OF_WEEK_BASED_YEAR, 2);
                i += 2;
            } else if (pattern.startsWith("DD", i)) {
                builder.appendValue(ChronoField.DAY_OF_MONTH, 2);
                i += 2;
            } else if (pattern.startsWith("HH", i)) {
                builder.appendValue(ChronoField.HOUR_OF_DAY, 2);
                i += 2;
            } else {
                builder.appendLiteral(c);
                i++;
            }
        }
        return builder.toFormatter(Locale.ROOT);
    }
}
