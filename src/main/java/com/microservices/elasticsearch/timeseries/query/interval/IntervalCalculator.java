package com.microservices.elasticsearch.timeseries.query.interval;

import java.time.Duration;

import org.springframework.stereotype.Component;

import com.microservices.elasticsearch.timeseries.query.dto.TimeRange;

/**
 * Derives the bucket interval for a panel from its time span and resolution, rounded to a
 * readable step and never finer than the minimum interval.
 */
@Component
public class IntervalCalculator {

    public static final long DEFAULT_RESOLUTION = 1500;

    // upper bound (inclusive) of the raw interval -> rounded interval, both in milliseconds
    private static final long[][] ROUNDING = {
            {10L, 1L},
            {15L, 10L},
            {35L, 20L},
            {75L, 50L},
            {150L, 100L},
            {350L, 200L},
            {750L, 500L},
            {1_500L, 1_000L},
            {3_500L, 2_000L},
            {7_500L, 5_000L},
            {12_500L, 10_000L},
            {17_500L, 15_000L},
            {25_000L, 20_000L},
            {45_000L, 30_000L},
            {90_000L, 60_000L},
            {210_000L, 120_000L},
            {450_000L, 300_000L},
            {750_000L, 600_000L},
            {1_050_000L, 900_000L},
            {1_500_000L, 1_200_000L},
            {2_700_000L, 1_800_000L},
            {5_400_000L, 3_600_000L},
            {9_000_000L, 7_200_000L},
            {16_200_000L, 10_800_000L},
            {32_400_000L, 21_600_000L},
            {86_400_000L, 43_200_000L},
            {172_800_000L, 86_400_000L},
            {604_800_000L, 86_400_000L},
            {1_814_400_000L, 604_800_000L},
    };
    private static final long THIRTY_DAYS = 2_592_000_000L;
    private static final long SIX_WEEKS = 3_628_800_000L;
    private static final long ONE_YEAR = 31_536_000_000L;

    public Interval calculate(TimeRange timeRange, Duration minInterval, long maxDataPoints) {
        long resolution = maxDataPoints > 0 ? maxDataPoints : DEFAULT_RESOLUTION;
        Duration calculated = Duration.ofMillis(timeRange.durationMillis()).dividedBy(resolution);
        if (calculated.compareTo(minInterval) < 0) {
            return Interval.of(minInterval);
        }
        return Interval.of(Duration.ofMillis(round(calculated)));
    }

    static long round(Duration interval) {
        long nanos = interval.toNanos();
        for (long[] step : ROUNDING) {
            if (nanos <= step[0] * 1_000_000L) {
                return step[1];
            }
        }
        return nanos < SIX_WEEKS * 1_000_000L ? THIRTY_DAYS : ONE_YEAR;
    }
}
