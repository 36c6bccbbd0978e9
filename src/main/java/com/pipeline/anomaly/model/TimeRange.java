package com.pipeline.anomaly.model;

import java.io.Serializable;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * 闭区间时间范围 [start, end]
 */
public final class TimeRange implements Serializable {
    private final Instant start;
    private final Instant end;

    public TimeRange(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds must not be null");
        }
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Time range start " + start + " is after end " + end);
        }
        this.start = start;
        this.end = end;
    }

    /**
     * 以当前时刻为终点、向前回溯指定小时数的时间范围。
     *
     * @param clock         时钟
     * @param lookbackHours 回溯小时数，必须 &gt;= 1
     */
    public static TimeRange lookback(Clock clock, int lookbackHours) {
        if (lookbackHours < 1) {
            throw new IllegalArgumentException("Lookback hours must be >= 1, got: " + lookbackHours);
        }
        Instant now = clock.instant();
        return new TimeRange(now.minus(Duration.ofHours(lookbackHours)), now);
    }

    public Instant getStart() { return start; }
    public Instant getEnd() { return end; }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
