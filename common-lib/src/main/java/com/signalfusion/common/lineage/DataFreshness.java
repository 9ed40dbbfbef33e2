package com.signalfusion.common.lineage;

import java.time.Duration;
import java.time.Instant;

/**
 * Age bucket of a value relative to when it was recorded.
 *
 * <pre>
 *   REALTIME  &lt; 5 min      FRESH  &lt; 60 min     RECENT &lt; 24 h
 *   DAILY     &lt; 7 days     WEEKLY &lt; 30 days    STALE  otherwise
 *   UNKNOWN   no data timestamp
 * </pre>
 */
public enum DataFreshness {
    REALTIME(30),
    FRESH(25),
    RECENT(20),
    DAILY(15),
    WEEKLY(10),
    STALE(5),
    UNKNOWN(10);

    private final int points;

    DataFreshness(int points) {
        this.points = points;
    }

    public int points() {
        return points;
    }

    public static DataFreshness classify(Instant dataTimestamp, Instant now) {
        if (dataTimestamp == null) return UNKNOWN;
        Duration age = Duration.between(dataTimestamp, now);
        if (age.isNegative()) age = Duration.ZERO;

        if (age.compareTo(Duration.ofMinutes(5)) < 0)  return REALTIME;
        if (age.compareTo(Duration.ofMinutes(60)) < 0) return FRESH;
        if (age.compareTo(Duration.ofHours(24)) < 0)   return RECENT;
        if (age.compareTo(Duration.ofDays(7)) < 0)     return DAILY;
        if (age.compareTo(Duration.ofDays(30)) < 0)    return WEEKLY;
        return STALE;
    }
}
