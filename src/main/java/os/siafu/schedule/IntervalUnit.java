package os.siafu.schedule;

import java.time.Duration;

/**
 * Fixed length units of an {@link IntervalRule}.
 *
 * <p>{@link #MONTHLY} is an approximation of 30 days and does not follow the calendar.</p>
 */
public enum IntervalUnit {
    SECONDLY(Duration.ofSeconds(1)),
    MINUTELY(Duration.ofMinutes(1)),
    HOURLY(Duration.ofHours(1)),
    DAILY(Duration.ofDays(1)),
    WEEKLY(Duration.ofDays(7)),
    MONTHLY(Duration.ofDays(30));

    private final Duration length;

    IntervalUnit(Duration length) {
        this.length = length;
    }

    public Duration getLength() {
        return length;
    }
}
