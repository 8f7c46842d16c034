package os.siafu.schedule;

import os.siafu.SchedulerException;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Recurs every {@code multiplier} {@link IntervalUnit units}, counted from the previously planned run.
 */
public final class IntervalRule implements RecurrenceRule {

    private final IntervalUnit unit;
    private final int multiplier;

    public IntervalRule(IntervalUnit unit, int multiplier) {
        this.unit = Objects.requireNonNull(unit, "unit");
        if (multiplier <= 0) {
            throw SchedulerException.invalidSchedule("Interval multiplier must be positive, but was " + multiplier);
        }
        this.multiplier = multiplier;
    }

    public static IntervalRule secondly(int seconds) {
        return new IntervalRule(IntervalUnit.SECONDLY, seconds);
    }

    public static IntervalRule minutely(int minutes) {
        return new IntervalRule(IntervalUnit.MINUTELY, minutes);
    }

    public static IntervalRule hourly(int hours) {
        return new IntervalRule(IntervalUnit.HOURLY, hours);
    }

    public static IntervalRule daily(int days) {
        return new IntervalRule(IntervalUnit.DAILY, days);
    }

    public static IntervalRule weekly(int weeks) {
        return new IntervalRule(IntervalUnit.WEEKLY, weeks);
    }

    public static IntervalRule monthly(int months) {
        return new IntervalRule(IntervalUnit.MONTHLY, months);
    }

    /**
     * Picks the coarsest unit that divides the given interval: days, hours, minutes and finally seconds.
     *
     * @throws SchedulerException of kind {@code INVALID_SCHEDULE} if the interval is not a positive number of whole seconds
     */
    public static IntervalRule of(Duration interval) {
        if (interval.isNegative() || interval.isZero() || interval.getNano() != 0) {
            throw SchedulerException.invalidSchedule("Interval must be a positive number of whole seconds, but was " + interval);
        }

        long seconds = interval.getSeconds();
        if (seconds % 86_400 == 0) {
            return daily(toMultiplier(seconds / 86_400, interval));
        } else if (seconds % 3_600 == 0) {
            return hourly(toMultiplier(seconds / 3_600, interval));
        } else if (seconds % 60 == 0) {
            return minutely(toMultiplier(seconds / 60, interval));
        }
        return secondly(toMultiplier(seconds, interval));
    }

    private static int toMultiplier(long value, Duration interval) {
        if (value > Integer.MAX_VALUE) {
            throw SchedulerException.invalidSchedule("Interval too large: " + interval);
        }
        return (int) value;
    }

    public IntervalUnit getUnit() {
        return unit;
    }

    public int getMultiplier() {
        return multiplier;
    }

    public Duration getStep() {
        return Instants.times(unit.getLength(), multiplier);
    }

    @Override
    public Optional<Instant> next(Instant previous, Instant now) {
        return Optional.of(Instants.plus(previous, getStep()));
    }

    @Override
    public Optional<Instant> defaultFirstRun(Instant now) {
        return Optional.of(Instants.plus(now, getStep()));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IntervalRule that = (IntervalRule) o;
        return multiplier == that.multiplier && unit == that.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(unit, multiplier);
    }

    @Override
    public String toString() {
        return "IntervalRule{" +
                "unit=" + unit +
                ", multiplier=" + multiplier +
                '}';
    }
}
