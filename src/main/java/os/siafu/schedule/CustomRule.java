package os.siafu.schedule;

import os.siafu.SchedulerException;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * A named cadence. The names {@code daily}, {@code weekly} and {@code monthly} step 1, 7 and 30 days;
 * any other name steps {@code frequency} days.
 */
public final class CustomRule implements RecurrenceRule {

    static final Duration DEFAULT_FIRST_RUN_OFFSET = Duration.ofMinutes(1);

    private final String name;
    private final int frequency;

    public CustomRule(String name, int frequency) {
        this.name = Objects.requireNonNull(name, "name");
        this.frequency = frequency;
        if (knownDays(name) == null && frequency <= 0) {
            throw SchedulerException.invalidSchedule("Frequency of custom cadence '" + name + "' must be positive, but was " + frequency);
        }
    }

    public String getName() {
        return name;
    }

    public int getFrequency() {
        return frequency;
    }

    public Duration getStep() {
        Integer days = knownDays(name);
        return Instants.times(Duration.ofDays(1), days != null ? days : frequency);
    }

    @Override
    public Optional<Instant> next(Instant previous, Instant now) {
        return Optional.of(Instants.plus(previous, getStep()));
    }

    @Override
    public Optional<Instant> defaultFirstRun(Instant now) {
        return Optional.of(Instants.plus(now, DEFAULT_FIRST_RUN_OFFSET));
    }

    private static Integer knownDays(String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "daily":
                return 1;
            case "weekly":
                return 7;
            case "monthly":
                return 30;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CustomRule that = (CustomRule) o;
        return frequency == that.frequency && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, frequency);
    }

    @Override
    public String toString() {
        return "CustomRule{" +
                "name='" + name + '\'' +
                ", frequency=" + frequency +
                '}';
    }
}
