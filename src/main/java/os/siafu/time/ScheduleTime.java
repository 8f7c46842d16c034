package os.siafu.time;

import os.siafu.SchedulerException;
import os.siafu.utils.SystemClock;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;

/**
 * Describes when a schedule starts: either a {@link Delay} relative to the moment the schedule is built,
 * or an absolute instant ({@link At}).
 *
 * <p>The textual form is {@code delay:<duration>} (for example {@code delay:1h 30m}) or
 * {@code at:<RFC3339 timestamp>} (for example {@code at:2025-05-05T12:00:00Z}).</p>
 */
public abstract class ScheduleTime {

    static final String DELAY_TAG = "delay";
    static final String AT_TAG = "at";

    private ScheduleTime() {
    }

    public static ScheduleTime delay(Duration delay) {
        return new Delay(delay);
    }

    public static ScheduleTime at(Instant instant) {
        return new At(instant);
    }

    /**
     * Parses the textual form of a schedule time.
     *
     * @param text {@code delay:<duration>} or {@code at:<timestamp>}
     * @return the parsed schedule time
     * @throws SchedulerException of kind {@code INVALID_SCHEDULE} if the text can not be parsed
     */
    public static ScheduleTime parse(String text) {
        if (text == null) {
            throw SchedulerException.invalidSchedule("Invalid format: expected 'delay:<duration>' or 'at:<timestamp>'");
        }

        int separator = text.indexOf(':');
        if (separator < 0) {
            throw SchedulerException.invalidSchedule("Invalid format: expected 'delay:<duration>' or 'at:<timestamp>'");
        }

        String tag = text.substring(0, separator).trim().toLowerCase(Locale.ROOT);
        String value = text.substring(separator + 1).trim();

        switch (tag) {
            case DELAY_TAG:
                try {
                    return new Delay(Durations.parseDuration(value));
                } catch (DateTimeParseException e) {
                    throw SchedulerException.invalidSchedule("Failed to parse duration '" + value + "'", e);
                }
            case AT_TAG:
                try {
                    return new At(OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
                } catch (DateTimeParseException e) {
                    throw SchedulerException.invalidSchedule("Failed to parse timestamp '" + value + "'", e);
                }
            default:
                throw SchedulerException.invalidSchedule("Unknown schedule type tag '" + tag + "'");
        }
    }

    /**
     * Resolves this schedule time to an absolute instant, using the given clock as "now" for delays.
     *
     * @throws SchedulerException of kind {@code TIME_CALCULATION} if the instant is out of range
     */
    public abstract Instant resolve(SystemClock clock);

    public static final class Delay extends ScheduleTime {

        private final Duration duration;

        Delay(Duration duration) {
            Objects.requireNonNull(duration, "duration");
            if (duration.isNegative()) {
                throw SchedulerException.invalidSchedule("Delay must not be negative: " + duration);
            }
            this.duration = duration;
        }

        public Duration getDuration() {
            return duration;
        }

        @Override
        public Instant resolve(SystemClock clock) {
            try {
                return clock.now().plus(duration);
            } catch (DateTimeException | ArithmeticException e) {
                throw SchedulerException.timeCalculation("Delay of " + duration + " exceeds the supported time range", e);
            }
        }

        @Override
        public String toString() {
            return DELAY_TAG + ":" + Durations.formatDuration(duration);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Delay delay = (Delay) o;
            return duration.equals(delay.duration);
        }

        @Override
        public int hashCode() {
            return Objects.hash(DELAY_TAG, duration);
        }
    }

    public static final class At extends ScheduleTime {

        private final Instant instant;

        At(Instant instant) {
            this.instant = Objects.requireNonNull(instant, "instant");
        }

        public Instant getInstant() {
            return instant;
        }

        @Override
        public Instant resolve(SystemClock clock) {
            return instant;
        }

        @Override
        public String toString() {
            return AT_TAG + ":" + DateTimeFormatter.ISO_INSTANT.format(instant);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            At at = (At) o;
            return instant.equals(at.instant);
        }

        @Override
        public int hashCode() {
            return Objects.hash(AT_TAG, instant);
        }
    }
}
