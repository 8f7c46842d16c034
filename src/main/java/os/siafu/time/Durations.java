package os.siafu.time;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Human readable durations such as {@code 1h 30m}, {@code 15m} or {@code 2days 500ms}.
 *
 * <p>Weeks, months and years are fixed lengths: 7 days, 30.44 days and 365.25 days. Only {@code M} stands for
 * months; {@code m} is minutes.</p>
 *
 * <p>{@link #formatDuration(Duration)} always writes the canonical short units, so formatting and
 * re-parsing a duration yields an equal value.</p>
 */
public class Durations {

    // 365.25 days and a twelfth of it
    private static final Duration YEAR = Duration.ofSeconds(31_557_600);
    private static final Duration MONTH = Duration.ofSeconds(2_630_016);

    private static final Pattern TERM = Pattern.compile("\\s*(\\d+)\\s*([a-zA-Z]+)\\s*");

    private Durations() {
    }

    public static Duration parseDuration(CharSequence text) {
        if (text == null || text.toString().trim().isEmpty()) {
            throw new DateTimeParseException("Empty duration", text == null ? "" : text, 0);
        }

        Matcher matcher = TERM.matcher(text);
        Duration duration = Duration.ZERO;
        int position = 0;
        while (position < text.length()) {
            if (!matcher.find(position) || matcher.start() != position) {
                throw new DateTimeParseException("Invalid duration", text, position);
            }

            long amount;
            try {
                amount = Long.parseLong(matcher.group(1));
            } catch (NumberFormatException e) {
                throw new DateTimeParseException("Duration amount out of range", text, matcher.start(1), e);
            }

            try {
                duration = duration.plus(unitOf(matcher.group(2), text, matcher.start(2)).multipliedBy(amount));
            } catch (ArithmeticException e) {
                throw new DateTimeParseException("Duration out of range", text, matcher.start(1), e);
            }
            position = matcher.end();
        }
        return duration;
    }

    public static String formatDuration(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Negative durations can not be formatted: " + duration);
        }
        if (duration.isZero()) {
            return "0s";
        }

        long d = duration.toDays();
        long h = duration.toHoursPart();
        long m = duration.toMinutesPart();
        long s = duration.toSecondsPart();
        long nanos = duration.toNanosPart();
        long ms = nanos / 1_000_000;
        long us = (nanos / 1_000) % 1_000;
        long ns = nanos % 1_000;

        List<String> parts = new ArrayList<>();
        append(parts, d, "d");
        append(parts, h, "h");
        append(parts, m, "m");
        append(parts, s, "s");
        append(parts, ms, "ms");
        append(parts, us, "us");
        append(parts, ns, "ns");
        return String.join(" ", parts);
    }

    private static void append(List<String> parts, long value, String unit) {
        if (value != 0) {
            parts.add(value + unit);
        }
    }

    private static Duration unitOf(String unit, CharSequence text, int index) {
        if (unit.equals("M")) {
            return MONTH;
        }
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "y":
            case "year":
            case "years":
                return YEAR;
            case "month":
            case "months":
                return MONTH;
            case "w":
            case "week":
            case "weeks":
                return Duration.ofDays(7);
            case "d":
            case "day":
            case "days":
                return Duration.ofDays(1);
            case "h":
            case "hr":
            case "hrs":
            case "hour":
            case "hours":
                return Duration.ofHours(1);
            case "m":
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                return Duration.ofMinutes(1);
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
                return Duration.ofSeconds(1);
            case "ms":
            case "msec":
            case "millis":
                return Duration.ofMillis(1);
            case "us":
            case "usec":
                return Duration.ofNanos(1_000);
            case "ns":
            case "nsec":
                return Duration.ofNanos(1);
            default:
                throw new DateTimeParseException("Unknown time unit '" + unit + "'", text, index);
        }
    }
}
