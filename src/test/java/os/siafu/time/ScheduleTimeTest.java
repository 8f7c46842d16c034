package os.siafu.time;

import org.junit.jupiter.api.Test;
import os.siafu.ErrorKind;
import os.siafu.SchedulerException;
import os.siafu.utils.TestSystemClock;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScheduleTimeTest {

    private final TestSystemClock systemClock = new TestSystemClock();

    @Test
    void parse_delay() {
        ScheduleTime parsed = ScheduleTime.parse("delay:1h 1m 1s");

        assertEquals(ScheduleTime.delay(Duration.ofSeconds(3661)), parsed);
    }

    @Test
    void parse_delay_in_weeks() {
        assertEquals(ScheduleTime.delay(Duration.ofDays(14)), ScheduleTime.parse("delay:2w"));
    }

    @Test
    void round_trip_delay_through_its_canonical_form() {
        ScheduleTime delay = ScheduleTime.delay(Duration.ofMinutes(90));

        ScheduleTime reparsed = ScheduleTime.parse(delay.toString());

        assertEquals("delay:1h 30m", delay.toString());
        assertEquals(delay, reparsed);
        assertEquals("delay:15m", ScheduleTime.parse("delay:15m").toString());
    }

    @Test
    void round_trip_timestamp_unchanged() {
        String text = "at:2020-01-01T12:34:56Z";

        ScheduleTime parsed = ScheduleTime.parse(text);

        assertInstanceOf(ScheduleTime.At.class, parsed);
        assertEquals(Instant.parse("2020-01-01T12:34:56Z"), ((ScheduleTime.At) parsed).getInstant());
        assertEquals(text, parsed.toString());
    }

    @Test
    void accept_timestamps_with_offset_and_upper_case_tag() {
        ScheduleTime parsed = ScheduleTime.parse("AT: 2020-01-01T14:34:56+02:00");

        assertEquals(ScheduleTime.at(Instant.parse("2020-01-01T12:34:56Z")), parsed);
    }

    @Test
    void resolve_delay_relative_to_clock() {
        Instant now = Instant.parse("2024-03-01T08:00:00Z");
        systemClock.fixedTime(now);

        Instant resolved = ScheduleTime.delay(Duration.ofSeconds(5)).resolve(systemClock);

        assertEquals(now.plusSeconds(5), resolved);
    }

    @Test
    void resolve_at_to_its_instant() {
        Instant instant = Instant.parse("2030-01-01T00:00:00Z");

        assertEquals(instant, ScheduleTime.at(instant).resolve(systemClock));
    }

    @Test
    void report_time_calculation_error_when_delay_overflows() {
        systemClock.fixedTime(Instant.MAX.minusSeconds(1));

        SchedulerException exception = assertThrows(SchedulerException.class,
                () -> ScheduleTime.delay(Duration.ofDays(1)).resolve(systemClock));

        assertEquals(ErrorKind.TIME_CALCULATION, exception.getKind());
    }

    @Test
    void reject_malformed_input_as_invalid_schedule() {
        assertInvalid("", "Invalid format");
        assertInvalid("10s", "Invalid format");
        assertInvalid("foo:10s", "Unknown schedule type tag");
        assertInvalid("delay:abc", "Failed to parse duration");
        assertInvalid("at:abc", "Failed to parse timestamp");
    }

    private static void assertInvalid(String text, String expectedMessage) {
        SchedulerException exception = assertThrows(SchedulerException.class, () -> ScheduleTime.parse(text));
        assertEquals(ErrorKind.INVALID_SCHEDULE, exception.getKind());
        assertTrue(exception.getMessage().contains(expectedMessage), exception.getMessage());
    }
}
