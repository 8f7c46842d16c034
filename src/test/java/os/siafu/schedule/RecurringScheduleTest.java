package os.siafu.schedule;

import org.junit.jupiter.api.Test;
import os.siafu.ErrorKind;
import os.siafu.SchedulerException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RecurringScheduleTest {

    private final Instant start = Instant.parse("2024-01-01T12:00:00Z");

    @Test
    void advance_relative_to_previous_planned_run() {
        RecurringSchedule schedule = new RecurringSchedule(IntervalRule.secondly(5), start);

        Instant lateTick = start.plus(Duration.ofSeconds(3));
        Optional<Instant> next = schedule.advance(lateTick);

        assertEquals(Optional.of(start.plusSeconds(5)), next);
        assertEquals(Optional.of(start.plusSeconds(5)), schedule.peekNextRun());
        assertEquals(1, schedule.getRunCount());
    }

    @Test
    void be_unbounded_by_default() {
        RecurringSchedule schedule = new RecurringSchedule(IntervalRule.hourly(1), start);

        for (int i = 0; i < 100; i++) {
            schedule.advance(start);
        }

        assertFalse(schedule.getMaxRuns().isPresent());
        assertEquals(Optional.of(start.plus(Duration.ofHours(100))), schedule.peekNextRun());
    }

    @Test
    void stop_after_run_limit() {
        Schedule schedule = new RecurringSchedule(IntervalRule.secondly(1), start).limitRuns(2);

        schedule.advance(start);
        Optional<Instant> afterLimit = schedule.advance(start.plusSeconds(1));
        Optional<Instant> beyondLimit = schedule.advance(start.plusSeconds(2));

        assertEquals(Optional.empty(), afterLimit);
        assertEquals(Optional.empty(), beyondLimit);
        assertEquals(2, schedule.getRunCount());
    }

    @Test
    void use_current_time_for_cron_rules() {
        CronRule everyMinute = new CronRule(CronExpression.parse("0 * * * * *"));
        RecurringSchedule schedule = new RecurringSchedule(everyMinute, start);

        Optional<Instant> next = schedule.advance(Instant.parse("2024-01-01T12:10:30Z"));

        assertEquals(Optional.of(Instant.parse("2024-01-01T12:11:00Z")), next);
    }

    @Test
    void end_when_next_run_can_not_be_computed() {
        RecurringSchedule schedule = new RecurringSchedule(IntervalRule.weekly(1), Instant.MAX.minusSeconds(1));

        SchedulerException exception = assertThrows(SchedulerException.class, () -> schedule.advance(start));

        assertEquals(ErrorKind.TIME_CALCULATION, exception.getKind());
        assertFalse(schedule.peekNextRun().isPresent());
    }

    @Test
    void reject_non_positive_run_limit() {
        RecurringSchedule schedule = new RecurringSchedule(IntervalRule.hourly(1), start);

        assertThrows(SchedulerException.class, () -> schedule.limitRuns(0));
    }
}
